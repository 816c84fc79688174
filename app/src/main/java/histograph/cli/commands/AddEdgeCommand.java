package histograph.cli.commands;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import histograph.cli.mixins.GlobalOptionsMixin;
import histograph.cli.mixins.StoreMixin;
import histograph.cli.utils.StoreSession;
import histograph.cli.utils.VertexIdConverter;
import histograph.graph.DirectedGraph;
import histograph.graph.Edge;
import histograph.graph.VertexId;

@Command(name = "add-edge", description = "Add a directed edge to a snapshot", mixinStandardHelpOptions = true, footer = {
        "",
        "Missing endpoints are added as vertices.",
        "",
        "Examples:",
        "  histo-graph add-edge 14 15       Add the edge 14 -> 15 to the 'current' snapshot"
})
public class AddEdgeCommand implements Callable<Integer> {

    @Mixin
    private GlobalOptionsMixin globalOptions;

    @Mixin
    private StoreMixin storeMixin;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<from>", converter = VertexIdConverter.class,
            description = "Id of the source vertex")
    private VertexId from;

    @Parameters(index = "1", paramLabel = "<to>", converter = VertexIdConverter.class,
            description = "Id of the target vertex")
    private VertexId to;

    @Override
    public Integer call() throws Exception {
        globalOptions.configureLogging();

        Edge edge = new Edge(from, to);
        try (StoreSession session = storeMixin.openSession()) {
            DirectedGraph graph = session.load();
            if (graph.addEdge(edge)) {
                session.save(graph);
            }
        }

        if (globalOptions.isVerbose()) {
            spec.commandLine().getErr().println("Added edge " + edge);
        }
        return 0;
    }
}
