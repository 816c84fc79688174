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
import histograph.graph.VertexId;

@Command(name = "add-vertex", description = "Add a vertex to a snapshot", mixinStandardHelpOptions = true, footer = {
        "",
        "Examples:",
        "  histo-graph add-vertex 14        Add vertex 14 to the 'current' snapshot"
})
public class AddVertexCommand implements Callable<Integer> {

    @Mixin
    private GlobalOptionsMixin globalOptions;

    @Mixin
    private StoreMixin storeMixin;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<vertexId>", converter = VertexIdConverter.class,
            description = "Id of the vertex to add, an unsigned 64-bit number")
    private VertexId vertex;

    @Override
    public Integer call() throws Exception {
        globalOptions.configureLogging();

        try (StoreSession session = storeMixin.openSession()) {
            DirectedGraph graph = session.load();
            if (graph.addVertex(vertex)) {
                session.save(graph);
            }
        }

        if (globalOptions.isVerbose()) {
            spec.commandLine().getErr().println("Added vertex " + vertex);
        }
        return 0;
    }
}
