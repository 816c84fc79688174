package histograph.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import histograph.cli.mixins.GlobalOptionsMixin;
import histograph.cli.mixins.StoreMixin;
import histograph.cli.utils.StoreSession;
import histograph.graph.DirectedGraph;
import histograph.graph.Edge;
import histograph.graph.VertexId;

@Command(name = "show", description = "Print the vertices and edges of a snapshot", mixinStandardHelpOptions = true, footer = {
        "",
        "Output format, one item per line:",
        "  vertex <id>",
        "  edge <from> -> <to>"
})
public class ShowCommand implements Callable<Integer> {

    @Mixin
    private GlobalOptionsMixin globalOptions;

    @Mixin
    private StoreMixin storeMixin;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        globalOptions.configureLogging();

        DirectedGraph graph;
        try (StoreSession session = storeMixin.openSession()) {
            graph = session.load();
        }

        Ansi ansi = globalOptions.ansi();
        PrintWriter out = spec.commandLine().getOut();
        for (VertexId vertex : graph.vertices()) {
            out.println(ansi.string("@|bold vertex|@ " + vertex));
        }
        for (Edge edge : graph.edges()) {
            out.println(ansi.string("@|bold edge|@ " + edge.getFrom() + " -> " + edge.getTo()));
        }
        out.flush();
        return 0;
    }
}
