package histograph.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import histograph.cli.mixins.GlobalOptionsMixin;
import histograph.cli.mixins.StoreMixin;
import histograph.cli.utils.StoreSession;
import histograph.graph.DirectedGraph;

@Command(name = "init", description = "Save an empty graph under the snapshot name", mixinStandardHelpOptions = true, footer = {
        "",
        "Examples:",
        "  histo-graph init                 Start the 'current' snapshot in .store/",
        "  histo-graph init -n draft        Start a snapshot named 'draft'"
})
public class InitCommand implements Callable<Integer> {

    @Mixin
    private GlobalOptionsMixin globalOptions;

    @Mixin
    private StoreMixin storeMixin;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        globalOptions.configureLogging();

        try (StoreSession session = storeMixin.openSession()) {
            session.save(new DirectedGraph());

            if (!globalOptions.isQuiet()) {
                PrintWriter out = spec.commandLine().getOut();
                out.println("Initialized empty graph '" + session.getSnapshotName() + "' in "
                        + session.getStoreDir().toAbsolutePath());
                out.flush();
            }
        }
        return 0;
    }
}
