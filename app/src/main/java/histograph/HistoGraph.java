package histograph;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import histograph.cli.commands.*;
import histograph.cli.mixins.GlobalOptionsMixin;
import histograph.cli.mixins.VersionProvider;
import histograph.cli.exceptions.StoreExecutionExceptionHandler;
import histograph.cli.exceptions.StoreParameterExceptionHandler;

@Command(name = "histo-graph", description = "Stores directed graphs as content-addressed snapshots", versionProvider = VersionProvider.class, mixinStandardHelpOptions = true, subcommands = {
                InitCommand.class,
                ShowCommand.class,
                AddVertexCommand.class,
                AddEdgeCommand.class,
                CommandLine.HelpCommand.class
}, footer = {
                "",
                "Examples:",
                "  histo-graph init                 Save an empty graph as 'current'",
                "  histo-graph add-vertex 14        Add a vertex",
                "  histo-graph add-edge 14 15       Add an edge",
                "  histo-graph show                 Print the graph",
                "  histo-graph --version            Show version information"
})
public class HistoGraph implements Runnable {
        @Mixin
        private GlobalOptionsMixin globalOptions;

        @Spec
        private CommandSpec spec;

        public static void main(String[] args) {
                int exitCode = createCommandLine().execute(args);
                System.exit(exitCode);
        }

        public static CommandLine createCommandLine() {
                CommandLine commandLine = new CommandLine(new HistoGraph())
                                .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO))
                                .setExecutionExceptionHandler(new StoreExecutionExceptionHandler())
                                .setParameterExceptionHandler(new StoreParameterExceptionHandler())
                                .setUsageHelpAutoWidth(true);

                commandLine.setAbbreviatedSubcommandsAllowed(true);
                commandLine.setAbbreviatedOptionsAllowed(true);
                return commandLine;
        }

        @Override
        public void run() {
                // When no subcommand is specified, show help
                spec.commandLine().usage(spec.commandLine().getOut());
        }
}
