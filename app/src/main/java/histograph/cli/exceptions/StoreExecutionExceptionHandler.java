package histograph.cli.exceptions;

import histograph.exceptions.StoreException;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;

/**
 * Custom exception handler for execution exceptions
 */
public class StoreExecutionExceptionHandler implements IExecutionExceptionHandler {

    @Override
    public int handleExecutionException(
            Exception ex,
            CommandLine commandLine,
            CommandLine.ParseResult parseResult) {

        if (ex instanceof StoreException) {
            commandLine.getErr().println("fatal: " + ex.getMessage());
        } else {
            commandLine.getErr().println("error: " + ex.getMessage());
        }

        if (debugRequested(parseResult)) {
            ex.printStackTrace(commandLine.getErr());
        }

        return 1;
    }

    private static boolean debugRequested(CommandLine.ParseResult parseResult) {
        for (CommandLine command : parseResult.asCommandLineList()) {
            if (command.getParseResult() != null && command.getParseResult().hasMatchedOption("--debug")) {
                return true;
            }
        }
        return false;
    }
}
