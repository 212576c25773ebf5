package io.provtrack;

import io.provtrack.cli.ProvTrackCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new ProvTrackCommand())
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    log.debug("Command failed", e);
                    commandLine.getErr().println("error: " + e.getMessage());
                    return 1;
                });
    }
}
