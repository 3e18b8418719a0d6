package com.tandem.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Tandem.
 * Routes to subcommands: serve, status, history, health, token.
 */
@Command(
        name = "tandem",
        mixinStandardHelpOptions = true,
        version = "Tandem 0.1.0",
        description = "Agent/human task handshake service",
        subcommands = {
                ServeCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                TokenCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TandemCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
