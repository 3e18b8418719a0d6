package com.tandem.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TandemCommand tandemCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TandemCommand tandemCommand, IFactory factory) {
        this.tandemCommand = tandemCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // The embedded web server keeps the JVM alive in serve mode; picocli would return at once.
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = new CommandLine(tandemCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
