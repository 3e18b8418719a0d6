package com.tandem.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: tandem serve
 * <p>
 * Starts the HTTP server exposing the tool endpoint and the human-side REST API.
 * The web server is enabled by {@link com.tandem.TandemApplication#main} detecting
 * "serve" in args, and {@link CliRunner} skips picocli in that mode. The banner is
 * printed once the server reports its port.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Tandem HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Tandem server running on port " + port);
        System.out.println();
        System.out.println("  Tools:   http://localhost:" + port + "/api/v1/tools");
        System.out.println("  Tasks:   http://localhost:" + port + "/api/v1/tasks/{id}/interaction-status");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
