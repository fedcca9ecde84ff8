package com.flowsmith.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: flowsmith serve
 * <p>
 * Starts Flowsmith as a long-running HTTP server. The web server is enabled by
 * {@link com.flowsmith.FlowsmithApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli in that mode. The banner is printed once
 * the server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 flowsmith serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Flowsmith HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Flowsmith server running on port " + port);
        System.out.println();
        System.out.println("  Generate:  POST http://localhost:" + port + "/api/v1/workflows/generate");
        System.out.println("  Compile:   POST http://localhost:" + port + "/api/v1/workflows/compile");
        System.out.println("  Plugins:   GET  http://localhost:" + port + "/api/v1/plugins");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
