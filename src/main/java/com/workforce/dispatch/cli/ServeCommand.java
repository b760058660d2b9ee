package com.workforce.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: workforce serve
 * <p>
 * Starts the HTTP server exposing the REST API and SSE event streams. The web server is enabled by
 * {@link com.workforce.WorkforceApplication#main} detecting "serve" in args, and {@link CliRunner}
 * skips picocli in that mode. The banner is printed once the embedded server is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 workforce serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the workforce HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through picocli help paths; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Workforce server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Companies:  http://localhost:" + port + "/api/v1/companies");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
