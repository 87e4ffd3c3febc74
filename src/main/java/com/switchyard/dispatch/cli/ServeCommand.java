package com.switchyard.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: switchyard serve
 * <p>
 * Starts Switchyard as a long-running HTTP server exposing the REST API. The web server
 * is enabled by {@link com.switchyard.SwitchyardApplication#main} detecting "serve" in
 * args; {@link CliRunner} then skips picocli and the banner is printed once the server
 * is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Switchyard HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through picocli (e.g. --help paths); serve mode bypasses it.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Switchyard server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
