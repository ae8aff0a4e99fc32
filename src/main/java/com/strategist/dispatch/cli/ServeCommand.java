package com.strategist.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: strategist serve
 * <p>
 * Starts the planner as a long-running HTTP server exposing the REST API. The web
 * server is enabled by {@link com.strategist.StrategistApplication#main} detecting
 * "serve" in the arguments; {@link CliRunner} then skips picocli, and the banner is
 * printed once the server reports its port.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 strategist serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Strategist HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Outside serve mode the banner is all this prints.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Strategist server running on port " + port);
        System.out.println();
        System.out.println("  Plans:    POST http://localhost:" + port + "/api/v1/plans");
        System.out.println("  Health:   http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
