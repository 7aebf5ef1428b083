package com.agentflow.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentflow serve
 * <p>
 * Runs the REST API, the SSE streams and the sweeps. The web server is
 * enabled by {@link com.agentflow.AgentFlowApplication#main} seeing "serve";
 * {@link CliRunner} then skips picocli, so {@link #run()} only serves --help.
 * The banner is printed once the web server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the AgentFlow server and orchestrator")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("AgentFlow server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
