package com.agentflow.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.ConnectException;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentflow health
 * <p>
 * Displays the component checks of a running server with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ServerClient client;

    public HealthCommand(ServerClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ServerClient.Response response;
        try {
            // 503 still carries the component breakdown
            response = client.get(port, "/health");
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to AgentFlow server at localhost:" + port);
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Health check failed: " + e.getMessage());
            return 1;
        }

        boolean allUp = true;
        Iterator<Map.Entry<String, JsonNode>> components = response.body().path("components").fields();
        while (components.hasNext()) {
            var component = components.next();
            String label = component.getKey() + ": " + component.getValue().path("detail").asText();
            switch (component.getValue().path("status").asText()) {
                case "UP" -> ConsoleOutput.success(label);
                case "DEGRADED" -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
                default -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
        return "UP".equals(response.body().path("status").asText()) ? 0 : 1;
    }
}
