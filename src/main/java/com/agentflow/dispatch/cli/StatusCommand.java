package com.agentflow.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.net.ConnectException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentflow status
 * <p>
 * Shows whether the sweeps are running, which tasks are in flight, and task
 * and agent counts by status, as reported by a running server.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show orchestrator status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ServerClient client;

    public StatusCommand(ServerClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            ServerClient.Response response = client.get(port, "/orchestrator/status");
            if (!response.isSuccess()) {
                ConsoleOutput.error("Server returned HTTP " + response.status());
                return 1;
            }
            JsonNode status = response.body();
            if (status.path("running").asBoolean()) {
                ConsoleOutput.success("Orchestrator: running");
            } else {
                ConsoleOutput.warn("Orchestrator: stopped");
            }
            ConsoleOutput.info("In flight: " + status.path("inFlightTaskIds"));
            System.out.println();
            ConsoleOutput.counts("Tasks", counts(status.path("taskCountsByStatus")));
            ConsoleOutput.counts("Agents", counts(status.path("agentCountsByStatus")));
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to AgentFlow server at localhost:" + port);
            ConsoleOutput.info("Start the server first: agentflow serve");
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Status failed: " + e.getMessage());
            return 1;
        }
    }

    private static Map<String, Long> counts(JsonNode node) {
        Map<String, Long> counts = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> counts.put(e.getKey(), e.getValue().asLong()));
        return counts;
    }
}
