package com.agentflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentflow submit &lt;title&gt;
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Submit a task to a running server")
@Component
public class SubmitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task title")
    private String title;

    @Option(names = {"--description", "-d"}, description = "Task description")
    private String description;

    @Option(names = {"--priority", "-p"}, description = "low, medium, high or urgent (default: ${DEFAULT-VALUE})",
            defaultValue = "medium")
    private String priority;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ServerClient client;

    public SubmitCommand(ServerClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("title", title);
        body.put("description", description);
        body.put("priority", priority);
        try {
            ServerClient.Response response = client.post(port, "/tasks", body);
            if (!response.isSuccess()) {
                ConsoleOutput.error("Task rejected (HTTP " + response.status() + "): "
                        + response.body().path("error").asText("no detail"));
                return 1;
            }
            ConsoleOutput.success("Task " + response.body().path("id").asLong() + " submitted ("
                    + response.body().path("priority").asText() + ")");
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to AgentFlow server at localhost:" + port);
            ConsoleOutput.info("Start the server first: agentflow serve");
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (Exception e) {
            ConsoleOutput.error("Submit failed: " + e.getMessage());
            return 1;
        }
    }
}
