package com.agentflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for AgentFlow.
 */
@Command(
        name = "agentflow",
        mixinStandardHelpOptions = true,
        version = "AgentFlow 0.1.0",
        description = "Autonomous task orchestration across a fixed roster of role agents",
        subcommands = {
                ServeCommand.class,
                StatusCommand.class,
                SubmitCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentFlowCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
