package com.agentflow.dispatch.cli;

import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output for the AgentFlow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) AGENTFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [AGENTFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    /** Prints a {@code label  count} table, one row per entry. */
    public static void counts(String title, Map<String, Long> rows) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
        if (rows.isEmpty()) {
            System.out.println("  (none)");
        }
        rows.forEach((label, count) -> System.out.printf("  %-14s %d%n", label, count));
    }
}
