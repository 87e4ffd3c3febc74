package com.switchyard.dispatch.cli;

import com.switchyard.core.model.TaskResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Switchyard CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWITCHYARD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWITCHYARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void result(TaskResult result) {
        String agent = "@|fg(blue) [" + result.agent().value().toUpperCase() + "]|@ ";
        if (result.success()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(agent + "@|fg(green) OK|@ " + result.output()));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(agent + "@|fg(red) FAILED|@ " + result.error()));
        }
        result.metadata().forEach((key, value) ->
                System.out.println("    " + key + ": " + value));
    }

    public static void circuit(String name, String state, int failures, long totalCalls) {
        String color = switch (state) {
            case "closed" -> "fg(green)";
            case "half_open" -> "fg(yellow)";
            default -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-16s @|%s %-10s|@ %-9d %d", name, color, state, failures, totalCalls)));
    }
}
