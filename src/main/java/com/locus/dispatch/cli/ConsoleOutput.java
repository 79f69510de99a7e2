package com.locus.dispatch.cli;

import com.locus.agent.RunSummary;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Locus CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) LOCUS WORKER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LOCUS]|@ " + message));
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

    public static void sandbox(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SANDBOX]|@ " + message));
    }

    public static void tool(String activity) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) >|@ " + activity));
    }

    public static void thinking(String text) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|faint,italic " + text.strip() + "|@"));
    }

    public static void agentOutput(String text) {
        System.out.print(text.endsWith("\n") ? text : text + "\n");
    }

    public static void summary(RunSummary summary) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run Summary|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + summary.completed() + " in review|@, @|fg(yellow) "
                        + summary.blocked() + " blocked|@, @|fg(red) " + summary.failed() + " failed|@"));
        for (String url : summary.prUrls()) {
            System.out.println("  PR: " + url);
        }
    }
}
