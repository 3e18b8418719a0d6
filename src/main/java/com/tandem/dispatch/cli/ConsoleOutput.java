package com.tandem.dispatch.cli;

import com.tandem.core.model.InteractionLogEntry;
import com.tandem.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Tandem CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TANDEM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TANDEM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(TaskStatus status) {
        String color = switch (status) {
            case DONE -> "fg(green)";
            case CANCELLED -> "fg(red)";
            case WAITING_HUMAN_FEEDBACK -> "fg(magenta),bold";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Status: @|" + color + " " + status.wireValue() + "|@"));
    }

    public static void interaction(InteractionLogEntry entry) {
        String prefix = entry.isHumanResponse()
                ? "@|fg(green) [HUMAN " + entry.status().wireValue() + "]|@"
                : "@|fg(blue) [AI " + entry.status().wireValue() + "]|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + entry.createdAt() + " " + prefix + " " + entry.createdBy() + ": " + truncate(entry.content(), 60)));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
