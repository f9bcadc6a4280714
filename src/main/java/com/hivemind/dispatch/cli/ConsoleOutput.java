package com.hivemind.dispatch.cli;

import com.hivemind.core.bus.Message;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Hivemind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HIVEMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HIVEMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String agentId, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + agentId + "]|@ " + message));
    }

    public static void fileChange(String agentId, String content) {
        String symbol = content.startsWith("Deleted") ? "-" : content.startsWith("Wrote") ? "+" : "~";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) " + symbol + "|@ " + content + " @|faint (" + agentId + ")|@"));
    }

    public static void approval(String approvalId, String description) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(magenta) [APPROVAL " + approvalId + "]|@ " + description));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  reply @|bold approve " + approvalId + "|@ or @|bold reject " + approvalId + "|@"));
    }

    /**
     * One line per bus message. Status and thought chatter is left to the log.
     */
    public static void event(Message message) {
        String prefix = switch (message.type()) {
            case TASK_ASSIGNED -> "@|fg(blue) [TASK]|@";
            case REVIEW_REQUEST, REVIEW_RESULT -> "@|fg(yellow) [REVIEW]|@";
            case TEST_RESULT -> "@|fg(yellow) [TEST]|@";
            case TERMINAL_OUTPUT -> "@|fg(white) [SHELL]|@";
            case HANDOFF -> "@|fg(cyan) [HANDOFF]|@";
            case ASK_HELP, SHARE_INSIGHT, PROPOSE_APPROACH -> "@|fg(cyan) [COLLAB]|@";
            case SYSTEM -> "@|fg(magenta) [SYSTEM]|@";
            case MISSION_COMPLETE -> "@|fg(green),bold [COMPLETE]|@";
            default -> "@|fg(blue) [CHAT]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " @|bold " + message.sender() + "|@: " + firstLine(message.content())));
    }

    public static void tasks(List<Task> tasks) {
        if (tasks.isEmpty()) {
            info("No tasks.");
            return;
        }
        System.out.printf("  %-10s %-12s %-12s %-8s %s%n", "TASK", "ASSIGNEE", "STATUS", "PRIORITY", "TITLE");
        System.out.println("  " + "-".repeat(72));
        for (Task task : tasks) {
            String status = task.status() == TaskStatus.DONE
                    ? "@|fg(green) " + pad(task.status().wireName(), 12) + "|@"
                    : pad(task.status().wireName(), 12);
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-10s %-12s %s %-8s %s",
                    task.id(), task.assignee() == null ? "-" : task.assignee(), status,
                    task.priority().name().toLowerCase(), truncate(task.title(), 40))));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return truncate(newline < 0 ? text : text.substring(0, newline) + " ...", 160);
    }

    private static String pad(String s, int width) {
        return String.format("%-" + width + "s", s);
    }
}
