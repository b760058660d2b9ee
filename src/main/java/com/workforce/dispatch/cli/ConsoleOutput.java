package com.workforce.dispatch.cli;

import com.workforce.core.events.SessionEvent;
import com.workforce.core.model.CostEstimate;
import com.workforce.core.model.TokenUsage;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the workforce CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WORKFORCE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WORKFORCE]|@ " + message));
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

    /**
     * One line per session event. Deltas are skipped; the full answer is printed on {@code complete}.
     */
    public static void sessionEvent(SessionEvent event) {
        Map<String, Object> data = event.data();
        switch (event.type()) {
            case START -> info("Run " + event.runId() + " started ("
                    + data.get("company") + ", " + data.get("task_type") + ")");
            case AGENT_CHANGE -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(magenta) [HANDOFF]|@ " + data.get("from") + " -> " + data.get("to")
                            + " (" + data.get("kind") + ")"
                            + (data.get("note") != null ? " " + data.get("note") : "")));
            case TOOL_CALL -> agent(event.agent(), "calling " + data.get("tool"));
            case TOOL_RESULT -> agent(event.agent(), data.get("tool") + " returned "
                    + String.valueOf(data.get("content")).length() + " chars");
            case DELTA -> {
                // printed as part of complete
            }
            case ARTIFACTS_SAVED -> info("Artifacts saved to " + data.get("path"));
            case COMPLETE -> {
                System.out.println();
                System.out.println(data.get("response"));
                System.out.println();
                success("Complete (" + data.get("evaluation_outcome") + ", "
                        + formatDuration(toLong(data.get("duration_ms"))) + ")");
            }
            case ERROR -> error(data.get("error_type") + ": " + data.get("error"));
        }
    }

    public static void usage(TokenUsage usage, CostEstimate cost) {
        if (usage == null) {
            return;
        }
        String line = "  Tokens: " + usage.inputTokens() + " in, " + usage.outputTokens() + " out ("
                + usage.requests() + " requests)";
        if (cost != null && cost.totalEstimatedUsdCost() != null) {
            line += String.format(", est. $%.4f (%s)", cost.totalEstimatedUsdCost(), cost.model());
        }
        System.out.println(line);
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static long toLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
