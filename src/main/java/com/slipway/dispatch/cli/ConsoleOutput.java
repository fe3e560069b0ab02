package com.slipway.dispatch.cli;

import com.slipway.core.model.RunStatus;
import com.slipway.core.model.RunSummary;
import com.slipway.core.model.StageRecord;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Slipway CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SLIPWAY v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SLIPWAY]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void stage(String stage, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [STAGE " + stage + "]|@ " + message));
    }

    public static void runSummary(RunSummary summary) {
        System.out.println();
        System.out.println("RUN " + summary.runNumber() + "  " + summary.branch() + "@" + shortCommit(summary.commit()));
        status("Status: " + summary.status(), summary.status());

        System.out.println();
        System.out.printf("  %-16s %-8s %-10s %-9s %s%n", "STAGE", "ACTION", "STATE", "ATTEMPTS", "DURATION");
        System.out.println("  " + "-".repeat(60));
        for (StageRecord stage : summary.stages()) {
            System.out.printf("  %-16s %-8s %-10s %-9d %s%n",
                    stage.name(), stage.action(), stage.state(), stage.attempts(),
                    formatDuration(stage.durationMs()));
        }

        if (summary.artifact() != null) {
            System.out.println();
            info("Artifact: " + summary.artifact().reference() + " " + summary.artifact().digest());
        }
        for (String reference : summary.publishedReferences()) {
            success("Published " + reference);
        }
        if (summary.deploymentId() != null) {
            success("Deployment requested: " + summary.deploymentId());
        }
        if (summary.error() != null) {
            error(summary.error());
        }
        System.out.println("──────────────────────────────────");
        System.out.println("  Duration: " + formatDuration(summary.durationMs()));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "stage.started", "stage.state" -> "@|fg(blue) [STAGE]|@";
            case "stage.retrying" -> "@|fg(yellow) [RETRY]|@";
            case "stage.completed" -> "@|fg(green) [STAGE]|@";
            case "stage.failed" -> "@|fg(red) [STAGE]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "run.failed" -> "@|fg(red),bold [FAILED]|@";
            case "run.aborted" -> "@|fg(yellow),bold [ABORTED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static void status(String label, RunStatus status) {
        switch (status) {
            case SUCCEEDED -> success(label);
            case FAILED, ABORTED -> error(label);
            default -> info(label);
        }
    }

    static String shortCommit(String commit) {
        if (commit == null) return "-";
        return commit.length() > 8 ? commit.substring(0, 8) : commit;
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
