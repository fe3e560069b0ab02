package com.slipway.dispatch.cli;

import com.slipway.core.engine.PipelineRunService;
import com.slipway.core.model.RunSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: slipway history
 * <p>
 * Lists recent runs as a table: Run | Status | Branch | Commit | Duration.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent runs")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final PipelineRunService runService;

    public HistoryCommand(PipelineRunService runService) {
        this.runService = runService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<RunSummary> runs = runService.list(limit);
        if (runs.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return;
        }

        ConsoleOutput.info("Runs (" + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-6s %-10s %-20s %-10s %s%n", "RUN", "STATUS", "BRANCH", "COMMIT", "DURATION");
        System.out.println("  " + "-".repeat(60));
        for (RunSummary run : runs) {
            System.out.printf("  %-6d %-10s %-20s %-10s %s%n",
                    run.runNumber(), run.status(), truncate(run.branch(), 20),
                    ConsoleOutput.shortCommit(run.commit()), ConsoleOutput.formatDuration(run.durationMs()));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
