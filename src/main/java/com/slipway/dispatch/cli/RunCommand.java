package com.slipway.dispatch.cli;

import com.slipway.core.engine.PipelineRunService;
import com.slipway.core.events.EventBus;
import com.slipway.core.events.PipelineEvent;
import com.slipway.core.model.RunStatus;
import com.slipway.core.model.RunSummary;
import com.slipway.core.model.SourceRef;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: slipway run --branch &lt;branch&gt; --commit &lt;sha&gt;
 * <p>
 * Executes one run in the foreground and prints stage transitions as they happen.
 * Exit code: 0 succeeded, 1 failed, 2 aborted.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the pipeline for one revision")
@Component
public class RunCommand implements Callable<Integer> {

    static final int EXIT_SUCCEEDED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_ABORTED = 2;

    @Option(names = {"--branch", "-b"}, description = "Branch name (default: ${DEFAULT-VALUE})",
            defaultValue = "main")
    private String branch;

    @Option(names = {"--commit", "-c"}, required = true, description = "Commit SHA to build")
    private String commit;

    @Option(names = {"--repository-url"}, description = "Source repository clone URL", defaultValue = "")
    private String repositoryUrl;

    private final PipelineRunService runService;
    private final EventBus eventBus;

    public RunCommand(PipelineRunService runService, EventBus eventBus) {
        this.runService = runService;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Running pipeline for " + branch + "@" + ConsoleOutput.shortCommit(commit));

        EventBus.Subscription subscription = eventBus.subscribeAll(RunCommand::printEvent);
        RunSummary summary;
        try {
            summary = runService.runNow(new SourceRef(repositoryUrl, branch, commit));
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + e.getMessage());
            return EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.runSummary(summary);
        return exitCodeFor(summary.status());
    }

    static int exitCodeFor(RunStatus status) {
        return switch (status) {
            case SUCCEEDED -> EXIT_SUCCEEDED;
            case ABORTED -> EXIT_ABORTED;
            default -> EXIT_FAILED;
        };
    }

    private static void printEvent(PipelineEvent event) {
        switch (event.eventType()) {
            case "stage.started" -> ConsoleOutput.stage(event.stage(),
                    "attempt " + event.payload().get("attempt"));
            case "stage.retrying" -> ConsoleOutput.stage(event.stage(),
                    "retrying in " + event.payload().get("backoffMs") + "ms: " + event.payload().get("error"));
            case "stage.completed" -> ConsoleOutput.success(event.stage() + " succeeded");
            case "stage.failed" -> ConsoleOutput.error(event.stage() + " " + event.payload().get("state")
                    + ": " + event.payload().get("error"));
            default -> {
                // state transitions are too chatty for the terminal
            }
        }
    }
}
