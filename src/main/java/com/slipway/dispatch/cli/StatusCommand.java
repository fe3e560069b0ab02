package com.slipway.dispatch.cli;

import com.slipway.core.engine.PipelineRunService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * CLI command: slipway status &lt;run-number&gt;
 * <p>
 * Shows a run from the archive, or follows a live run on a running server with --watch.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show run status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Run number")
    private long runNumber;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port for watch mode (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final PipelineRunService runService;

    public StatusCommand(PipelineRunService runService) {
        this.runService = runService;
    }

    @Override
    public void run() {
        if (watch) {
            runWatchMode();
            return;
        }

        ConsoleOutput.printBanner();
        runService.find(runNumber).ifPresentOrElse(
                ConsoleOutput::runSummary,
                () -> ConsoleOutput.error("Run not found: " + runNumber));
    }

    private void runWatchMode() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching run " + runNumber + " (connecting to localhost:" + port + ")...");
        System.out.println();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/runs/" + runNumber + "/events");
        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "text/event-stream")
                    .GET()
                    .build();

            HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());
            if (response.statusCode() == 404) {
                ConsoleOutput.error("Run not found: " + runNumber);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }

            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, line.substring(5).trim());
                    currentEventType[0] = "";
                }
            });

            System.out.println();
            ConsoleOutput.info("Stream ended.");
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Slipway server at localhost:" + port);
            ConsoleOutput.info("Start the server first: slipway serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }
}
