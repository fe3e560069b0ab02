package com.slipway.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: slipway serve
 * <p>
 * Starts Slipway as a long-running HTTP server that accepts push webhooks and exposes
 * run status and SSE streams. {@link #requested} decides both whether the web server
 * starts and whether {@link CliRunner} hands the arguments to picocli.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Slipway HTTP server")
@Component
public class ServeCommand implements Runnable {

    static final String NAME = "serve";

    /**
     * Whether {@code args} select this command. Only the subcommand position counts, so
     * {@code run --branch serve} is still a run.
     */
    public static boolean requested(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return NAME.equals(arg);
            }
        }
        return false;
    }

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not reached in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Slipway server running on port " + port);
        System.out.println();
        System.out.println("  Webhook:  http://localhost:" + port + "/api/v1/webhooks/push");
        System.out.println("  Runs:     http://localhost:" + port + "/api/v1/runs");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
