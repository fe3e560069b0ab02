package com.slipway.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Slipway.
 * Routes to subcommands: run, status, history, health, serve.
 */
@Command(
        name = "slipway",
        mixinStandardHelpOptions = true,
        version = "Slipway 0.1.0",
        description = "Stage-isolated build, publish and deploy pipeline",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SlipwayCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // usage from the bound spec; subcommands need the Spring-aware factory
        spec.commandLine().usage(System.out);
    }
}
