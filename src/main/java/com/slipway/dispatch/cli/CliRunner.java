package com.slipway.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the context is up and keeps its exit code for
 * {@link com.slipway.SlipwayApplication} to exit with.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SlipwayCommand slipwayCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SlipwayCommand slipwayCommand, IFactory factory) {
        this.slipwayCommand = slipwayCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // The embedded web server keeps the JVM alive in serve mode
        if (ServeCommand.requested(args)) {
            return;
        }
        exitCode = new CommandLine(slipwayCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
