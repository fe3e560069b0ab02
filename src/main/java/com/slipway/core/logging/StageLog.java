package com.slipway.core.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Per-stage log that stage actions write into. Every line is redacted before it is
 * kept for the run record or handed to SLF4J.
 */
public final class StageLog {

    private static final Logger log = LoggerFactory.getLogger("slipway.stage");

    private final Consumer<String> sink;
    private final UnaryOperator<String> redactor;

    public StageLog(Consumer<String> sink, UnaryOperator<String> redactor) {
        this.sink = sink;
        this.redactor = redactor;
    }

    /** A log that keeps nothing. */
    public static StageLog discarding() {
        return new StageLog(line -> {}, UnaryOperator.identity());
    }

    public void info(String line) {
        String safe = redactor.apply(line);
        log.info(safe);
        sink.accept(safe);
    }

    /** Appends multi-line command output, one record per non-blank line. */
    public void output(String block) {
        if (block == null || block.isBlank()) {
            return;
        }
        for (String line : redactor.apply(block).split("\\R")) {
            if (!line.isBlank()) {
                log.debug(line);
                sink.accept(line);
            }
        }
    }
}
