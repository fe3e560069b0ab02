package com.slipway.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Slipway-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(long runNumber) {
        MDC.put("runNumber", String.valueOf(runNumber));
    }

    public static void setStage(long runNumber, String stage, int attempt) {
        MDC.put("runNumber", String.valueOf(runNumber));
        MDC.put("stage", stage);
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clearStage() {
        MDC.remove("stage");
        MDC.remove("attempt");
    }

    public static void clear() {
        MDC.remove("runNumber");
        MDC.remove("stage");
        MDC.remove("attempt");
    }
}
