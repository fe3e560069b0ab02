package com.slipway.sandbox;

/**
 * Outcome of a command run inside a stage environment.
 *
 * @param exitCode process exit code (0 = success, -1 = unknown)
 * @param output   combined stdout/stderr, unredacted; callers route it through a StageLog
 */
public record CommandResult(int exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }

    /** Last non-blank output line, trimmed. Handy for single-value commands. */
    public String lastLine() {
        if (output == null) {
            return "";
        }
        String[] lines = output.strip().split("\\R");
        return lines.length == 0 ? "" : lines[lines.length - 1].trim();
    }

    /** The last {@code lines} non-blank output lines, for error messages. */
    public String tail(int lines) {
        if (output == null || output.isBlank()) {
            return "";
        }
        var kept = output.strip().lines().filter(l -> !l.isBlank()).toList();
        return String.join("\n", kept.subList(Math.max(0, kept.size() - lines), kept.size()));
    }
}
