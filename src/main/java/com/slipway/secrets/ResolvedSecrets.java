package com.slipway.secrets;

import com.slipway.core.exception.AccessDeniedException;
import com.slipway.core.logging.SecretRedactor;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Secret values resolved for one stage attempt. Lives no longer than the stage:
 * {@link #close} drops every value. {@link #toString} never prints values.
 */
public final class ResolvedSecrets implements AutoCloseable {

    private final String stage;
    private final Map<String, String> values;
    private final SecretRedactor initialRedactor;
    private volatile SecretRedactor redactor;
    private volatile boolean closed;

    ResolvedSecrets(String stage, Map<String, String> values) {
        this.stage = stage;
        this.values = new HashMap<>(values);
        this.initialRedactor = SecretRedactor.of(values.values());
        this.redactor = initialRedactor;
    }

    public static ResolvedSecrets empty(String stage) {
        return new ResolvedSecrets(stage, Map.of());
    }

    /**
     * Returns a declared secret's value.
     *
     * @throws AccessDeniedException if the stage did not declare the secret
     */
    public synchronized String require(String name) {
        if (closed) {
            throw new IllegalStateException("Secrets for stage " + stage + " were already released");
        }
        String value = values.get(name);
        if (value == null) {
            throw new AccessDeniedException(stage, "Stage " + stage + " did not declare secret " + name);
        }
        return value;
    }

    public synchronized Set<String> names() {
        return new TreeSet<>(values.keySet());
    }

    public synchronized boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Redactor built from the values resolved at construction. Keeps working after
     * {@link #close}, for output that arrives late from an interrupted command.
     */
    public SecretRedactor redactor() {
        return initialRedactor;
    }

    /** Masks every resolved value in {@code text}. */
    public String redact(String text) {
        return redactor.redact(text);
    }

    @Override
    public synchronized void close() {
        values.clear();
        redactor = SecretRedactor.none();
        closed = true;
    }

    @Override
    public String toString() {
        return "ResolvedSecrets[stage=" + stage + ", names=" + names() + "]";
    }
}
