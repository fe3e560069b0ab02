package com.slipway.core.logging;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Replaces known secret values in free text with a fixed mask.
 */
public final class SecretRedactor {

    public static final String MASK = "****";

    /** Values shorter than this are not masked; masking "a" would shred every log line. */
    static final int MIN_LENGTH = 4;

    private final List<String> values;

    private SecretRedactor(List<String> values) {
        this.values = values;
    }

    public static SecretRedactor of(Collection<String> secretValues) {
        // Longest first so a secret containing another secret is masked whole.
        List<String> sorted = secretValues.stream()
                .filter(v -> v != null && v.length() >= MIN_LENGTH)
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        return new SecretRedactor(sorted);
    }

    public static SecretRedactor none() {
        return new SecretRedactor(List.of());
    }

    public String redact(String text) {
        if (text == null || values.isEmpty()) {
            return text;
        }
        String result = text;
        for (String value : values) {
            result = result.replace(value, MASK);
        }
        return result;
    }
}
