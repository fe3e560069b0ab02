package com.slipway.secrets;

import java.util.Map;

/**
 * Builds {@link ResolvedSecrets} directly for tests outside this package.
 */
public final class TestSecrets {

    private TestSecrets() {}

    public static ResolvedSecrets of(String stage, Map<String, String> values) {
        return new ResolvedSecrets(stage, values);
    }
}
