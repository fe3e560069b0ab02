package com.slipway.secrets;

import com.slipway.core.exception.SecretNotFoundException;

import java.util.function.Function;

/**
 * Reads credentials from process environment variables. Meant for local runs.
 * The credential path is the variable name; structured fields are not supported.
 */
public class EnvironmentSecretStore implements SecretStore {

    private final Function<String, String> lookup;

    public EnvironmentSecretStore(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    @Override
    public String fetch(String stage, String path, String field) {
        String value = lookup.apply(path);
        if (value == null || value.isEmpty()) {
            throw new SecretNotFoundException(stage, path, "environment variable not set");
        }
        return value;
    }

    @Override
    public String name() {
        return "environment";
    }
}
