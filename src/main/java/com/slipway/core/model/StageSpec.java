package com.slipway.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * Declarative definition of one pipeline stage. Immutable once a run starts.
 *
 * @param name         unique within a run
 * @param environment  the isolated environment the stage runs in
 * @param action       build, publish or trigger
 * @param secretScopes credential names this stage may read
 * @param retryPolicy  attempts, backoff and timeout
 */
public record StageSpec(
    String name,
    EnvironmentSpec environment,
    StageAction action,
    Set<String> secretScopes,
    RetryPolicy retryPolicy
) implements Serializable {

    public StageSpec {
        if (name == null || !name.matches("[a-z0-9][a-z0-9-]*")) {
            throw new IllegalArgumentException(
                    "stage name must be lowercase alphanumeric with dashes: " + name);
        }
        if (environment == null || action == null) {
            throw new IllegalArgumentException("stage " + name + " needs an environment and an action");
        }
        secretScopes = secretScopes != null ? Set.copyOf(secretScopes) : Set.of();
        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.noRetry();
    }

    public boolean declares(String scope) {
        return secretScopes.contains(scope);
    }
}
