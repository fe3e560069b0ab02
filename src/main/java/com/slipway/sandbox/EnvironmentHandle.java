package com.slipway.sandbox;

import com.slipway.core.model.EnvironmentSpec;

import java.util.List;
import java.util.Map;

/**
 * A live, ephemeral environment bound to exactly one stage attempt.
 * Owned by the stage that acquired it; never shared or reused.
 */
public interface EnvironmentHandle {

    String handleId();

    String stageName();

    EnvironmentSpec spec();

    /**
     * Runs a command inside the environment and blocks until it exits.
     *
     * @param command argv, no shell interpretation unless the command itself is a shell
     * @param env     variables visible to this process only; the channel for secret values
     */
    CommandResult exec(List<String> command, Map<String, String> env);

    default CommandResult exec(List<String> command) {
        return exec(command, Map.of());
    }
}
