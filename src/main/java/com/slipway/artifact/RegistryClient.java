package com.slipway.artifact;

import com.slipway.core.logging.StageLog;
import com.slipway.sandbox.EnvironmentHandle;

/**
 * Registry operations run from inside a publish environment.
 * Every failure surfaces as {@link com.slipway.core.exception.PublishException}.
 */
public interface RegistryClient {

    /** Credentials travel as exec environment only, never on a command line. */
    void login(EnvironmentHandle env, String registry, String username, String password, StageLog log);

    void logout(EnvironmentHandle env, String registry, StageLog log);

    void tag(EnvironmentHandle env, String source, String target, StageLog log);

    /**
     * @return the manifest digest the registry reported, or {@code null} if none was printed
     */
    String push(EnvironmentHandle env, String reference, StageLog log);

    /** Local image id (content digest) a reference points at. */
    String imageId(EnvironmentHandle env, String reference);
}
