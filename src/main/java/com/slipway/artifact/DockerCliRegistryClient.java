package com.slipway.artifact;

import com.slipway.core.exception.PublishException;
import com.slipway.core.logging.StageLog;
import com.slipway.sandbox.CommandResult;
import com.slipway.sandbox.EnvironmentHandle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Drives the {@code docker} CLI inside the stage environment. The environment needs
 * the Docker socket capability.
 */
@Component
public class DockerCliRegistryClient implements RegistryClient {

    static final String USERNAME_VAR = "REGISTRY_USERNAME";
    static final String PASSWORD_VAR = "REGISTRY_PASSWORD";

    /** $0 is the registry host; the password is piped from the exec environment. */
    static final String LOGIN_SCRIPT =
            "printf '%s' \"$" + PASSWORD_VAR + "\" | docker login \"$0\" -u \"$" + USERNAME_VAR + "\" --password-stdin";

    private static final Pattern PUSH_DIGEST = Pattern.compile("digest: (sha256:[a-f0-9]{64})");

    @Override
    public void login(EnvironmentHandle env, String registry, String username, String password, StageLog log) {
        var result = env.exec(List.of("sh", "-c", LOGIN_SCRIPT, registry),
                Map.of(USERNAME_VAR, username, PASSWORD_VAR, password));
        log.output(result.output());
        require(env, result, "docker login to " + registry);
    }

    @Override
    public void logout(EnvironmentHandle env, String registry, StageLog log) {
        var result = env.exec(List.of("docker", "logout", registry));
        log.output(result.output());
    }

    @Override
    public void tag(EnvironmentHandle env, String source, String target, StageLog log) {
        var result = env.exec(List.of("docker", "tag", source, target));
        log.output(result.output());
        require(env, result, "docker tag " + target);
    }

    @Override
    public String push(EnvironmentHandle env, String reference, StageLog log) {
        var result = env.exec(List.of("docker", "push", reference));
        log.output(result.output());
        require(env, result, "docker push " + reference);
        var matcher = PUSH_DIGEST.matcher(result.output());
        return matcher.find() ? matcher.group(1) : null;
    }

    @Override
    public String imageId(EnvironmentHandle env, String reference) {
        var result = env.exec(List.of("docker", "image", "inspect", "--format", "{{.Id}}", reference));
        require(env, result, "docker image inspect " + reference);
        return result.lastLine();
    }

    private static void require(EnvironmentHandle env, CommandResult result, String what) {
        if (!result.succeeded()) {
            throw new PublishException(env.stageName(),
                    what + " exited with " + result.exitCode() + ": " + result.tail(5));
        }
    }
}
