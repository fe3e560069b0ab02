package com.slipway.core.engine;

import com.slipway.core.exception.PipelineDefinitionException;
import com.slipway.core.model.BuildAction;
import com.slipway.core.model.Capability;
import com.slipway.core.model.ImageReferenceMode;
import com.slipway.core.model.PublishAction;
import com.slipway.core.model.TriggerAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineDefinitionFactoryTest {

    private PipelineProperties properties;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getPipeline().setRepository("registry.example.com/team/app");
        properties.getTarget().setCluster("platform/prod");
        properties.getTarget().setService("app");
    }

    private PipelineProperties.Stage stage(String name, String action) {
        var stage = new PipelineProperties.Stage();
        stage.setName(name);
        stage.setAction(action);
        stage.setImage("docker:27-cli");
        properties.getStages().add(stage);
        return stage;
    }

    private PipelineProperties.Stage publish() {
        var stage = stage("publish", "publish");
        stage.setRegistryUrl("registry.example.com");
        stage.setUsernameSecret("registry-user");
        stage.setPasswordSecret("registry-pass");
        stage.setSecretScopes(new ArrayList<>(List.of("registry-user", "registry-pass")));
        return stage;
    }

    @Test
    @DisplayName("builds a three-stage definition in declared order")
    void buildsDefinition() {
        var build = stage("build", "build");
        build.setCapabilities(List.of("docker-socket"));
        build.setContextDir("/workspace");
        publish().getRetry().setMaxAttempts(3);
        stage("deploy", "trigger");

        var definition = PipelineDefinitionFactory.create(properties);

        assertEquals("registry.example.com/team/app", definition.repository());
        assertEquals(List.of("build", "publish", "deploy"),
                definition.stages().stream().map(s -> s.name()).toList());
        assertInstanceOf(BuildAction.class, definition.stages().get(0).action());
        assertInstanceOf(PublishAction.class, definition.stages().get(1).action());
        assertInstanceOf(TriggerAction.class, definition.stages().get(2).action());
        assertTrue(definition.stages().get(0).environment().grants(Capability.DOCKER_SOCKET));
        assertFalse(definition.stages().get(1).environment().grants(Capability.DOCKER_SOCKET));
        assertEquals(3, definition.stages().get(1).retryPolicy().maxAttempts());
        assertEquals(Duration.ofMinutes(30), definition.stages().get(0).retryPolicy().timeout());
        assertEquals("platform/prod", definition.target().cluster());
        assertEquals(ImageReferenceMode.LATEST, definition.imageReferenceMode());
    }

    @Test
    @DisplayName("publish defaults its additional tags to latest")
    void publishDefaultsToLatest() {
        stage("build", "build");
        publish();

        var action = (PublishAction) PipelineDefinitionFactory.create(properties).stages().get(1).action();

        assertEquals(List.of("latest"), action.additionalTags());
    }

    @Test
    @DisplayName("rejects a missing repository")
    void rejectsMissingRepository() {
        properties.getPipeline().setRepository("");
        stage("build", "build");

        var e = assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
        assertTrue(e.getMessage().contains("repository"));
    }

    @Test
    @DisplayName("rejects an empty stage list")
    void rejectsNoStages() {
        assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
    }

    @Test
    @DisplayName("rejects duplicate stage names")
    void rejectsDuplicateNames() {
        stage("build", "build");
        stage("build", "build");

        var e = assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
        assertTrue(e.getMessage().contains("Duplicate stage name"));
    }

    @Test
    @DisplayName("rejects an unknown action")
    void rejectsUnknownAction() {
        stage("test", "lint");

        var e = assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
        assertTrue(e.getMessage().contains("unknown action"));
    }

    @Test
    @DisplayName("rejects an unknown capability")
    void rejectsUnknownCapability() {
        stage("build", "build").setCapabilities(List.of("privileged"));

        var e = assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
        assertTrue(e.getMessage().contains("unknown capability"));
    }

    @Test
    @DisplayName("rejects a stage without an image")
    void rejectsMissingImage() {
        stage("build", "build").setImage(null);

        assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
    }

    @Test
    @DisplayName("rejects a publish stage that runs before any build")
    void rejectsPublishBeforeBuild() {
        publish();

        var e = assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
        assertTrue(e.getMessage().contains("before any build"));
    }

    @Test
    @DisplayName("rejects a trigger stage without a deployment target")
    void rejectsTriggerWithoutTarget() {
        properties.getTarget().setCluster("");
        stage("deploy", "trigger");

        assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
    }

    @Test
    @DisplayName("VERSION image references need a build stage before the trigger")
    void versionModeNeedsBuild() {
        properties.getPipeline().setImageReferenceMode(ImageReferenceMode.VERSION);
        stage("deploy", "trigger");

        assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
    }

    @Test
    @DisplayName("LATEST image references need the publish stage to push latest")
    void latestModeNeedsLatestTag() {
        stage("build", "build");
        publish().setTags(List.of("stable"));
        stage("deploy", "trigger");

        var e = assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
        assertTrue(e.getMessage().contains("latest"));
    }

    @Test
    @DisplayName("VERSION image references accept publish stages without latest")
    void versionModeAcceptsCustomTags() {
        properties.getPipeline().setImageReferenceMode(ImageReferenceMode.VERSION);
        stage("build", "build");
        publish().setTags(List.of("stable"));
        stage("deploy", "trigger");

        var action = (PublishAction) PipelineDefinitionFactory.create(properties).stages().get(1).action();
        assertEquals(List.of("stable"), action.additionalTags());
    }

    @Test
    @DisplayName("LATEST image references allow a trigger-only pipeline")
    void latestModeAllowsTriggerOnly() {
        stage("deploy", "trigger");

        assertEquals(1, PipelineDefinitionFactory.create(properties).stages().size());
    }

    @Test
    @DisplayName("rejects credentials an action uses but the stage does not declare")
    void rejectsUndeclaredActionSecret() {
        stage("build", "build");
        publish().setSecretScopes(new ArrayList<>(List.of("registry-user")));

        var e = assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
        assertTrue(e.getMessage().contains("registry-pass"));
    }

    @Test
    @DisplayName("rejects an invalid retry policy")
    void rejectsInvalidRetryPolicy() {
        stage("build", "build").getRetry().setMaxAttempts(0);

        assertThrows(PipelineDefinitionException.class, () -> PipelineDefinitionFactory.create(properties));
    }
}
