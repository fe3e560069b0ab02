package com.slipway.core.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthStatusTest {

    private static HealthStatus degraded(String component) {
        return new HealthStatus(component, HealthStatus.Status.DEGRADED, "slow", null);
    }

    @Test
    @DisplayName("overall status is the worst component status")
    void overall() {
        var up = HealthStatus.up("pipeline", "3 stage(s)", Map.of("activeRuns", "0"));

        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of(up)));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.overall(List.of(up, degraded("secrets"))));
        assertEquals(HealthStatus.Status.DOWN,
                HealthStatus.overall(List.of(degraded("secrets"), HealthStatus.down("docker", "unreachable"), up)));
        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of()));
    }

    @Test
    @DisplayName("metadata is never null")
    void metadataDefaults() {
        assertEquals(Map.of(), degraded("docker").metadata());
        assertEquals(Map.of(), HealthStatus.down("docker", "unreachable").metadata());
    }
}
