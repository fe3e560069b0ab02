package com.slipway.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slipway.core.model.Artifact;
import com.slipway.core.model.RunStatus;
import com.slipway.core.model.RunSummary;
import com.slipway.core.model.StageAction;
import com.slipway.core.model.StageRecord;
import com.slipway.core.model.StageState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunArchiveTest {

    @TempDir
    Path directory;

    private RunArchive archive;

    @BeforeEach
    void setUp() {
        archive = new RunArchive(directory.resolve("runs"), new ObjectMapper().findAndRegisterModules());
    }

    private static RunSummary summary(long runNumber, RunStatus status) {
        var now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        var artifact = new Artifact("registry.example.com/team/app", String.valueOf(runNumber),
                "sha256:" + "b".repeat(64));
        var build = new StageRecord("build", StageAction.Kind.BUILD, StageState.SUCCEEDED, 1, now, now, 12,
                null, null, List.of("Built registry.example.com/team/app:" + runNumber));
        return new RunSummary(runNumber, "main", "abc123", status, now, now, now, 12, List.of(build),
                artifact, List.of(artifact.reference()), "deployment-" + runNumber, null);
    }

    @Test
    @DisplayName("saved runs can be found again with all fields")
    void saveAndFind() throws Exception {
        var saved = summary(3, RunStatus.SUCCEEDED);
        archive.save(saved);

        var found = archive.find(3).orElseThrow();
        assertEquals(saved, found);
        assertTrue(Files.exists(directory.resolve("runs").resolve("run-3.json")));
    }

    @Test
    @DisplayName("find returns empty for unknown runs and a missing directory")
    void findUnknown() {
        assertTrue(archive.find(1).isEmpty());
        assertTrue(archive.list(10).isEmpty());
        assertEquals(0, archive.latestRunNumber());
    }

    @Test
    @DisplayName("list returns newest runs first up to the limit")
    void listNewestFirst() throws Exception {
        archive.save(summary(1, RunStatus.SUCCEEDED));
        archive.save(summary(10, RunStatus.FAILED));
        archive.save(summary(2, RunStatus.ABORTED));

        assertEquals(List.of(10L, 2L), archive.list(2).stream().map(RunSummary::runNumber).toList());
        assertEquals(10, archive.latestRunNumber());
    }

    @Test
    @DisplayName("recorded run numbers count towards the latest run number")
    void recordedRunNumber() throws Exception {
        archive.save(summary(4, RunStatus.SUCCEEDED));
        archive.recordRunNumber(6);

        assertEquals(6, archive.latestRunNumber());
        assertTrue(archive.list(10).stream().allMatch(s -> s.runNumber() == 4));

        archive.save(summary(9, RunStatus.FAILED));
        assertEquals(9, archive.latestRunNumber());
    }

    @Test
    @DisplayName("a corrupt run counter falls back to the archived runs")
    void corruptCounter() throws Exception {
        archive.save(summary(3, RunStatus.SUCCEEDED));
        Files.writeString(directory.resolve("runs").resolve("last-run-number"), "three");

        assertEquals(3, archive.latestRunNumber());
    }

    @Test
    @DisplayName("unreadable files are skipped")
    void skipsCorruptFiles() throws Exception {
        archive.save(summary(1, RunStatus.SUCCEEDED));
        Files.writeString(directory.resolve("runs").resolve("run-2.json"), "{not json");

        assertTrue(archive.find(2).isEmpty());
        assertEquals(List.of(1L), archive.list(10).stream().map(RunSummary::runNumber).toList());
    }

    @Test
    @DisplayName("saving the same run twice replaces the previous record")
    void overwrite() throws Exception {
        archive.save(summary(5, RunStatus.FAILED));
        archive.save(summary(5, RunStatus.SUCCEEDED));

        assertEquals(RunStatus.SUCCEEDED, archive.find(5).orElseThrow().status());
    }
}
