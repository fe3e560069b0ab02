package com.slipway.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slipway.core.engine.PipelineProperties;
import com.slipway.core.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores terminal run summaries as one JSON file per run ({@code run-<n>.json}).
 * Summaries are already redacted when they get here.
 */
@Component
public class RunArchive {

    private static final Logger log = LoggerFactory.getLogger(RunArchive.class);

    private static final Pattern FILE_NAME = Pattern.compile("run-(\\d+)\\.json");
    private static final String COUNTER_FILE = "last-run-number";

    private final Path directory;
    private final ObjectMapper objectMapper;

    @Autowired
    public RunArchive(PipelineProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getArchiveDir()), objectMapper);
    }

    public RunArchive(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public void save(RunSummary summary) throws IOException {
        Files.createDirectories(directory);
        Path target = fileFor(summary.runNumber());
        Path tmp = directory.resolve(target.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), summary);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Archived run {} to {}", summary.runNumber(), target);
    }

    public Optional<RunSummary> find(long runNumber) {
        Path file = fileFor(runNumber);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return read(file);
    }

    /** Most recent archived runs first. */
    public List<RunSummary> list(int limit) {
        var result = new ArrayList<RunSummary>();
        for (long runNumber : runNumbersDescending()) {
            if (result.size() >= limit) {
                break;
            }
            find(runNumber).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Highest run number ever issued, 0 for a fresh archive. Seeds run numbering, so numbers
     * of runs that never reached the archive (crash, failed write) are not handed out again.
     */
    public long latestRunNumber() {
        var numbers = runNumbersDescending();
        long archived = numbers.isEmpty() ? 0 : numbers.get(0);
        return Math.max(archived, recordedRunNumber());
    }

    /** Persists {@code runNumber} as issued, before the run starts. */
    public void recordRunNumber(long runNumber) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(COUNTER_FILE);
        Path tmp = directory.resolve(COUNTER_FILE + ".tmp");
        Files.writeString(tmp, Long.toString(runNumber));
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private long recordedRunNumber() {
        Path file = directory.resolve(COUNTER_FILE);
        if (!Files.isRegularFile(file)) {
            return 0;
        }
        try {
            return Long.parseLong(Files.readString(file).trim());
        } catch (IOException | NumberFormatException e) {
            log.warn("Ignoring unreadable run counter {}: {}", file, e.getMessage());
            return 0;
        }
    }

    private List<Long> runNumbersDescending() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .map(p -> FILE_NAME.matcher(p.getFileName().toString()))
                    .filter(Matcher::matches)
                    .map(m -> Long.parseLong(m.group(1)))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        } catch (IOException e) {
            log.warn("Cannot list run archive {}: {}", directory, e.getMessage());
            return List.of();
        }
    }

    private Optional<RunSummary> read(Path file) {
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), RunSummary.class));
        } catch (IOException e) {
            log.warn("Skipping unreadable run archive {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Path fileFor(long runNumber) {
        return directory.resolve("run-" + runNumber + ".json");
    }
}
