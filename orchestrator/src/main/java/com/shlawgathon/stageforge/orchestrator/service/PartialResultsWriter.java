package com.shlawgathon.stageforge.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.stageforge.orchestrator.model.PartialResultBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Dumps the state of a failed run into a fresh directory for a person to inspect:
 * <pre>
 *   partial_results_&lt;timestamp&gt;/
 *     stage_data.json       working document at the time of failure
 *     stage_results.json    every stage result recorded so far
 *     recovery_info.json    where the run stopped and how to resume it
 *     error.json            the terminal error
 * </pre>
 */
public class PartialResultsWriter {

    private static final Logger log = LoggerFactory.getLogger(PartialResultsWriter.class);

    static final String DIRECTORY_PREFIX = "partial_results_";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PartialResultsWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Write {@code bundle} under {@code baseDir}.
     *
     * @return the bundle with its location set, or with no location if writing failed
     */
    public PartialResultBundle write(Path baseDir, PartialResultBundle bundle) {
        try {
            Path directory = newDirectory(baseDir);
            objectMapper.writeValue(directory.resolve("stage_data.json").toFile(), bundle.getWorkingDocument());
            objectMapper.writeValue(directory.resolve("stage_results.json").toFile(), bundle.getStageResults());
            objectMapper.writeValue(directory.resolve("recovery_info.json").toFile(), bundle.getRecoveryInfo());
            objectMapper.writeValue(directory.resolve("error.json").toFile(), bundle.getError());

            log.info("[PARTIAL] Partial results saved to {}", directory);
            return bundle.toBuilder().location(directory).build();
        } catch (IOException e) {
            // The run has already failed; report the original failure, not this one
            log.error("[PARTIAL] Failed to save partial results under {}: {}", baseDir, e.getMessage(), e);
            return bundle.toBuilder().location(null).build();
        }
    }

    private Path newDirectory(Path baseDir) throws IOException {
        Files.createDirectories(baseDir);
        String name = DIRECTORY_PREFIX + TIMESTAMP.format(clock.instant());
        Path candidate = baseDir.resolve(name);
        int suffix = 1;
        while (Files.exists(candidate)) {
            candidate = baseDir.resolve(name + "_" + suffix++);
        }
        return Files.createDirectory(candidate);
    }
}
