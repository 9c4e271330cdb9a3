package com.shlawgathon.stageforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Full parameterization of one pipeline run. Built once by the caller and
 * frozen into every checkpoint the run writes.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PipelineConfig {

    // Locations
    String inputPath;
    String outputPath;
    String checkpointDir;
    String partialResultsDir;
    String manifestPath;

    // Error recovery
    @Builder.Default
    boolean enableCheckpoints = true;

    @Builder.Default
    boolean enableRetry = true;

    @Builder.Default
    int maxRetryAttempts = 3;

    @Builder.Default
    Duration initialRetryDelay = Duration.ofSeconds(1);

    @Builder.Default
    double backoffMultiplier = 2.0;

    @Builder.Default
    int checkpointRetention = 3;

    @Builder.Default
    boolean savePartialResults = true;

    // Resume and early stop
    String resumeFromStage;
    String resumeFromCheckpoint;
    String stopAfterStage;

    // Stage-specific settings, opaque to the orchestrator
    @Singular
    Map<String, Object> options;

    @JsonIgnore
    public boolean isResuming() {
        return resumeFromStage != null || resumeFromCheckpoint != null;
    }

    @JsonIgnore
    public Optional<Object> option(String key) {
        return Optional.ofNullable(options.get(key));
    }

    @JsonIgnore
    public boolean optionEnabled(String key) {
        return option(key).map(value -> Boolean.parseBoolean(value.toString())).orElse(false);
    }

    @JsonIgnore
    public int intOption(String key, int defaultValue) {
        return option(key).map(value -> Integer.parseInt(value.toString())).orElse(defaultValue);
    }

    @JsonIgnore
    public Path input() {
        return Path.of(inputPath);
    }

    @JsonIgnore
    public Path output() {
        return Path.of(outputPath);
    }

    /**
     * Copy of a restored config that keeps its locations and stage options but
     * takes every run-control setting from {@code current}. Resume targets are
     * cleared so the copy can be frozen into new checkpoints.
     */
    public PipelineConfig withRunControlsFrom(PipelineConfig current) {
        return toBuilder()
                .checkpointDir(current.getCheckpointDir() != null ? current.getCheckpointDir() : checkpointDir)
                .partialResultsDir(current.getPartialResultsDir() != null
                        ? current.getPartialResultsDir()
                        : partialResultsDir)
                .manifestPath(current.getManifestPath() != null ? current.getManifestPath() : manifestPath)
                .enableCheckpoints(current.isEnableCheckpoints())
                .enableRetry(current.isEnableRetry())
                .maxRetryAttempts(current.getMaxRetryAttempts())
                .initialRetryDelay(current.getInitialRetryDelay())
                .backoffMultiplier(current.getBackoffMultiplier())
                .checkpointRetention(current.getCheckpointRetention())
                .savePartialResults(current.isSavePartialResults())
                .stopAfterStage(current.getStopAfterStage())
                .resumeFromStage(null)
                .resumeFromCheckpoint(null)
                .build();
    }
}
