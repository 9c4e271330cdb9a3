package com.shlawgathon.stageforge.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Processing log of one run: which stages ran, what they consumed and
 * produced, and how the run ended.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunManifest {

    private String runId;
    private RunStatus status;

    private Instant startedAt;
    private Instant finishedAt;
    private long totalDurationMs;

    private PipelineConfig config;

    // Set when the run continued from a checkpoint
    private String resumedFromCheckpoint;

    @Builder.Default
    private List<ManifestStep> steps = new ArrayList<>();

    private int recoveredErrors;
    private int warnings;
    private int errors;

    /**
     * Processing record of a single stage.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ManifestStep {
        private String stage;
        private Instant completedAt;
        private long durationMs;
        private String inputHash;
        private String outputHash;
        private boolean success;
        private boolean degraded;
        private int attempts;

        @Builder.Default
        private List<String> errors = new ArrayList<>();
    }
}
