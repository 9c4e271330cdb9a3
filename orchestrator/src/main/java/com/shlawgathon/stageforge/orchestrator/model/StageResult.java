package com.shlawgathon.stageforge.orchestrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Outcome of one stage. A degraded result carries the document produced by the
 * stage's fallback and is never checkpointed.
 */
@Value
@Builder
@Jacksonized
public class StageResult {

    String stageName;
    int stageIndex;
    int attempts;
    long durationMs;
    boolean success;
    boolean degraded;

    // Serialized working document the stage produced
    WorkingDocument output;

    String inputHash;
    String outputHash;
    Instant completedAt;
}
