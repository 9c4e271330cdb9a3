package com.shlawgathon.stageforge.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * What a person needs to pick a failed run back up without re-executing
 * completed work.
 */
@Value
@Builder
@Jacksonized
public class RecoveryInfo {

    String failedStage;

    // Stage that runs first when the run is resumed
    String resumePoint;

    String lastCompletedStage;
    String lastCheckpointId;

    @Singular("stageCompleted")
    List<String> stagesCompleted;

    Instant createdAt;

    @Singular
    List<String> recoverySuggestions;
}
