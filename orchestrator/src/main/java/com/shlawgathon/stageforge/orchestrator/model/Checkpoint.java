package com.shlawgathon.stageforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Durable snapshot of pipeline state taken right after a stage succeeded.
 * Immutable once written.
 */
@Value
@Builder
@Jacksonized
public class Checkpoint {

    String checkpointId;

    // Most recently completed stage
    String stageName;

    Instant createdAt;

    PipelineConfig config;

    @Singular("stage")
    List<String> stageSequence;

    // Ordered results up to and including stageName
    @Singular
    List<StageResult> stageResults;

    WorkingDocument workingDocument;

    @JsonIgnore
    public CheckpointIndexEntry toIndexEntry() {
        return CheckpointIndexEntry.builder()
                .checkpointId(checkpointId)
                .stageName(stageName)
                .createdAt(createdAt)
                .build();
    }
}
