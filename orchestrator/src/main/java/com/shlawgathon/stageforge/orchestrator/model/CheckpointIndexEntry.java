package com.shlawgathon.stageforge.orchestrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One line of the checkpoint index.
 */
@Value
@Builder
@Jacksonized
public class CheckpointIndexEntry {
    String checkpointId;
    String stageName;
    Instant createdAt;
}
