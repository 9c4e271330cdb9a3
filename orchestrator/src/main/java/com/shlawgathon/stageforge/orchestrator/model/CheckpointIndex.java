package com.shlawgathon.stageforge.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Contents of a checkpoint directory's index file, oldest entry first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointIndex {

    @Builder.Default
    private List<CheckpointIndexEntry> checkpoints = new ArrayList<>();

    private Instant lastUpdated;
}
