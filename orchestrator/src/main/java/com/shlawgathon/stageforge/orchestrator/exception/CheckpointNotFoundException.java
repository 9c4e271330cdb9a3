package com.shlawgathon.stageforge.orchestrator.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class CheckpointNotFoundException extends CheckpointError {

    private final String checkpointId;

    public CheckpointNotFoundException(String checkpointId) {
        super("Checkpoint not found: " + checkpointId, Map.of("checkpointId", checkpointId));
        this.checkpointId = checkpointId;
    }
}
