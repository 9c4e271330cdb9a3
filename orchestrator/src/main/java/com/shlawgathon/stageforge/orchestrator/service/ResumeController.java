package com.shlawgathon.stageforge.orchestrator.service;

import com.shlawgathon.stageforge.orchestrator.exception.CheckpointError;
import com.shlawgathon.stageforge.orchestrator.model.Checkpoint;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.registry.StageRegistry;
import com.shlawgathon.stageforge.orchestrator.repository.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Positions a run after a previously checkpointed stage. Every failure to do so
 * surfaces as a {@link CheckpointError} before any stage executes.
 */
public class ResumeController {

    private static final Logger log = LoggerFactory.getLogger(ResumeController.class);

    private final StageRegistry registry;
    private final CheckpointStore store;

    public ResumeController(StageRegistry registry, CheckpointStore store) {
        this.registry = registry;
        this.store = store;
    }

    /**
     * Resolve the resume target named by {@code config}.
     */
    public ResumeState resume(PipelineConfig config) {
        if (config.getResumeFromCheckpoint() != null && config.getResumeFromStage() != null) {
            throw new CheckpointError("Resume from a stage or from a checkpoint id, not both", Map.of(
                    "resumeFromStage", config.getResumeFromStage(),
                    "resumeFromCheckpoint", config.getResumeFromCheckpoint()));
        }
        if (config.getResumeFromCheckpoint() != null) {
            return resumeFromCheckpoint(config.getResumeFromCheckpoint());
        }
        if (config.getResumeFromStage() != null) {
            return resumeFromStage(config.getResumeFromStage());
        }
        throw new IllegalArgumentException("Config names no resume target");
    }

    /**
     * Restore the most recent checkpoint taken after {@code stageName} completed.
     * The run continues with the stage that follows it.
     */
    public ResumeState resumeFromStage(String stageName) {
        if (!registry.contains(stageName)) {
            throw new CheckpointError("Cannot resume from unknown stage '" + stageName + "'", Map.of(
                    "stage", stageName,
                    "registeredStages", registry.getStageSequence()));
        }
        Checkpoint checkpoint = store.forStage(stageName)
                .orElseThrow(() -> new CheckpointError("No checkpoint found for stage '" + stageName + "' in "
                        + store.getDirectory() + "; run without resuming to start over", Map.of(
                        "stage", stageName,
                        "checkpointDir", store.getDirectory().toString())));
        return restore(checkpoint);
    }

    /**
     * Restore a specific checkpoint.
     *
     * @throws com.shlawgathon.stageforge.orchestrator.exception.CheckpointNotFoundException if the id is unknown
     */
    public ResumeState resumeFromCheckpoint(String checkpointId) {
        return restore(store.load(checkpointId));
    }

    private ResumeState restore(Checkpoint checkpoint) {
        if (!registry.getStageSequence().equals(checkpoint.getStageSequence())) {
            throw new CheckpointError("Checkpoint " + checkpoint.getCheckpointId()
                    + " was written for a different stage sequence", Map.of(
                    "checkpointSequence", checkpoint.getStageSequence(),
                    "registeredSequence", registry.getStageSequence()));
        }
        if (checkpoint.getConfig() == null || checkpoint.getWorkingDocument() == null) {
            throw new CheckpointError("Checkpoint " + checkpoint.getCheckpointId() + " is incomplete");
        }

        int nextStageIndex = registry.indexOf(checkpoint.getStageName()) + 1;
        log.info("[RESUME] Restored checkpoint {} (after stage {}), continuing at stage {}/{}",
                checkpoint.getCheckpointId(), checkpoint.getStageName(), nextStageIndex + 1, registry.size());

        return ResumeState.builder()
                .checkpointId(checkpoint.getCheckpointId())
                .stageName(checkpoint.getStageName())
                .config(checkpoint.getConfig())
                .stageResults(checkpoint.getStageResults())
                .document(checkpoint.getWorkingDocument())
                .nextStageIndex(nextStageIndex)
                .build();
    }
}
