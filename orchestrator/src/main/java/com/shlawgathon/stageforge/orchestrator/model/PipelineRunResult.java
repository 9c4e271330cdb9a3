package com.shlawgathon.stageforge.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Terminal value of a pipeline run.
 */
@Value
@Builder
public class PipelineRunResult {

    String runId;
    RunStatus status;

    @Singular
    List<StageResult> stageResults;

    WorkingDocument finalDocument;

    // Non-fatal errors on success, the terminal error last on failure
    @Singular
    List<PipelineError> errors;

    @Singular
    List<String> checkpointIds;

    String lastCompletedStage;
    String lastCheckpointId;
    int recoveredErrors;
    long totalDurationMs;

    PartialResultBundle partialResults;
    Path manifestPath;

    public boolean isSucceeded() {
        return status == RunStatus.SUCCEEDED;
    }

    public Optional<PipelineError> getTerminalError() {
        return status == RunStatus.FAILED && !errors.isEmpty()
                ? Optional.of(errors.get(errors.size() - 1))
                : Optional.empty();
    }

    public Optional<Path> getPartialResultsPath() {
        return Optional.ofNullable(partialResults).map(PartialResultBundle::getLocation);
    }
}
