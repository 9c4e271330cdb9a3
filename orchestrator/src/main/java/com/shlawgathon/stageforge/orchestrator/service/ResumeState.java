package com.shlawgathon.stageforge.orchestrator.service;

import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.StageResult;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Run state restored from a checkpoint: everything the runner needs to carry on
 * with the stage after the checkpointed one.
 */
@Value
@Builder
public class ResumeState {

    String checkpointId;

    // Last stage the checkpoint covers
    String stageName;

    PipelineConfig config;

    @Singular
    List<StageResult> stageResults;

    WorkingDocument document;

    int nextStageIndex;
}
