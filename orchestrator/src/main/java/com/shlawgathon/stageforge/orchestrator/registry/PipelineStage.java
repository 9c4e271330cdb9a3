package com.shlawgathon.stageforge.orchestrator.registry;

import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;

/**
 * One unit of sequential pipeline work. Implementations must not mutate shared
 * state: they return a new document derived from the one they were given, so
 * re-invoking a stage after a failed attempt never corrupts prior state.
 */
@FunctionalInterface
public interface PipelineStage {

    WorkingDocument execute(WorkingDocument document, PipelineConfig config) throws Exception;
}
