package com.shlawgathon.stageforge.orchestrator.registry;

import com.shlawgathon.stageforge.orchestrator.model.PipelineError;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;

import java.util.Map;

/**
 * Continuation applied when a degradable stage fails for good. Receives the
 * document the stage was given and the error that was recorded.
 */
@FunctionalInterface
public interface StageFallback {

    WorkingDocument apply(WorkingDocument document, PipelineError error);

    /**
     * Continue with the stage's input unchanged.
     */
    static StageFallback skip() {
        return (document, error) -> document;
    }

    /**
     * Continue with {@code defaults} filled into the stage's input.
     */
    static StageFallback defaults(Map<String, ?> defaults) {
        Map<String, ?> values = Map.copyOf(defaults);
        return (document, error) -> document.withAll(values);
    }
}
