package com.shlawgathon.stageforge.orchestrator.model;

/**
 * Terminal state of a pipeline run.
 */
public enum RunStatus {
    SUCCEEDED,
    FAILED
}
