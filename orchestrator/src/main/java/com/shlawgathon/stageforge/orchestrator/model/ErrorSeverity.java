package com.shlawgathon.stageforge.orchestrator.model;

/**
 * Severity of a pipeline failure. Used for reporting and sorting only,
 * never to decide retry, abort or degrade.
 */
public enum ErrorSeverity {
    CRITICAL, // Run must stop
    HIGH, // Stage failed, run may stop
    MEDIUM, // Degraded, run continues
    LOW // Warning only
}
