package com.shlawgathon.stageforge.orchestrator.registry;

import lombok.Value;

import java.util.Optional;

/**
 * Failure policy of one registered stage, as seen by the runner.
 */
@Value
public class StagePolicy {

    String stageName;
    int index;

    // First or last stage of the sequence
    boolean hardCritical;

    boolean registeredCritical;

    StageFallback fallback;

    /**
     * Whether an exhausted failure of this stage aborts the run. A degradable
     * stage without a fallback fails closed.
     */
    public boolean isCritical() {
        return hardCritical || registeredCritical || fallback == null;
    }

    public Optional<StageFallback> getFallback() {
        return isCritical() ? Optional.empty() : Optional.of(fallback);
    }
}
