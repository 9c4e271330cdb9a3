package com.shlawgathon.stageforge.orchestrator.registry;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fixed, ordered sequence of named stages and the failure policy of each.
 * <p>
 * The first stage (which produces the first usable working document) and the
 * last stage (which emits the final artifact) are critical whatever their
 * registration. Every other stage is degradable unless registered critical, and
 * a degradable stage with no fallback is treated as critical.
 */
public class StageRegistry {

    // Stage names end up in checkpoint file names
    private static final Pattern STAGE_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final Map<String, Registration> registrations;
    private final List<String> sequence;

    private StageRegistry(Map<String, Registration> registrations) {
        if (registrations.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one stage");
        }
        this.registrations = Collections.unmodifiableMap(new LinkedHashMap<>(registrations));
        this.sequence = List.copyOf(registrations.keySet());
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getStageSequence() {
        return sequence;
    }

    public int size() {
        return sequence.size();
    }

    public boolean contains(String stageName) {
        return registrations.containsKey(stageName);
    }

    /**
     * Position of {@code stageName} in the sequence.
     *
     * @throws IllegalArgumentException if the stage is not registered
     */
    public int indexOf(String stageName) {
        int index = sequence.indexOf(stageName);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown stage: " + stageName + " (registered: " + sequence + ")");
        }
        return index;
    }

    public String stageAt(int index) {
        return sequence.get(index);
    }

    public PipelineStage stage(String stageName) {
        return registration(stageName).getStage();
    }

    public StagePolicy policyFor(String stageName) {
        Registration registration = registration(stageName);
        int index = indexOf(stageName);
        boolean hardCritical = index == 0 || index == sequence.size() - 1;
        return new StagePolicy(stageName, index, hardCritical, registration.isCritical(), registration.getFallback());
    }

    /**
     * Stages whose exhausted failure aborts the run.
     */
    public List<String> criticalStages() {
        List<String> critical = new ArrayList<>();
        for (String name : sequence) {
            if (policyFor(name).isCritical()) {
                critical.add(name);
            }
        }
        return critical;
    }

    public Optional<StageFallback> fallbackFor(String stageName) {
        return policyFor(stageName).getFallback();
    }

    private Registration registration(String stageName) {
        Registration registration = registrations.get(stageName);
        if (registration == null) {
            throw new IllegalArgumentException("Unknown stage: " + stageName + " (registered: " + sequence + ")");
        }
        return registration;
    }

    @Value
    private static class Registration {
        PipelineStage stage;
        boolean critical;
        StageFallback fallback;
    }

    /**
     * Collects stages in execution order.
     */
    public static class Builder {

        private final Map<String, Registration> registrations = new LinkedHashMap<>();

        /**
         * Register a stage that aborts the run when it fails.
         */
        public Builder critical(String name, PipelineStage stage) {
            return add(name, stage, true, null);
        }

        /**
         * Register a stage whose failure is masked by {@code fallback}.
         */
        public Builder degradable(String name, PipelineStage stage, StageFallback fallback) {
            return add(name, stage, false, fallback);
        }

        /**
         * Register a stage with explicit criticality; {@code fallback} may be null.
         */
        public Builder stage(String name, PipelineStage stage, boolean critical, StageFallback fallback) {
            return add(name, stage, critical, fallback);
        }

        public StageRegistry build() {
            return new StageRegistry(registrations);
        }

        private Builder add(String name, PipelineStage stage, boolean critical, StageFallback fallback) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Stage name must not be blank");
            }
            if (!STAGE_NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Stage name may only contain letters, digits, '_' and '-': " + name);
            }
            if (stage == null) {
                throw new IllegalArgumentException("Stage '" + name + "' has no implementation");
            }
            if (registrations.containsKey(name)) {
                throw new IllegalArgumentException("Stage registered twice: " + name);
            }
            registrations.put(name, new Registration(stage, critical, fallback));
            return this;
        }
    }
}
