package com.shlawgathon.stageforge.orchestrator.service;

import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import com.shlawgathon.stageforge.orchestrator.registry.PipelineStage;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Deterministic test stage: marks the document with its name, after failing a
 * scripted number of times.
 */
class ScriptedStage implements PipelineStage {

    private static final int ALWAYS = -1;

    private final String name;
    private final int failures;
    private final Supplier<? extends Throwable> failure;
    private final AtomicInteger calls = new AtomicInteger();

    private ScriptedStage(String name, int failures, Supplier<? extends Throwable> failure) {
        this.name = name;
        this.failures = failures;
        this.failure = failure;
    }

    static ScriptedStage succeeding(String name) {
        return new ScriptedStage(name, 0, null);
    }

    static ScriptedStage failingAlways(String name, Supplier<? extends Exception> failure) {
        return new ScriptedStage(name, ALWAYS, failure);
    }

    static ScriptedStage raisingAlways(String name, Supplier<? extends Error> error) {
        return new ScriptedStage(name, ALWAYS, error);
    }

    static ScriptedStage failingTimes(String name, int times, Supplier<? extends Exception> failure) {
        return new ScriptedStage(name, times, failure);
    }

    @Override
    public WorkingDocument execute(WorkingDocument document, PipelineConfig config) throws Exception {
        int call = calls.incrementAndGet();
        if (failure != null && (failures == ALWAYS || call <= failures)) {
            Throwable thrown = failure.get();
            if (thrown instanceof Error error) {
                throw error;
            }
            throw (Exception) thrown;
        }
        return document
                .with(name, "done")
                .with(name + "_saw", document.size());
    }

    int getCalls() {
        return calls.get();
    }
}
