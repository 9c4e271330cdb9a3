package com.shlawgathon.stageforge.orchestrator.stage;

/**
 * Keys of {@code PipelineConfig.options} read by the reference stages.
 */
public final class StageOptions {

    public static final String TEMPLATE = "template";
    public static final String STRICT = "strict";
    public static final String MAX_BULLETS = "max_bullets";
    public static final String MAX_WORDS = "max_words";

    public static final int DEFAULT_MAX_BULLETS = 6;
    public static final int DEFAULT_MAX_WORDS = 6;

    private StageOptions() {
    }
}
