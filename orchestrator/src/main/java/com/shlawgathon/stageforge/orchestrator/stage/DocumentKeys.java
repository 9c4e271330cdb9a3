package com.shlawgathon.stageforge.orchestrator.stage;

/**
 * Working-document entries shared by the reference stages.
 */
public final class DocumentKeys {

    // ingestion
    public static final String SOURCE_PATH = "source_path";
    public static final String SOURCE_FORMAT = "source_format";
    public static final String RAW_CONTENT = "raw_content";

    // extraction
    public static final String TITLE = "title";
    public static final String SECTIONS = "sections";
    public static final String SECTION_COUNT = "section_count";

    // transformation
    public static final String SLIDES = "slides";
    public static final String SLIDE_COUNT = "slide_count";

    // template_selection
    public static final String SELECTED_TEMPLATE = "selected_template";
    public static final String TEMPLATE_SOURCE = "template_source";

    // validation
    public static final String VALIDATION = "validation";

    // generation
    public static final String OUTPUT_PATH = "output_path";

    private DocumentKeys() {
    }
}
