package com.shlawgathon.stageforge.orchestrator.service;

import com.shlawgathon.stageforge.orchestrator.exception.CheckpointError;
import com.shlawgathon.stageforge.orchestrator.exception.CriticalError;
import com.shlawgathon.stageforge.orchestrator.exception.GenerationError;
import com.shlawgathon.stageforge.orchestrator.exception.TransformationError;
import com.shlawgathon.stageforge.orchestrator.exception.ValidationError;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Human-readable remediation text attached to every recorded failure, looked up
 * by stage name and then refined by the failure's type.
 */
public class RemediationCatalog {

    private static final Map<String, List<String>> DEFAULT_STAGE_SUGGESTIONS = new LinkedHashMap<>();

    static {
        DEFAULT_STAGE_SUGGESTIONS.put("ingestion", List.of(
                "Check that the input file exists and is readable",
                "Verify the file format is supported (Markdown, HTML, plain text, JSON)",
                "Ensure the file is not corrupted or empty"));
        DEFAULT_STAGE_SUGGESTIONS.put("extraction", List.of(
                "Check input content structure and formatting",
                "Try simplifying complex nested structures",
                "Verify content encoding (UTF-8 expected)"));
        DEFAULT_STAGE_SUGGESTIONS.put("transformation", List.of(
                "Review semantic structure for invalid data",
                "Check that all required fields are present",
                "Reduce content complexity if transformation times out"));
        DEFAULT_STAGE_SUGGESTIONS.put("template_selection", List.of(
                "Specify a template explicitly using the --template option",
                "Check that the template name is one of the known templates"));
        DEFAULT_STAGE_SUGGESTIONS.put("validation", List.of(
                "Review validation errors for specific issues",
                "Run without --strict to report violations without failing",
                "Check slide content against the 6x6 rule"));
        DEFAULT_STAGE_SUGGESTIONS.put("generation", List.of(
                "Check that the output directory is writable",
                "Ensure the presentation structure is valid",
                "Try with a different template"));
    }

    private static final List<String> GENERIC_SUGGESTIONS = List.of(
            "Inspect the stage input in the partial results for unexpected data");

    private final Map<String, List<String>> stageSuggestions;

    public RemediationCatalog(Map<String, List<String>> overrides) {
        Map<String, List<String>> merged = new LinkedHashMap<>(DEFAULT_STAGE_SUGGESTIONS);
        if (overrides != null) {
            overrides.forEach((stage, lines) -> merged.put(stage, List.copyOf(lines)));
        }
        this.stageSuggestions = merged;
    }

    public static RemediationCatalog defaults() {
        return new RemediationCatalog(Map.of());
    }

    /**
     * Suggestions for {@code failure} raised by {@code stageName}: the stage's own
     * list followed by any hint specific to the failure type.
     */
    public List<String> suggestionsFor(String stageName, Throwable failure) {
        List<String> suggestions = new ArrayList<>(stageSuggestions.getOrDefault(stageName, GENERIC_SUGGESTIONS));

        if (failure instanceof ValidationError validation && !validation.getViolations().isEmpty()) {
            suggestions.add("Fix the " + validation.getViolations().size() + " reported violation(s) in the source content");
        } else if (failure instanceof TransformationError) {
            suggestions.add("Check the extracted sections for headings without content");
        } else if (failure instanceof GenerationError) {
            suggestions.add("Remove any partially written output file before retrying");
        } else if (failure instanceof CheckpointError) {
            suggestions.add("Check that the checkpoint directory is writable and not locked by another run");
        } else if (failure instanceof CriticalError) {
            suggestions.add("This failure is never retried; fix its cause before running again");
        } else if (failure instanceof IOException || failure instanceof UncheckedIOException) {
            suggestions.add("Check file permissions and free disk space");
        }
        return suggestions;
    }

    public List<String> stageSuggestions(String stageName) {
        return stageSuggestions.getOrDefault(stageName, GENERIC_SUGGESTIONS);
    }
}
