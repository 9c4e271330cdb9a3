package com.shlawgathon.stageforge.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Structured failure record. Fatal and degraded failures share this shape; which
 * one it was follows from the status of the run that recorded it.
 */
@Value
@Builder
@Jacksonized
public class PipelineError {

    private static final String RULE = "=".repeat(70);

    String stage;
    String errorType;
    String message;

    @Singular("contextEntry")
    Map<String, Object> context;

    boolean recoverable;

    @Singular
    List<String> suggestions;

    String trace;

    @Builder.Default
    ErrorSeverity severity = ErrorSeverity.HIGH;

    @Builder.Default
    int attempts = 1;

    @Builder.Default
    Instant timestamp = Instant.now();

    /**
     * Render the error for a terminal.
     */
    public String format() {
        StringBuilder out = new StringBuilder()
                .append('\n').append(RULE).append('\n')
                .append("ERROR in stage: ").append(stage).append('\n')
                .append("Type: ").append(errorType).append(" (").append(severity).append(")\n")
                .append(RULE).append("\n\n")
                .append(message).append('\n');

        if (!context.isEmpty()) {
            out.append("\nContext:\n");
            context.forEach((key, value) -> out.append("  ").append(key).append(": ").append(value).append('\n'));
        }

        if (!suggestions.isEmpty()) {
            out.append("\nSuggestions:\n");
            for (int i = 0; i < suggestions.size(); i++) {
                out.append("  ").append(i + 1).append(". ").append(suggestions.get(i)).append('\n');
            }
        }

        out.append("\nAttempts: ").append(attempts)
                .append("\nRecoverable: ").append(recoverable ? "Yes" : "No")
                .append('\n').append(RULE).append('\n');
        return out.toString();
    }
}
