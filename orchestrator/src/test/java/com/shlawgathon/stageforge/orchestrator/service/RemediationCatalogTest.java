package com.shlawgathon.stageforge.orchestrator.service;

import com.shlawgathon.stageforge.orchestrator.exception.CriticalError;
import com.shlawgathon.stageforge.orchestrator.exception.ValidationError;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RemediationCatalogTest {

    @Test
    void shouldReturnStageSuggestionsForPlainFailure() {
        // Given
        RemediationCatalog catalog = RemediationCatalog.defaults();

        // When
        List<String> suggestions = catalog.suggestionsFor("ingestion", new IllegalStateException("bad"));

        // Then
        assertEquals(catalog.stageSuggestions("ingestion"), suggestions);
        assertEquals("Check that the input file exists and is readable", suggestions.get(0));
    }

    @Test
    void shouldAppendViolationHintForValidationErrors() {
        RemediationCatalog catalog = RemediationCatalog.defaults();
        ValidationError error = ValidationError.critical("2 violations",
                Map.of("violations", List.of("Slide 1: too long", "Slide 2: too long")));

        List<String> suggestions = catalog.suggestionsFor("validation", error);

        assertEquals(4, suggestions.size());
        assertEquals("Fix the 2 reported violation(s) in the source content", suggestions.get(3));
    }

    @Test
    void shouldAppendTypeHints() {
        RemediationCatalog catalog = RemediationCatalog.defaults();

        assertTrue(catalog.suggestionsFor("generation", new IOException("disk full"))
                .contains("Check file permissions and free disk space"));
        assertTrue(catalog.suggestionsFor("extraction", new CriticalError("stop"))
                .contains("This failure is never retried; fix its cause before running again"));
    }

    @Test
    void shouldUseGenericSuggestionsForUnknownStage() {
        RemediationCatalog catalog = RemediationCatalog.defaults();

        assertEquals(List.of("Inspect the stage input in the partial results for unexpected data"),
                catalog.suggestionsFor("publishing", new RuntimeException("x")));
    }

    @Test
    void shouldPreferConfiguredOverrides() {
        // Given
        RemediationCatalog catalog = new RemediationCatalog(Map.of("ingestion", List.of("Ask the data team")));

        // Then
        assertEquals(List.of("Ask the data team"), catalog.stageSuggestions("ingestion"));
        assertEquals(RemediationCatalog.defaults().stageSuggestions("generation"),
                catalog.stageSuggestions("generation"));
    }
}
