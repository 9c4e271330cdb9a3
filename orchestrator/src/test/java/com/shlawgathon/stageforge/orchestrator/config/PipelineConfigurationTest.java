package com.shlawgathon.stageforge.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.stageforge.orchestrator.exception.ValidationError;
import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;
import com.shlawgathon.stageforge.orchestrator.model.PipelineError;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import com.shlawgathon.stageforge.orchestrator.registry.StageRegistry;
import com.shlawgathon.stageforge.orchestrator.stage.DocumentKeys;
import com.shlawgathon.stageforge.orchestrator.stage.ExtractionStage;
import com.shlawgathon.stageforge.orchestrator.stage.GenerationStage;
import com.shlawgathon.stageforge.orchestrator.stage.IngestionStage;
import com.shlawgathon.stageforge.orchestrator.stage.TemplateSelectionStage;
import com.shlawgathon.stageforge.orchestrator.stage.TransformationStage;
import com.shlawgathon.stageforge.orchestrator.stage.ValidationStage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigurationTest {

    private final ObjectMapper objectMapper = JsonConfig.pipelineObjectMapper();

    @Test
    void shouldRegisterReferenceStagesInOrder() {
        StageRegistry registry = registry(new PipelineProperties());

        assertEquals(List.of("ingestion", "extraction", "transformation", "template_selection", "validation",
                "generation"), registry.getStageSequence());
    }

    @Test
    void shouldTreatConfiguredStagesAsCritical() {
        // Given
        PipelineProperties properties = new PipelineProperties();

        // When
        StageRegistry registry = registry(properties);

        // Then
        assertEquals(List.of("ingestion", "extraction", "transformation", "generation"), registry.criticalStages());
        assertTrue(registry.fallbackFor("template_selection").isPresent());
        assertTrue(registry.fallbackFor("validation").isPresent());
    }

    @Test
    void shouldDegradeExtractionAndTransformationWhenNotListedCritical() {
        // Given
        PipelineProperties properties = new PipelineProperties();
        properties.setCriticalStages(new ArrayList<>());

        // When
        StageRegistry registry = registry(properties);

        // Then
        assertEquals(List.of("ingestion", "generation"), registry.criticalStages());
        assertFalse(registry.policyFor("extraction").isCritical());
        assertFalse(registry.policyFor("transformation").isCritical());
    }

    @Test
    void shouldFallBackToMinimalTemplate() {
        // Given
        StageRegistry registry = registry(new PipelineProperties());
        WorkingDocument document = WorkingDocument.empty().with(DocumentKeys.TITLE, "Deck");

        // When
        WorkingDocument degraded = registry.fallbackFor("template_selection").orElseThrow()
                .apply(document, error("template_selection"));

        // Then
        assertEquals("minimal", degraded.getString(DocumentKeys.SELECTED_TEMPLATE).orElseThrow());
        assertEquals("fallback", degraded.getString(DocumentKeys.TEMPLATE_SOURCE).orElseThrow());
        assertEquals("Deck", degraded.getString(DocumentKeys.TITLE).orElseThrow());
    }

    @Test
    void shouldSkipValidationOnFallback() {
        StageRegistry registry = registry(new PipelineProperties());
        WorkingDocument document = WorkingDocument.empty().with(DocumentKeys.TITLE, "Deck");

        WorkingDocument degraded = registry.fallbackFor("validation").orElseThrow()
                .apply(document, error("validation"));

        assertSame(document, degraded);
    }

    private StageRegistry registry(PipelineProperties properties) {
        return new PipelineConfiguration().stageRegistry(
                new IngestionStage(),
                new ExtractionStage(objectMapper),
                new TransformationStage(),
                new TemplateSelectionStage(),
                new ValidationStage(),
                new GenerationStage(objectMapper),
                properties);
    }

    private static PipelineError error(String stage) {
        return PipelineError.builder()
                .stage(stage)
                .errorType(ValidationError.class.getSimpleName())
                .message("boom")
                .recoverable(true)
                .severity(ErrorSeverity.MEDIUM)
                .attempts(3)
                .timestamp(Instant.now())
                .build();
    }
}
