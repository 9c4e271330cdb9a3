package com.shlawgathon.stageforge.orchestrator.registry;

import com.shlawgathon.stageforge.orchestrator.model.PipelineError;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StageRegistryTest {

    private static final PipelineStage IDENTITY = (document, config) -> document;

    @Test
    void shouldKeepRegistrationOrder() {
        // Given
        StageRegistry registry = StageRegistry.builder()
                .critical("ingestion", IDENTITY)
                .degradable("template_selection", IDENTITY, StageFallback.skip())
                .critical("generation", IDENTITY)
                .build();

        // Then
        assertEquals(List.of("ingestion", "template_selection", "generation"), registry.getStageSequence());
        assertEquals(3, registry.size());
        assertEquals(1, registry.indexOf("template_selection"));
        assertEquals("generation", registry.stageAt(2));
        assertTrue(registry.contains("ingestion"));
        assertFalse(registry.contains("validation"));
    }

    @Test
    void shouldTreatFirstAndLastStagesAsCritical() {
        // Given
        StageRegistry registry = StageRegistry.builder()
                .degradable("first", IDENTITY, StageFallback.skip())
                .degradable("middle", IDENTITY, StageFallback.skip())
                .degradable("last", IDENTITY, StageFallback.skip())
                .build();

        // Then
        assertTrue(registry.policyFor("first").isCritical());
        assertTrue(registry.policyFor("first").isHardCritical());
        assertFalse(registry.policyFor("middle").isCritical());
        assertTrue(registry.policyFor("last").isCritical());
        assertEquals(List.of("first", "last"), registry.criticalStages());
        assertTrue(registry.fallbackFor("first").isEmpty());
        assertTrue(registry.fallbackFor("middle").isPresent());
    }

    @Test
    void shouldFailClosedWithoutFallback() {
        // Given
        StageRegistry registry = StageRegistry.builder()
                .critical("first", IDENTITY)
                .stage("middle", IDENTITY, false, null)
                .critical("last", IDENTITY)
                .build();

        // Then
        StagePolicy policy = registry.policyFor("middle");
        assertFalse(policy.isRegisteredCritical());
        assertTrue(policy.isCritical());
        assertTrue(policy.getFallback().isEmpty());
    }

    @Test
    void shouldHonourRegisteredCriticality() {
        // Given
        StageRegistry registry = StageRegistry.builder()
                .critical("first", IDENTITY)
                .stage("extraction", IDENTITY, true, StageFallback.skip())
                .stage("transformation", IDENTITY, false, StageFallback.skip())
                .critical("last", IDENTITY)
                .build();

        // Then
        assertTrue(registry.policyFor("extraction").isCritical());
        assertTrue(registry.fallbackFor("extraction").isEmpty());
        assertFalse(registry.policyFor("transformation").isCritical());
    }

    @Test
    void shouldRejectInvalidRegistrations() {
        assertThrows(IllegalArgumentException.class, () -> StageRegistry.builder().build());
        assertThrows(IllegalArgumentException.class, () -> StageRegistry.builder().critical(" ", IDENTITY));
        assertThrows(IllegalArgumentException.class, () -> StageRegistry.builder().critical("a", null));
        assertThrows(IllegalArgumentException.class,
                () -> StageRegistry.builder().critical("a", IDENTITY).critical("a", IDENTITY));
    }

    @Test
    void shouldRejectNamesUnsafeForCheckpointFiles() {
        assertThrows(IllegalArgumentException.class, () -> StageRegistry.builder().critical("../escape", IDENTITY));
        assertThrows(IllegalArgumentException.class, () -> StageRegistry.builder().critical("a/b", IDENTITY));
        assertThrows(IllegalArgumentException.class, () -> StageRegistry.builder().critical("..", IDENTITY));
        assertThrows(IllegalArgumentException.class, () -> StageRegistry.builder().critical("with space", IDENTITY));

        StageRegistry registry = StageRegistry.builder().critical("template_selection", IDENTITY)
                .critical("post-process", IDENTITY).build();
        assertEquals(List.of("template_selection", "post-process"), registry.getStageSequence());
    }

    @Test
    void shouldRejectUnknownStageLookups() {
        StageRegistry registry = StageRegistry.builder().critical("only", IDENTITY).build();

        assertThrows(IllegalArgumentException.class, () -> registry.indexOf("other"));
        assertThrows(IllegalArgumentException.class, () -> registry.policyFor("other"));
    }

    @Test
    void shouldApplyFallbacks() {
        // Given
        WorkingDocument input = WorkingDocument.empty().with("title", "Deck");
        PipelineError error = PipelineError.builder().stage("template_selection").message("boom").build();

        // When
        WorkingDocument skipped = StageFallback.skip().apply(input, error);
        WorkingDocument defaulted = StageFallback.defaults(Map.of("selected_template", "minimal")).apply(input, error);

        // Then
        assertSame(input, skipped);
        assertEquals("minimal", defaulted.getString("selected_template").orElseThrow());
        assertEquals("Deck", defaulted.getString("title").orElseThrow());
        assertFalse(input.contains("selected_template"));
    }
}
