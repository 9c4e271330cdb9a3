package com.shlawgathon.stageforge.orchestrator.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.stageforge.orchestrator.config.JsonConfig;
import com.shlawgathon.stageforge.orchestrator.config.PipelineConfiguration;
import com.shlawgathon.stageforge.orchestrator.config.PipelineProperties;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.PipelineError;
import com.shlawgathon.stageforge.orchestrator.model.PipelineRunResult;
import com.shlawgathon.stageforge.orchestrator.model.StageResult;
import com.shlawgathon.stageforge.orchestrator.repository.CheckpointStore;
import com.shlawgathon.stageforge.orchestrator.retry.RecordingSleeper;
import com.shlawgathon.stageforge.orchestrator.service.PipelineRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the six reference stages end to end over real files.
 */
class ReferencePipelineTest {

    private static final String DECK = String.join("\n",
            "# Quarterly Review",
            "",
            "## Highlights",
            "- Revenue grew ten percent",
            "- Two new regions launched",
            "",
            "## Next Steps",
            "- Hire three engineers",
            "");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = JsonConfig.pipelineObjectMapper();

    private PipelineRunner runner;
    private Path input;
    private Path output;

    @BeforeEach
    void setUp() throws Exception {
        input = tempDir.resolve("deck.md");
        output = tempDir.resolve("out/deck.json");
        Files.writeString(input, DECK);

        runner = PipelineRunner.builder()
                .registry(new PipelineConfiguration().stageRegistry(
                        new IngestionStage(),
                        new ExtractionStage(objectMapper),
                        new TransformationStage(),
                        new TemplateSelectionStage(),
                        new ValidationStage(),
                        new GenerationStage(objectMapper),
                        new PipelineProperties()))
                .store(new CheckpointStore(tempDir.resolve("checkpoints"), objectMapper, Clock.systemUTC(), 10))
                .objectMapper(objectMapper)
                .sleeper(new RecordingSleeper())
                .build();
    }

    @Test
    void shouldGeneratePresentationFromMarkdown() throws Exception {
        // When
        PipelineRunResult result = runner.run(config().build());

        // Then
        assertTrue(result.isSucceeded());
        assertEquals(6, result.getStageResults().size());
        assertEquals(6, result.getCheckpointIds().size());
        assertTrue(result.getErrors().isEmpty());

        JsonNode presentation = objectMapper.readTree(output.toFile());
        assertEquals("Quarterly Review", presentation.get("title").asText());
        assertEquals("modern", presentation.get("template").asText());
        assertEquals(3, presentation.get("slide_count").asInt());
        assertEquals("Hire three engineers", presentation.get("slides").get(2).get("bullets").get(0).asText());
        assertTrue(presentation.get("validation").get("passed").asBoolean());
    }

    @Test
    void shouldFallBackToMinimalTemplateForUnknownTemplate() throws Exception {
        // When
        PipelineRunResult result = runner.run(config().option(StageOptions.TEMPLATE, "neon").build());

        // Then
        assertTrue(result.isSucceeded());
        assertEquals(1, result.getErrors().size());
        PipelineError error = result.getErrors().get(0);
        assertEquals("template_selection", error.getStage());
        assertEquals(3, error.getAttempts());
        assertTrue(error.isRecoverable());

        StageResult degraded = result.getStageResults().get(3);
        assertTrue(degraded.isDegraded());
        assertEquals(6, result.getCheckpointIds().size());
        assertEquals("minimal", objectMapper.readTree(output.toFile()).get("template").asText());
    }

    @Test
    void shouldStopOnStrictValidationFailure() throws Exception {
        // Given
        Files.writeString(input, "# Deck\n\n## Wordy\n- one two three four five six seven eight\n");

        // When
        PipelineRunResult result = runner.run(config().option(StageOptions.STRICT, true).build());

        // Then
        assertFalse(result.isSucceeded());
        PipelineError error = result.getTerminalError().orElseThrow();
        assertEquals("validation", error.getStage());
        assertEquals("ValidationError", error.getErrorType());
        assertEquals(1, error.getAttempts());
        assertEquals(4, result.getCheckpointIds().size());
        assertFalse(Files.exists(output));
        assertTrue(result.getPartialResultsPath().isPresent());
    }

    @Test
    void shouldFailWithoutCheckpointWhenInputIsMissing() throws Exception {
        // Given
        Files.delete(input);

        // When
        PipelineRunResult result = runner.run(config().build());

        // Then
        PipelineError error = result.getTerminalError().orElseThrow();
        assertEquals("ingestion", error.getStage());
        assertEquals("CriticalError", error.getErrorType());
        assertTrue(result.getCheckpointIds().isEmpty());
        assertTrue(error.getSuggestions().contains(
                "No checkpoint was written before this failure; fix the issue and run from the start"));
    }

    @Test
    void shouldKeepStageOptionsOfRestoredCheckpoint() throws Exception {
        // Given
        Files.writeString(input, "# Deck\n\n## Wordy\n- one two three four five six seven eight\n");
        PipelineRunResult failed = runner.run(config().option(StageOptions.STRICT, true).build());

        // When
        PipelineRunResult resumed = runner.run(config().resumeFromCheckpoint(failed.getLastCheckpointId()).build());

        // Then
        assertFalse(failed.isSucceeded());
        assertFalse(resumed.isSucceeded());
        assertEquals("validation", resumed.getTerminalError().orElseThrow().getStage());
        assertEquals(failed.getLastCheckpointId(), resumed.getLastCheckpointId());
        assertTrue(resumed.getCheckpointIds().isEmpty());
    }

    private PipelineConfig.PipelineConfigBuilder config() {
        return PipelineConfig.builder()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .checkpointDir(tempDir.resolve("checkpoints").toString())
                .partialResultsDir(tempDir.resolve("partial").toString())
                .initialRetryDelay(Duration.ofMillis(10));
    }
}
