package com.shlawgathon.stageforge.orchestrator.stage;

import com.shlawgathon.stageforge.orchestrator.exception.CriticalError;
import com.shlawgathon.stageforge.orchestrator.exception.ValidationError;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import com.shlawgathon.stageforge.orchestrator.registry.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the input file into the working document.
 */
@Component
public class IngestionStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(IngestionStage.class);

    public static final String NAME = "ingestion";

    @Override
    public WorkingDocument execute(WorkingDocument document, PipelineConfig config) throws IOException {
        if (config.getInputPath() == null) {
            throw new CriticalError("No input file configured");
        }
        Path input = config.input();
        if (!Files.isRegularFile(input)) {
            throw new CriticalError("Input file not found: " + input, Map.of("inputPath", input.toString()));
        }
        SourceFormat format = SourceFormat.fromPath(input)
                .orElseThrow(() -> new CriticalError("Unsupported input format: " + input.getFileName(),
                        Map.of("inputPath", input.toString())));

        String content;
        try {
            content = Files.readString(input, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw ValidationError.critical("Input file is not valid UTF-8: " + input,
                    Map.of("inputPath", input.toString()));
        }
        if (content.isBlank()) {
            throw ValidationError.critical("Input file is empty: " + input, Map.of("inputPath", input.toString()));
        }

        log.debug("[INGEST] Read {} characters of {} from {}", content.length(), format, input);
        return document
                .with(DocumentKeys.SOURCE_PATH, input.toString())
                .with(DocumentKeys.SOURCE_FORMAT, format.name())
                .with(DocumentKeys.RAW_CONTENT, content);
    }
}
