package com.shlawgathon.stageforge.orchestrator.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.stageforge.orchestrator.exception.GenerationError;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import com.shlawgathon.stageforge.orchestrator.registry.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the presentation outline to the configured output path as JSON.
 */
@Component
public class GenerationStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(GenerationStage.class);

    public static final String NAME = "generation";

    private final ObjectMapper objectMapper;

    public GenerationStage(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public WorkingDocument execute(WorkingDocument document, PipelineConfig config) {
        if (config.getOutputPath() == null) {
            throw GenerationError.critical("No output file configured", Map.of());
        }
        List<Map<String, Object>> slides = DocumentValues.mapList(document.get(DocumentKeys.SLIDES).orElse(null));
        if (slides.isEmpty()) {
            throw GenerationError.critical("Nothing to generate: the deck has no slides", Map.of());
        }

        Map<String, Object> presentation = new LinkedHashMap<>();
        presentation.put("title", document.getString(DocumentKeys.TITLE).orElse("Untitled"));
        presentation.put("template", document.getString(DocumentKeys.SELECTED_TEMPLATE)
                .orElse(TemplateSelectionStage.FALLBACK_TEMPLATE));
        presentation.put("slide_count", slides.size());
        presentation.put("slides", slides);
        document.get(DocumentKeys.VALIDATION).ifPresent(report -> presentation.put("validation", report));

        Path output = config.output();
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(output.toFile(), presentation);
        } catch (IOException e) {
            throw new GenerationError("Failed to write presentation to " + output, e,
                    Map.of("outputPath", output.toString()));
        }

        log.info("[GENERATE] Wrote {} slide(s) to {}", slides.size(), output);
        return document.with(DocumentKeys.OUTPUT_PATH, output.toString());
    }
}
