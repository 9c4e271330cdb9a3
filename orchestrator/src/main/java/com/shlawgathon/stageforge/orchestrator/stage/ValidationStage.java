package com.shlawgathon.stageforge.orchestrator.stage;

import com.shlawgathon.stageforge.orchestrator.exception.ValidationError;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import com.shlawgathon.stageforge.orchestrator.registry.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks slides against the 6x6 rule (at most {@code max_bullets} bullets of at
 * most {@code max_words} words). Violations are recorded in the document; with
 * the {@code strict} option they stop the run instead.
 */
@Component
public class ValidationStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ValidationStage.class);

    public static final String NAME = "validation";

    @Override
    public WorkingDocument execute(WorkingDocument document, PipelineConfig config) {
        int maxBullets = config.intOption(StageOptions.MAX_BULLETS, StageOptions.DEFAULT_MAX_BULLETS);
        int maxWords = config.intOption(StageOptions.MAX_WORDS, StageOptions.DEFAULT_MAX_WORDS);

        List<String> violations = new ArrayList<>();
        List<Map<String, Object>> slides = DocumentValues.mapList(document.get(DocumentKeys.SLIDES).orElse(null));
        if (slides.isEmpty()) {
            violations.add("Deck has no slides");
        }
        for (Map<String, Object> slide : slides) {
            String label = "Slide " + DocumentValues.string(slide, "index");
            if (DocumentValues.string(slide, "title").isBlank()) {
                violations.add(label + ": missing title");
            }
            List<String> bullets = DocumentValues.stringList(slide.get("bullets"));
            if (bullets.size() > maxBullets) {
                violations.add(label + ": " + bullets.size() + " bullets (max " + maxBullets + ")");
            }
            for (String bullet : bullets) {
                int words = bullet.isBlank() ? 0 : bullet.strip().split("\\s+").length;
                if (words > maxWords) {
                    violations.add(label + ": bullet has " + words + " words (max " + maxWords + ")");
                }
            }
        }

        if (!violations.isEmpty() && config.optionEnabled(StageOptions.STRICT)) {
            throw ValidationError.critical(violations.size() + " validation violation(s) in strict mode",
                    Map.of("violations", violations));
        }
        if (!violations.isEmpty()) {
            log.warn("[VALIDATE] {} violation(s) found", violations.size());
        }

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("passed", violations.isEmpty());
        report.put("violation_count", violations.size());
        report.put("violations", violations);
        return document.with(DocumentKeys.VALIDATION, report);
    }
}
