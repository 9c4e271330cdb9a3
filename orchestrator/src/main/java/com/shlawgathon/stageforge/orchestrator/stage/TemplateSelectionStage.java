package com.shlawgathon.stageforge.orchestrator.stage;

import com.shlawgathon.stageforge.orchestrator.exception.ValidationError;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import com.shlawgathon.stageforge.orchestrator.registry.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the presentation template: the {@code template} option when given,
 * otherwise one chosen from the shape of the deck.
 */
@Component
public class TemplateSelectionStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(TemplateSelectionStage.class);

    public static final String NAME = "template_selection";

    public static final String FALLBACK_TEMPLATE = "minimal";

    public static final List<String> TEMPLATES = List.of("minimal", "modern", "corporate", "academic");

    private static final int LONG_DECK = 12;

    @Override
    public WorkingDocument execute(WorkingDocument document, PipelineConfig config) {
        Optional<String> requested = config.option(StageOptions.TEMPLATE).map(Object::toString);
        if (requested.isPresent()) {
            String template = requested.get();
            if (!TEMPLATES.contains(template)) {
                throw new ValidationError("Unknown template '" + template + "'",
                        Map.of("template", template, "available", TEMPLATES));
            }
            return selected(document, template, "option");
        }

        List<Map<String, Object>> slides = DocumentValues.mapList(document.get(DocumentKeys.SLIDES).orElse(null));
        String template;
        if (slides.size() > LONG_DECK) {
            template = "academic";
        } else if (slides.stream().anyMatch(slide -> DocumentValues.stringList(slide.get("bullets")).size() > 4)) {
            template = "corporate";
        } else {
            template = "modern";
        }
        return selected(document, template, "auto");
    }

    private static WorkingDocument selected(WorkingDocument document, String template, String source) {
        log.debug("[TEMPLATE] Using '{}' ({})", template, source);
        return document
                .with(DocumentKeys.SELECTED_TEMPLATE, template)
                .with(DocumentKeys.TEMPLATE_SOURCE, source);
    }
}
