package com.shlawgathon.stageforge.orchestrator.stage;

import com.shlawgathon.stageforge.orchestrator.exception.TransformationError;
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
 * Turns extracted sections into slides: a title slide, then one content slide
 * per {@code max_bullets} items of each section.
 */
@Component
public class TransformationStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(TransformationStage.class);

    public static final String NAME = "transformation";

    static final String CONTINUED = " (cont.)";

    @Override
    public WorkingDocument execute(WorkingDocument document, PipelineConfig config) {
        int maxBullets = config.intOption(StageOptions.MAX_BULLETS, StageOptions.DEFAULT_MAX_BULLETS);
        if (maxBullets < 1) {
            throw TransformationError.critical("max_bullets must be at least 1", Map.of("maxBullets", maxBullets));
        }

        String title = document.require(DocumentKeys.TITLE, String.class);
        List<Map<String, Object>> sections = DocumentValues.mapList(document.get(DocumentKeys.SECTIONS).orElse(null));
        if (sections.isEmpty()) {
            throw new TransformationError("Working document has no sections to transform");
        }

        List<Map<String, Object>> slides = new ArrayList<>();
        slides.add(slide(slides.size(), "title", title, List.of()));

        for (int i = 0; i < sections.size(); i++) {
            Map<String, Object> section = sections.get(i);
            String heading = DocumentValues.string(section, "heading").strip();
            if (heading.isEmpty()) {
                throw new TransformationError("Section " + (i + 1) + " has no heading", Map.of("sectionIndex", i));
            }
            List<String> items = DocumentValues.stringList(section.get("items"));
            if (items.isEmpty()) {
                slides.add(slide(slides.size(), "section_header", heading, List.of()));
                continue;
            }
            for (int from = 0; from < items.size(); from += maxBullets) {
                List<String> bullets = items.subList(from, Math.min(from + maxBullets, items.size()));
                String slideTitle = from == 0 ? heading : heading + CONTINUED;
                slides.add(slide(slides.size(), "content", slideTitle, bullets));
            }
        }

        log.debug("[TRANSFORM] {} section(s) became {} slide(s)", sections.size(), slides.size());
        return document
                .with(DocumentKeys.SLIDES, slides)
                .with(DocumentKeys.SLIDE_COUNT, slides.size());
    }

    /**
     * Degraded transformation: one slide per section, bullets left unsplit.
     */
    public WorkingDocument directTransformation(WorkingDocument document) {
        List<Map<String, Object>> slides = new ArrayList<>();
        slides.add(slide(0, "title", document.getString(DocumentKeys.TITLE).orElse("Untitled"), List.of()));
        for (Map<String, Object> section : DocumentValues.mapList(document.get(DocumentKeys.SECTIONS).orElse(null))) {
            slides.add(slide(slides.size(), "content", DocumentValues.string(section, "heading"),
                    DocumentValues.stringList(section.get("items"))));
        }
        return document
                .with(DocumentKeys.SLIDES, slides)
                .with(DocumentKeys.SLIDE_COUNT, slides.size());
    }

    private static Map<String, Object> slide(int index, String layout, String title, List<String> bullets) {
        Map<String, Object> slide = new LinkedHashMap<>();
        slide.put("index", index);
        slide.put("layout", layout);
        slide.put("title", title);
        slide.put("bullets", new ArrayList<>(bullets));
        return slide;
    }
}
