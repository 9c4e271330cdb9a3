package com.shlawgathon.stageforge.orchestrator.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the raw input into a title and headed sections of content items.
 * Each section is a map of {@code heading}, {@code level} and {@code items}.
 */
@Component
public class ExtractionStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ExtractionStage.class);

    public static final String NAME = "extraction";

    private static final String DEFAULT_HEADING = "Introduction";

    private static final Pattern MARKDOWN_HEADING = Pattern.compile("^(#{1,6})\\s+(.*)$");
    private static final Pattern MARKDOWN_ITEM = Pattern.compile("^(?:[-*+]|\\d+[.)])\\s+(.*)$");
    private static final Pattern HTML_BLOCK = Pattern.compile(
            "<(h[1-6]|li|p)\\b[^>]*>(.*?)</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern HTML_IGNORED = Pattern.compile(
            "<(script|style)\\b[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");

    private final ObjectMapper objectMapper;

    public ExtractionStage(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public WorkingDocument execute(WorkingDocument document, PipelineConfig config) {
        String raw = document.require(DocumentKeys.RAW_CONTENT, String.class);
        SourceFormat format = SourceFormat.valueOf(document.require(DocumentKeys.SOURCE_FORMAT, String.class));

        Outline outline;
        switch (format) {
            case MARKDOWN:
                outline = fromMarkdown(raw);
                break;
            case HTML:
                outline = fromHtml(raw);
                break;
            case JSON:
                outline = fromJson(raw);
                break;
            default:
                outline = fromText(raw);
        }

        if (outline.sections.isEmpty()) {
            throw new ValidationError("No content sections found in input", Map.of("format", format.name()));
        }

        log.debug("[EXTRACT] '{}': {} section(s)", outline.title(), outline.sections.size());
        return document
                .with(DocumentKeys.TITLE, outline.title())
                .with(DocumentKeys.SECTIONS, outline.sections)
                .with(DocumentKeys.SECTION_COUNT, outline.sections.size());
    }

    /**
     * Degraded extraction: one section holding every non-blank input line.
     */
    public WorkingDocument basicExtraction(WorkingDocument document) {
        String raw = document.getString(DocumentKeys.RAW_CONTENT).orElse("");
        Outline outline = new Outline();
        for (String line : raw.split("\\R")) {
            if (!line.isBlank()) {
                outline.addItem(line.strip());
            }
        }
        return document
                .with(DocumentKeys.TITLE, outline.title())
                .with(DocumentKeys.SECTIONS, outline.sections)
                .with(DocumentKeys.SECTION_COUNT, outline.sections.size());
    }

    private Outline fromMarkdown(String raw) {
        Outline outline = new Outline();
        for (String line : raw.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher heading = MARKDOWN_HEADING.matcher(trimmed);
            Matcher item = MARKDOWN_ITEM.matcher(trimmed);
            if (heading.matches()) {
                outline.addHeading(heading.group(1).length(), heading.group(2).strip());
            } else if (item.matches()) {
                outline.addItem(item.group(1).strip());
            } else {
                outline.addItem(trimmed);
            }
        }
        return outline;
    }

    private Outline fromHtml(String raw) {
        Outline outline = new Outline();
        Matcher block = HTML_BLOCK.matcher(HTML_IGNORED.matcher(raw).replaceAll(""));
        while (block.find()) {
            String tag = block.group(1).toLowerCase(Locale.ROOT);
            String text = unescape(HTML_TAG.matcher(block.group(2)).replaceAll("")).replaceAll("\\s+", " ").strip();
            if (text.isEmpty()) {
                continue;
            }
            if (tag.startsWith("h")) {
                outline.addHeading(tag.charAt(1) - '0', text);
            } else {
                outline.addItem(text);
            }
        }
        return outline;
    }

    private Outline fromText(String raw) {
        Outline outline = new Outline();
        for (String block : raw.strip().split("\\R\\s*\\R")) {
            String[] lines = block.strip().split("\\R");
            outline.addHeading(2, lines[0].strip());
            for (int i = 1; i < lines.length; i++) {
                if (!lines[i].isBlank()) {
                    outline.addItem(lines[i].strip());
                }
            }
        }
        return outline;
    }

    private Outline fromJson(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw ValidationError.critical("Input JSON is malformed: " + e.getOriginalMessage(),
                    Map.of("line", e.getLocation() != null ? e.getLocation().getLineNr() : -1));
        }

        Outline outline = new Outline();
        if (root.hasNonNull("title")) {
            outline.addHeading(1, root.get("title").asText());
        }
        for (JsonNode section : root.path("sections")) {
            outline.addHeading(2, section.path("heading").asText(""));
            JsonNode items = section.has("items") ? section.get("items") : section.path("bullets");
            for (JsonNode item : items) {
                outline.addItem(item.asText());
            }
        }
        return outline;
    }

    private static String unescape(String text) {
        return text.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&");
    }

    private static final class Outline {
        private String title;
        private final List<Map<String, Object>> sections = new ArrayList<>();
        private Map<String, Object> current;
        private List<String> currentItems;

        void addHeading(int level, String text) {
            if (level == 1 && title == null) {
                title = text;
                return;
            }
            currentItems = new ArrayList<>();
            current = new LinkedHashMap<>();
            current.put("heading", text);
            current.put("level", level);
            current.put("items", currentItems);
            sections.add(current);
        }

        void addItem(String text) {
            if (current == null) {
                addHeading(2, title != null ? title : DEFAULT_HEADING);
            }
            currentItems.add(text);
        }

        String title() {
            if (title != null) {
                return title;
            }
            return sections.isEmpty() ? "Untitled" : DocumentValues.string(sections.get(0), "heading");
        }
    }
}
