package com.shlawgathon.stageforge.orchestrator.stage;

import com.shlawgathon.stageforge.orchestrator.config.JsonConfig;
import com.shlawgathon.stageforge.orchestrator.exception.ValidationError;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionStageTest {

    private final ExtractionStage stage = new ExtractionStage(JsonConfig.pipelineObjectMapper());
    private final PipelineConfig config = PipelineConfig.builder().build();

    @Test
    void shouldSplitMarkdownIntoSections() {
        // Given
        WorkingDocument document = raw(SourceFormat.MARKDOWN,
                "# Quarterly Review\n\n## Highlights\n- Revenue grew\n* Costs fell\n\n## Next Steps\n1. Hire\n");

        // When
        WorkingDocument extracted = stage.execute(document, config);

        // Then
        assertEquals("Quarterly Review", extracted.getString(DocumentKeys.TITLE).orElseThrow());
        List<Map<String, Object>> sections = DocumentValues.mapList(extracted.get(DocumentKeys.SECTIONS).orElseThrow());
        assertEquals(2, sections.size());
        assertEquals("Highlights", sections.get(0).get("heading"));
        assertEquals(List.of("Revenue grew", "Costs fell"), sections.get(0).get("items"));
        assertEquals(List.of("Hire"), sections.get(1).get("items"));
        assertEquals(2, extracted.get(DocumentKeys.SECTION_COUNT).orElseThrow());
    }

    @Test
    void shouldExtractHtmlBlocksAndDropScripts() {
        WorkingDocument document = raw(SourceFormat.HTML,
                "<html><script>var x = '<h2>no</h2>';</script><h1>Deck</h1>"
                        + "<h2>Intro</h2><ul><li>Fish &amp; chips</li><li><b>Bold</b> move</li></ul></html>");

        WorkingDocument extracted = stage.execute(document, config);

        List<Map<String, Object>> sections = DocumentValues.mapList(extracted.get(DocumentKeys.SECTIONS).orElseThrow());
        assertEquals("Deck", extracted.getString(DocumentKeys.TITLE).orElseThrow());
        assertEquals(1, sections.size());
        assertEquals(List.of("Fish & chips", "Bold move"), sections.get(0).get("items"));
    }

    @Test
    void shouldTreatTextParagraphsAsSections() {
        WorkingDocument document = raw(SourceFormat.TEXT, "Goals\nShip it\nTest it\n\nRisks\nScope creep\n");

        WorkingDocument extracted = stage.execute(document, config);

        List<Map<String, Object>> sections = DocumentValues.mapList(extracted.get(DocumentKeys.SECTIONS).orElseThrow());
        assertEquals(2, sections.size());
        assertEquals("Risks", sections.get(1).get("heading"));
        assertEquals("Goals", extracted.getString(DocumentKeys.TITLE).orElseThrow());
    }

    @Test
    void shouldReadJsonOutline() {
        WorkingDocument document = raw(SourceFormat.JSON,
                "{\"title\": \"Plan\", \"sections\": [{\"heading\": \"Now\", \"bullets\": [\"a\", \"b\"]}]}");

        WorkingDocument extracted = stage.execute(document, config);

        List<Map<String, Object>> sections = DocumentValues.mapList(extracted.get(DocumentKeys.SECTIONS).orElseThrow());
        assertEquals("Plan", extracted.getString(DocumentKeys.TITLE).orElseThrow());
        assertEquals(List.of("a", "b"), sections.get(0).get("items"));
    }

    @Test
    void shouldFailCriticallyOnMalformedJson() {
        WorkingDocument document = raw(SourceFormat.JSON, "{\"title\": ");

        ValidationError thrown = assertThrows(ValidationError.class, () -> stage.execute(document, config));

        assertTrue(thrown.isCritical());
    }

    @Test
    void shouldRejectInputWithoutSections() {
        WorkingDocument document = raw(SourceFormat.JSON, "{\"title\": \"Only a title\"}");

        ValidationError thrown = assertThrows(ValidationError.class, () -> stage.execute(document, config));

        assertFalse(thrown.isCritical());
    }

    @Test
    void shouldCollectEveryLineInBasicExtraction() {
        WorkingDocument document = raw(SourceFormat.MARKDOWN, "first line\n\nsecond line\n");

        WorkingDocument extracted = stage.basicExtraction(document);

        List<Map<String, Object>> sections = DocumentValues.mapList(extracted.get(DocumentKeys.SECTIONS).orElseThrow());
        assertEquals(1, sections.size());
        assertEquals(List.of("first line", "second line"), sections.get(0).get("items"));
    }

    private static WorkingDocument raw(SourceFormat format, String content) {
        return WorkingDocument.empty()
                .with(DocumentKeys.SOURCE_FORMAT, format.name())
                .with(DocumentKeys.RAW_CONTENT, content);
    }
}
