package com.shlawgathon.stageforge.orchestrator.config;

import com.shlawgathon.stageforge.orchestrator.registry.StageFallback;
import com.shlawgathon.stageforge.orchestrator.registry.StageRegistry;
import com.shlawgathon.stageforge.orchestrator.retry.FailureClassifier;
import com.shlawgathon.stageforge.orchestrator.retry.Sleeper;
import com.shlawgathon.stageforge.orchestrator.service.RemediationCatalog;
import com.shlawgathon.stageforge.orchestrator.stage.DocumentKeys;
import com.shlawgathon.stageforge.orchestrator.stage.ExtractionStage;
import com.shlawgathon.stageforge.orchestrator.stage.GenerationStage;
import com.shlawgathon.stageforge.orchestrator.stage.IngestionStage;
import com.shlawgathon.stageforge.orchestrator.stage.TemplateSelectionStage;
import com.shlawgathon.stageforge.orchestrator.stage.TransformationStage;
import com.shlawgathon.stageforge.orchestrator.stage.ValidationStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Wires the reference stage sequence and the collaborators every run shares.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    /**
     * ingestion, extraction, transformation, template_selection, validation, generation.
     * Extraction and transformation are critical when listed in
     * {@code stageforge.pipeline.critical-stages}; otherwise they degrade to a
     * simpler rendition of their output.
     */
    @Bean
    public StageRegistry stageRegistry(IngestionStage ingestion, ExtractionStage extraction,
            TransformationStage transformation, TemplateSelectionStage templateSelection,
            ValidationStage validation, GenerationStage generation, PipelineProperties properties) {
        List<String> critical = properties.getCriticalStages();

        StageRegistry registry = StageRegistry.builder()
                .critical(IngestionStage.NAME, ingestion)
                .stage(ExtractionStage.NAME, extraction, critical.contains(ExtractionStage.NAME),
                        (document, error) -> extraction.basicExtraction(document))
                .stage(TransformationStage.NAME, transformation, critical.contains(TransformationStage.NAME),
                        (document, error) -> transformation.directTransformation(document))
                .stage(TemplateSelectionStage.NAME, templateSelection,
                        critical.contains(TemplateSelectionStage.NAME),
                        StageFallback.defaults(Map.of(
                                DocumentKeys.SELECTED_TEMPLATE, TemplateSelectionStage.FALLBACK_TEMPLATE,
                                DocumentKeys.TEMPLATE_SOURCE, "fallback")))
                .stage(ValidationStage.NAME, validation, critical.contains(ValidationStage.NAME),
                        StageFallback.skip())
                .critical(GenerationStage.NAME, generation)
                .build();

        log.info("[CONFIG] Stages: {} (critical: {})", registry.getStageSequence(), registry.criticalStages());
        return registry;
    }

    @Bean
    public RemediationCatalog remediationCatalog(PipelineProperties properties) {
        return new RemediationCatalog(properties.getRemediation());
    }

    @Bean
    public FailureClassifier failureClassifier() {
        return new FailureClassifier();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
