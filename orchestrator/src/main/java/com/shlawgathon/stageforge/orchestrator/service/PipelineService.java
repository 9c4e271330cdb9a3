package com.shlawgathon.stageforge.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.stageforge.orchestrator.config.PipelineProperties;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.PipelineRunResult;
import com.shlawgathon.stageforge.orchestrator.registry.StageRegistry;
import com.shlawgathon.stageforge.orchestrator.repository.CheckpointStore;
import com.shlawgathon.stageforge.orchestrator.retry.CancellationToken;
import com.shlawgathon.stageforge.orchestrator.retry.FailureClassifier;
import com.shlawgathon.stageforge.orchestrator.retry.Sleeper;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Entry point for running the configured pipeline: seeds run configs from
 * {@link PipelineProperties} and opens the checkpoint store each run writes to.
 */
@Service
public class PipelineService {

    private final StageRegistry stageRegistry;
    private final PipelineProperties properties;
    private final RemediationCatalog remediationCatalog;
    private final FailureClassifier failureClassifier;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final Clock clock;

    public PipelineService(StageRegistry stageRegistry,
            PipelineProperties properties,
            RemediationCatalog remediationCatalog,
            FailureClassifier failureClassifier,
            ObjectMapper objectMapper,
            Sleeper sleeper,
            Clock clock) {
        this.stageRegistry = stageRegistry;
        this.properties = properties;
        this.remediationCatalog = remediationCatalog;
        this.failureClassifier = failureClassifier;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Config builder preloaded with the configured defaults.
     */
    public PipelineConfig.PipelineConfigBuilder defaultConfig() {
        return PipelineConfig.builder()
                .checkpointDir(properties.getCheckpointDir())
                .partialResultsDir(properties.getPartialResultsDir())
                .enableCheckpoints(properties.isEnableCheckpoints())
                .enableRetry(properties.isEnableRetry())
                .maxRetryAttempts(properties.getMaxRetryAttempts())
                .initialRetryDelay(properties.getInitialRetryDelay())
                .backoffMultiplier(properties.getBackoffMultiplier())
                .checkpointRetention(properties.getCheckpointRetention())
                .savePartialResults(properties.isSavePartialResults());
    }

    /**
     * Manifest location for a run writing {@code outputPath}, or null when
     * manifests are disabled.
     */
    public String manifestPathFor(String outputPath) {
        return properties.isWriteManifest() && outputPath != null ? outputPath + ".manifest.json" : null;
    }

    public PipelineRunResult run(PipelineConfig config, CancellationToken cancellationToken) {
        PipelineRunner runner = PipelineRunner.builder()
                .registry(stageRegistry)
                .store(openStore(Path.of(config.getCheckpointDir()), config.getCheckpointRetention()))
                .remediation(remediationCatalog)
                .classifier(failureClassifier)
                .objectMapper(objectMapper)
                .sleeper(sleeper)
                .clock(clock)
                .pollInterval(properties.getPollInterval())
                .build();
        return runner.run(config, cancellationToken);
    }

    public CheckpointStore openStore(Path checkpointDir) {
        return openStore(checkpointDir, properties.getCheckpointRetention());
    }

    public CheckpointStore openStore(Path checkpointDir, int retention) {
        return new CheckpointStore(checkpointDir, objectMapper, clock, retention);
    }

    public StageRegistry getStageRegistry() {
        return stageRegistry;
    }
}
