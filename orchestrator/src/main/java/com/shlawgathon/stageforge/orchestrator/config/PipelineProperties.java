package com.shlawgathon.stageforge.orchestrator.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Defaults for every run, bound from {@code stageforge.pipeline.*}. Command-line
 * options override them per invocation.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "stageforge.pipeline")
public class PipelineProperties {

    @NotBlank
    private String checkpointDir = ".stageforge/checkpoints";

    // Next to the output file when unset
    private String partialResultsDir;

    private boolean enableCheckpoints = true;

    private boolean enableRetry = true;

    @Min(1)
    @Max(10)
    private int maxRetryAttempts = 3;

    @NotNull
    private Duration initialRetryDelay = Duration.ofSeconds(1);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    @NotNull
    private Duration pollInterval = Duration.ofMillis(100);

    @Min(1)
    private int checkpointRetention = 3;

    private boolean savePartialResults = true;

    /**
     * Write {@code <output>.manifest.json} after every run.
     */
    private boolean writeManifest = true;

    /**
     * Middle stages whose failure stops the run. The first and last stages are
     * always critical.
     */
    @NotNull
    private List<String> criticalStages = new ArrayList<>(List.of("extraction", "transformation"));

    /**
     * Replacement remediation text, keyed by stage name.
     */
    @NotNull
    private Map<String, List<String>> remediation = new LinkedHashMap<>();
}
