package com.shlawgathon.stageforge.orchestrator.cli;

import com.shlawgathon.stageforge.orchestrator.exception.CheckpointError;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.PipelineError;
import com.shlawgathon.stageforge.orchestrator.model.PipelineRunResult;
import com.shlawgathon.stageforge.orchestrator.retry.CancellationToken;
import com.shlawgathon.stageforge.orchestrator.service.PipelineService;
import com.shlawgathon.stageforge.orchestrator.stage.StageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Runs the pipeline over one input file.
 * Exit codes: 0 succeeded, 1 failed, 2 the run could not start or resume.
 */
@Component
@Command(
        name = "run",
        description = "Run the pipeline, optionally resuming an earlier run",
        mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_SUCCEEDED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_NOT_STARTED = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Input file (Markdown, HTML, plain text or JSON)")
    private Path input;

    @Parameters(index = "1", description = "Output file for the generated presentation outline")
    private Path output;

    @Option(names = "--resume-from", paramLabel = "<stage>",
            description = "Continue after the last checkpoint of this stage")
    private String resumeFrom;

    @Option(names = "--resume-checkpoint", paramLabel = "<id>",
            description = "Continue from a specific checkpoint")
    private String resumeCheckpoint;

    @Option(names = "--stop-after", paramLabel = "<stage>",
            description = "End the run successfully after this stage")
    private String stopAfter;

    @Option(names = "--checkpoint-dir", paramLabel = "<dir>",
            description = "Checkpoint directory (default: configured stageforge.pipeline.checkpoint-dir)")
    private Path checkpointDir;

    @Option(names = "--no-checkpoints", description = "Do not write checkpoints")
    private boolean noCheckpoints;

    @Option(names = "--no-retry", description = "Attempt every stage once")
    private boolean noRetry;

    @Option(names = "--max-retries", paramLabel = "<n>", description = "Attempts per stage")
    private Integer maxRetries;

    @Option(names = "--no-partial-results", description = "Do not save partial results when the run fails")
    private boolean noPartialResults;

    @Option(names = "--template", paramLabel = "<name>", description = "Presentation template")
    private String template;

    @Option(names = "--strict", description = "Fail the run on validation violations")
    private boolean strict;

    @Option(names = "--force-unlock", description = "Remove a stale lock left by a run that died")
    private boolean forceUnlock;

    private final PipelineService pipelineService;

    public RunCommand(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        PipelineConfig config = buildConfig();
        PipelineRunResult result;
        try {
            if (forceUnlock) {
                pipelineService.openStore(Path.of(config.getCheckpointDir())).breakLock();
            }
            result = pipelineService.run(config, CancellationToken.none());
        } catch (CheckpointError | IllegalArgumentException e) {
            log.error("[CLI] Run did not start: {}", e.getMessage());
            err.println("Run did not start: " + e.getMessage());
            return EXIT_NOT_STARTED;
        }

        for (PipelineError error : result.getErrors()) {
            err.print(error.format());
        }

        if (result.isSucceeded()) {
            out.printf("Pipeline SUCCEEDED in %d ms: %d stage result(s), %d degraded, %d checkpoint(s)%n",
                    result.getTotalDurationMs(), result.getStageResults().size(),
                    result.getErrors().size(), result.getCheckpointIds().size());
            out.println("Output: " + output);
            if (result.getManifestPath() != null) {
                out.println("Manifest: " + result.getManifestPath());
            }
            out.flush();
            return EXIT_SUCCEEDED;
        }

        out.printf("Pipeline FAILED at stage %s after %d ms%n",
                result.getTerminalError().map(PipelineError::getStage).orElse("?"), result.getTotalDurationMs());
        result.getPartialResultsPath().ifPresent(path -> out.println("Partial results: " + path));
        if (result.getLastCheckpointId() != null) {
            out.println("Last checkpoint: " + result.getLastCheckpointId());
        }
        out.flush();
        return EXIT_FAILED;
    }

    private PipelineConfig buildConfig() {
        PipelineConfig.PipelineConfigBuilder builder = pipelineService.defaultConfig()
                .inputPath(input.toString())
                .outputPath(output.toString())
                .manifestPath(pipelineService.manifestPathFor(output.toString()))
                .resumeFromStage(resumeFrom)
                .resumeFromCheckpoint(resumeCheckpoint)
                .stopAfterStage(stopAfter);

        if (checkpointDir != null) {
            builder.checkpointDir(checkpointDir.toString());
        }
        if (noCheckpoints) {
            builder.enableCheckpoints(false);
        }
        if (noRetry) {
            builder.enableRetry(false);
        }
        if (maxRetries != null) {
            builder.maxRetryAttempts(maxRetries);
        }
        if (noPartialResults) {
            builder.savePartialResults(false);
        }
        if (template != null) {
            builder.option(StageOptions.TEMPLATE, template);
        }
        if (strict) {
            builder.option(StageOptions.STRICT, true);
        }
        return builder.build();
    }
}
