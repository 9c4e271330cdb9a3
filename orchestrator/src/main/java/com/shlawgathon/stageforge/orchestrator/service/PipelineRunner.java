package com.shlawgathon.stageforge.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.stageforge.orchestrator.config.JsonConfig;
import com.shlawgathon.stageforge.orchestrator.exception.CriticalError;
import com.shlawgathon.stageforge.orchestrator.exception.PipelineException;
import com.shlawgathon.stageforge.orchestrator.exception.RetryCancelledException;
import com.shlawgathon.stageforge.orchestrator.exception.RetryExhaustedException;
import com.shlawgathon.stageforge.orchestrator.model.ErrorSeverity;
import com.shlawgathon.stageforge.orchestrator.model.PartialResultBundle;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.PipelineError;
import com.shlawgathon.stageforge.orchestrator.model.PipelineRunResult;
import com.shlawgathon.stageforge.orchestrator.model.RecoveryInfo;
import com.shlawgathon.stageforge.orchestrator.model.RunManifest;
import com.shlawgathon.stageforge.orchestrator.model.RunStatus;
import com.shlawgathon.stageforge.orchestrator.model.StageResult;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import com.shlawgathon.stageforge.orchestrator.registry.PipelineStage;
import com.shlawgathon.stageforge.orchestrator.registry.StageFallback;
import com.shlawgathon.stageforge.orchestrator.registry.StagePolicy;
import com.shlawgathon.stageforge.orchestrator.registry.StageRegistry;
import com.shlawgathon.stageforge.orchestrator.repository.CheckpointStore;
import com.shlawgathon.stageforge.orchestrator.repository.RunLock;
import com.shlawgathon.stageforge.orchestrator.retry.CancellationToken;
import com.shlawgathon.stageforge.orchestrator.retry.FailureClassifier;
import com.shlawgathon.stageforge.orchestrator.retry.FailureKind;
import com.shlawgathon.stageforge.orchestrator.retry.RetryExecutor;
import com.shlawgathon.stageforge.orchestrator.retry.RetryOutcome;
import com.shlawgathon.stageforge.orchestrator.retry.RetryPolicy;
import com.shlawgathon.stageforge.orchestrator.retry.Sleeper;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Drives one pipeline run through the registered stages in order.
 * <p>
 * Each stage is invoked through a {@link RetryExecutor}. A success is recorded
 * and checkpointed before the next stage starts. A failure that outlives its
 * retries either ends the run (critical stage, critical failure, cancellation)
 * or is masked by the stage's fallback, recorded as a non-fatal error and
 * checkpointed like a success. A stage that throws an {@link Error} ends the
 * run with a recorded error; only {@link VirtualMachineError}s propagate.
 * Resumed runs never re-execute stages covered by the restored checkpoint.
 */
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private static final DateTimeFormatter RUN_ID =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS").withZone(ZoneOffset.UTC);

    private final StageRegistry registry;
    private final CheckpointStore store;
    private final ResumeController resumeController;
    private final RemediationCatalog remediation;
    private final FailureClassifier classifier;
    private final DocumentHasher hasher;
    private final PartialResultsWriter partialResultsWriter;
    private final RunManifestWriter manifestWriter;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Duration pollInterval;

    @Builder
    public PipelineRunner(StageRegistry registry, CheckpointStore store, RemediationCatalog remediation,
            FailureClassifier classifier, ObjectMapper objectMapper, Sleeper sleeper, Clock clock,
            Duration pollInterval) {
        if (registry == null || store == null) {
            throw new IllegalArgumentException("A runner needs a stage registry and a checkpoint store");
        }
        ObjectMapper mapper = objectMapper != null ? objectMapper : JsonConfig.pipelineObjectMapper();
        this.registry = registry;
        this.store = store;
        this.resumeController = new ResumeController(registry, store);
        this.remediation = remediation != null ? remediation : RemediationCatalog.defaults();
        this.classifier = classifier != null ? classifier : new FailureClassifier();
        this.hasher = new DocumentHasher(mapper);
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.partialResultsWriter = new PartialResultsWriter(mapper, this.clock);
        this.manifestWriter = new RunManifestWriter(mapper);
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
        this.pollInterval = pollInterval != null ? pollInterval : Duration.ofMillis(100);
    }

    public PipelineRunResult run(PipelineConfig config) {
        return run(config, CancellationToken.none());
    }

    /**
     * Execute the pipeline described by {@code config}.
     *
     * @throws com.shlawgathon.stageforge.orchestrator.exception.CheckpointError if the run cannot
     *         be resumed as requested or another run holds the checkpoint directory
     * @throws IllegalArgumentException if {@code stopAfterStage} names an unknown stage
     */
    public PipelineRunResult run(PipelineConfig config, CancellationToken cancellationToken) {
        if (config.getStopAfterStage() != null) {
            registry.indexOf(config.getStopAfterStage());
        }

        boolean needsLock = config.isEnableCheckpoints() || config.isResuming();
        try (RunLock lock = needsLock ? store.acquireLock() : null) {
            return execute(config, cancellationToken);
        }
    }

    private PipelineRunResult execute(PipelineConfig requested, CancellationToken cancellationToken) {
        RunState state = new RunState(clock.instant(), System.nanoTime());
        state.config = requested;

        if (requested.isResuming()) {
            ResumeState resumed = resumeController.resume(requested);
            state.config = resumed.getConfig().withRunControlsFrom(requested);
            state.results.addAll(resumed.getStageResults());
            state.document = resumed.getDocument();
            state.nextIndex = resumed.getNextStageIndex();
            state.lastCompletedStage = resumed.getStageName();
            state.lastCheckpointId = resumed.getCheckpointId();
            state.lastCheckpointStage = resumed.getStageName();
            state.resumedFrom = resumed.getCheckpointId();
        }

        PipelineConfig config = state.config;
        int endIndex = config.getStopAfterStage() != null
                ? registry.indexOf(config.getStopAfterStage()) + 1
                : registry.size();

        RetryExecutor retry = new RetryExecutor(RetryPolicy.from(config, pollInterval),
                classifier, sleeper, cancellationToken);

        log.info("[PIPELINE] Run {} starting at stage {}/{} (checkpoints: {}, retry: {})",
                state.runId, state.nextIndex + 1, registry.size(),
                config.isEnableCheckpoints() ? "on" : "off",
                config.isEnableRetry() ? config.getMaxRetryAttempts() + " attempts" : "off");

        for (int index = state.nextIndex; index < endIndex; index++) {
            String stageName = registry.stageAt(index);

            if (cancellationToken.isCancelled()) {
                CriticalError cancelled = new CriticalError("Run cancelled before stage '" + stageName + "'");
                recordFailure(state, stageName, cancelled, 0);
                return finish(state, RunStatus.FAILED);
            }

            if (!runStage(state, index, stageName, retry)) {
                return finish(state, RunStatus.FAILED);
            }
        }

        if (endIndex < registry.size()) {
            log.info("[PIPELINE] Stopping after stage {} as requested", config.getStopAfterStage());
        }
        return finish(state, RunStatus.SUCCEEDED);
    }

    /**
     * @return false if the run must stop
     */
    private boolean runStage(RunState state, int index, String stageName, RetryExecutor retry) {
        PipelineConfig config = state.config;
        PipelineStage stage = registry.stage(stageName);
        StagePolicy policy = registry.policyFor(stageName);
        WorkingDocument input = state.document;
        String inputHash = hasher.hash(input);

        log.info("[STAGE] {}/{} {} started", index + 1, registry.size(), stageName);
        long started = System.nanoTime();

        StageResult result;
        try {
            RetryOutcome<HashedDocument> outcome = retry.run(stageName, () -> {
                WorkingDocument output = stage.execute(input, config);
                if (output == null) {
                    throw new IllegalStateException("Stage '" + stageName + "' returned no document");
                }
                return new HashedDocument(output, hasher.hash(output));
            });

            result = StageResult.builder()
                    .stageName(stageName)
                    .stageIndex(index)
                    .attempts(outcome.getAttempts())
                    .durationMs(elapsedMs(started))
                    .success(true)
                    .degraded(false)
                    .output(outcome.getValue().document)
                    .inputHash(inputHash)
                    .outputHash(outcome.getValue().hash)
                    .completedAt(clock.instant())
                    .build();
            if (outcome.getAttempts() > 1) {
                state.recoveredErrors++;
            }
        } catch (Exception e) {
            return handleFailure(state, index, stageName, policy, input, inputHash, started, e, retry);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            log.error("[STAGE] {} raised {}, stopping run: {}", stageName, e.getClass().getSimpleName(), e.getMessage());
            recordFailure(state, stageName, e, 1);
            return false;
        }

        state.record(result);
        state.document = result.getOutput();
        state.lastCompletedStage = stageName;
        log.info("[STAGE] {} completed in {} ms ({} attempt(s))", stageName, result.getDurationMs(), result.getAttempts());

        return checkpoint(state, stageName, retry);
    }

    /**
     * Checkpoint the state left by {@code stageName}, whether it succeeded or degraded.
     *
     * @return false if the run must stop
     */
    private boolean checkpoint(RunState state, String stageName, RetryExecutor retry) {
        PipelineConfig config = state.config;
        if (!config.isEnableCheckpoints()) {
            return true;
        }
        try {
            String checkpointId = retry.execute("checkpoint " + stageName, () -> store.save(
                    stageName, config, registry.getStageSequence(), state.results, state.document));
            state.checkpointIds.add(checkpointId);
            state.lastCheckpointId = checkpointId;
            state.lastCheckpointStage = stageName;
            return true;
        } catch (Exception e) {
            log.error("[CHECKPOINT] Could not checkpoint stage {}: {}", stageName, e.getMessage());
            recordFailure(state, stageName, e, attemptsOf(e));
            return false;
        }
    }

    private boolean handleFailure(RunState state, int index, String stageName, StagePolicy policy,
            WorkingDocument input, String inputHash, long started, Exception failure, RetryExecutor retry) {
        Throwable cause = unwrap(failure);
        int attempts = attemptsOf(failure);

        boolean fatal = policy.isCritical()
                || failure instanceof RetryCancelledException
                || classifier.classify(cause) == FailureKind.CRITICAL;

        if (fatal) {
            log.error("[STAGE] {} failed after {} attempt(s), stopping run: {}", stageName, attempts, cause.getMessage());
            recordFailure(state, stageName, failure, attempts);
            return false;
        }

        PipelineError error = toPipelineError(state, stageName, cause, attempts, false);
        StageFallback fallback = policy.getFallback().orElseThrow();
        WorkingDocument degraded;
        try {
            degraded = fallback.apply(input, error);
        } catch (RuntimeException fallbackFailure) {
            log.error("[STAGE] Fallback for {} failed: {}", stageName, fallbackFailure.getMessage());
            recordFailure(state, stageName, fallbackFailure, attempts);
            return false;
        }

        log.warn("[STAGE] {} failed after {} attempt(s), continuing with fallback: {}",
                stageName, attempts, cause.getMessage());

        state.errors.add(error);
        StageResult result = StageResult.builder()
                .stageName(stageName)
                .stageIndex(index)
                .attempts(attempts)
                .durationMs(elapsedMs(started))
                .success(false)
                .degraded(true)
                .output(degraded)
                .inputHash(inputHash)
                .outputHash(hasher.hash(degraded))
                .completedAt(clock.instant())
                .build();
        state.record(result, error.getMessage());
        state.document = degraded;
        return checkpoint(state, stageName, retry);
    }

    /**
     * Record the terminal error and write the partial-results bundle.
     */
    private void recordFailure(RunState state, String stageName, Throwable failure, int attempts) {
        Throwable cause = unwrap(failure);
        PipelineError error = toPipelineError(state, stageName, cause, attempts, true);
        state.errors.add(error);
        state.failedStage = stageName;
        log.error("[PIPELINE] Run {} failed{}", state.runId, error.format());

        if (state.config.isSavePartialResults()) {
            RecoveryInfo recoveryInfo = RecoveryInfo.builder()
                    .failedStage(stageName)
                    .resumePoint(stageName)
                    .lastCompletedStage(state.lastCompletedStage)
                    .lastCheckpointId(state.lastCheckpointId)
                    .stagesCompleted(state.completedStages())
                    .createdAt(clock.instant())
                    .recoverySuggestions(recoverySuggestions(state))
                    .build();

            PartialResultBundle bundle = PartialResultBundle.builder()
                    .stageResults(state.results)
                    .error(error)
                    .workingDocument(state.document)
                    .recoveryInfo(recoveryInfo)
                    .build();
            state.partialResults = partialResultsWriter.write(partialResultsBase(state.config), bundle);
        }
    }

    private PipelineRunResult finish(RunState state, RunStatus status) {
        long totalDurationMs = elapsedMs(state.startedNanos);
        Path manifestPath = null;
        if (state.config.getManifestPath() != null) {
            manifestPath = manifestWriter.write(Path.of(state.config.getManifestPath()),
                    state.manifest(status, clock.instant(), totalDurationMs));
        }

        if (status == RunStatus.SUCCEEDED) {
            log.info("[PIPELINE] Run {} succeeded in {} ms ({} stage result(s), {} degraded, {} recovered)",
                    state.runId, totalDurationMs, state.results.size(), state.errors.size(), state.recoveredErrors);
        }

        return PipelineRunResult.builder()
                .runId(state.runId)
                .status(status)
                .stageResults(state.results)
                .finalDocument(state.document)
                .errors(state.errors)
                .checkpointIds(state.checkpointIds)
                .lastCompletedStage(state.lastCompletedStage)
                .lastCheckpointId(state.lastCheckpointId)
                .recoveredErrors(state.recoveredErrors)
                .totalDurationMs(totalDurationMs)
                .partialResults(state.partialResults)
                .manifestPath(manifestPath)
                .build();
    }

    private PipelineError toPipelineError(RunState state, String stageName, Throwable cause, int attempts,
            boolean fatal) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (cause instanceof PipelineException pipelineException) {
            context.putAll(pipelineException.getContext());
        }
        context.put("stageIndex", registry.indexOf(stageName));

        List<String> suggestions = new ArrayList<>(remediation.suggestionsFor(stageName, cause));
        if (fatal) {
            suggestions.addAll(resumeSuggestions(state));
        }

        ErrorSeverity severity;
        if (!fatal) {
            severity = ErrorSeverity.MEDIUM;
        } else if (cause instanceof PipelineException pipelineException) {
            severity = pipelineException.getSeverity();
        } else {
            severity = ErrorSeverity.HIGH;
        }

        return PipelineError.builder()
                .stage(stageName)
                .errorType(cause.getClass().getSimpleName())
                .message(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName())
                .context(context)
                .recoverable(!fatal)
                .suggestions(suggestions)
                .trace(fatal ? stackTrace(cause) : null)
                .severity(severity)
                .attempts(Math.max(attempts, 1))
                .timestamp(clock.instant())
                .build();
    }

    private List<String> resumeSuggestions(RunState state) {
        List<String> suggestions = new ArrayList<>();
        if (state.lastCheckpointId != null) {
            suggestions.add("Fix the issue, then resume with --resume-checkpoint " + state.lastCheckpointId);
            suggestions.add("Or resume with --resume-from " + state.lastCheckpointStage
                    + " to continue after the last checkpointed stage");
        } else {
            suggestions.add("No checkpoint was written before this failure; fix the issue and run from the start");
        }
        return suggestions;
    }

    private List<String> recoverySuggestions(RunState state) {
        List<String> suggestions = new ArrayList<>();
        suggestions.add("Review stage_data.json and stage_results.json for debugging");
        suggestions.add("Fix the underlying issue and retry the pipeline");
        suggestions.addAll(resumeSuggestions(state));
        return suggestions;
    }

    private static Path partialResultsBase(PipelineConfig config) {
        if (config.getPartialResultsDir() != null) {
            return Path.of(config.getPartialResultsDir());
        }
        if (config.getOutputPath() != null) {
            Path parent = config.output().toAbsolutePath().getParent();
            if (parent != null) {
                return parent;
            }
        }
        return Path.of(".");
    }

    private static Throwable unwrap(Throwable failure) {
        if ((failure instanceof RetryExhaustedException || failure instanceof RetryCancelledException)
                && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private static int attemptsOf(Throwable failure) {
        if (failure instanceof RetryExhaustedException exhausted) {
            return exhausted.getAttempts();
        }
        if (failure instanceof PipelineException pipelineException
                && pipelineException.getContext().get("attempts") instanceof Integer attempts) {
            return attempts;
        }
        return 1;
    }

    private static String stackTrace(Throwable failure) {
        StringWriter out = new StringWriter();
        failure.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static final class HashedDocument {
        private final WorkingDocument document;
        private final String hash;

        private HashedDocument(WorkingDocument document, String hash) {
            this.document = document;
            this.hash = hash;
        }
    }

    /**
     * Mutable bookkeeping of the run in progress.
     */
    private static final class RunState {
        private final String runId;
        private final Instant startedAt;
        private final long startedNanos;

        private PipelineConfig config;
        private WorkingDocument document = WorkingDocument.empty();
        private int nextIndex;
        private final List<StageResult> results = new ArrayList<>();
        private final List<PipelineError> errors = new ArrayList<>();
        private final List<String> checkpointIds = new ArrayList<>();
        private final List<RunManifest.ManifestStep> steps = new ArrayList<>();
        private String lastCompletedStage;
        private String lastCheckpointId;
        private String lastCheckpointStage;
        private String resumedFrom;
        private String failedStage;
        private int recoveredErrors;
        private PartialResultBundle partialResults;

        private RunState(Instant startedAt, long startedNanos) {
            this.runId = "run_" + RUN_ID.format(startedAt);
            this.startedAt = startedAt;
            this.startedNanos = startedNanos;
        }

        private void record(StageResult result, String... errorMessages) {
            results.add(result);
            steps.add(RunManifest.ManifestStep.builder()
                    .stage(result.getStageName())
                    .completedAt(result.getCompletedAt())
                    .durationMs(result.getDurationMs())
                    .inputHash(result.getInputHash())
                    .outputHash(result.getOutputHash())
                    .success(result.isSuccess())
                    .degraded(result.isDegraded())
                    .attempts(result.getAttempts())
                    .errors(new ArrayList<>(List.of(errorMessages)))
                    .build());
        }

        private List<String> completedStages() {
            List<String> completed = new ArrayList<>();
            for (StageResult result : results) {
                if (result.isSuccess()) {
                    completed.add(result.getStageName());
                }
            }
            return completed;
        }

        private RunManifest manifest(RunStatus status, Instant finishedAt, long totalDurationMs) {
            int degraded = (int) results.stream().filter(StageResult::isDegraded).count();
            return RunManifest.builder()
                    .runId(runId)
                    .status(status)
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .totalDurationMs(totalDurationMs)
                    .config(config)
                    .resumedFromCheckpoint(resumedFrom)
                    .steps(new ArrayList<>(steps))
                    .recoveredErrors(recoveredErrors)
                    .warnings(degraded)
                    .errors(failedStage != null ? 1 : 0)
                    .build();
        }
    }
}
