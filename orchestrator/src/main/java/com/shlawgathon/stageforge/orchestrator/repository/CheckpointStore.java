package com.shlawgathon.stageforge.orchestrator.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.stageforge.orchestrator.exception.CheckpointError;
import com.shlawgathon.stageforge.orchestrator.exception.CheckpointNotFoundException;
import com.shlawgathon.stageforge.orchestrator.model.Checkpoint;
import com.shlawgathon.stageforge.orchestrator.model.CheckpointIndex;
import com.shlawgathon.stageforge.orchestrator.model.CheckpointIndexEntry;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.StageResult;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Checkpoints of one pipeline namespace, kept in a single directory:
 * <pre>
 *   index.json             ordered {checkpointId, stageName, createdAt} entries
 *   &lt;checkpointId&gt;.json    one payload per checkpoint
 *   .lock                  present while a run owns the directory
 * </pre>
 * Payloads are written before the index is replaced, and {@link #cleanup}
 * replaces the index before deleting payloads, so an index entry never points
 * at a missing payload. A payload orphaned by a crash between the two writes
 * is simply unreachable. Both files are replaced atomically (write-new-then-rename).
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    public static final String INDEX_FILE = "index.json";
    public static final String LOCK_FILE = ".lock";

    private static final DateTimeFormatter ID_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSSSSS").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int retention;

    private Instant lastCreatedAt;

    public CheckpointStore(Path directory, ObjectMapper objectMapper, Clock clock, int retention) {
        if (retention < 1) {
            throw new IllegalArgumentException("Checkpoint retention must be at least 1: " + retention);
        }
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.retention = retention;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Persist a checkpoint for the stage that just completed, then prune to the
     * configured retention. Pruning failures are logged and leave extra
     * checkpoints behind.
     *
     * @return the new checkpoint id
     */
    public synchronized String save(String stageName, PipelineConfig config, List<String> stageSequence,
            List<StageResult> stageResults, WorkingDocument document) {
        ensureDirectory();

        Instant createdAt = nextCreatedAt();
        String checkpointId = ID_TIMESTAMP.format(createdAt) + "_" + stageName;

        Checkpoint checkpoint = Checkpoint.builder()
                .checkpointId(checkpointId)
                .stageName(stageName)
                .createdAt(createdAt)
                .config(config)
                .stageSequence(stageSequence)
                .stageResults(stageResults)
                .workingDocument(document)
                .build();

        // Payload first, index second
        writeAtomically(payloadPath(checkpointId), checkpoint);

        List<CheckpointIndexEntry> entries = new ArrayList<>(readIndex());
        entries.add(checkpoint.toIndexEntry());
        writeIndex(entries);

        log.info("[CHECKPOINT] Saved {} (stage: {}, results: {})", checkpointId, stageName, stageResults.size());

        // The checkpoint is durable once indexed; a failed prune must not fail the save
        try {
            cleanup(retention);
        } catch (CheckpointError e) {
            log.warn("[CHECKPOINT] Saved {} but could not prune to {} checkpoint(s): {}",
                    checkpointId, retention, e.getMessage());
        }
        return checkpointId;
    }

    /**
     * Load a checkpoint listed in the index.
     *
     * @throws CheckpointNotFoundException if the index has no such id
     */
    public Checkpoint load(String checkpointId) {
        boolean indexed = readIndex().stream()
                .anyMatch(entry -> entry.getCheckpointId().equals(checkpointId));
        if (!indexed) {
            throw new CheckpointNotFoundException(checkpointId);
        }
        return readPayload(checkpointId);
    }

    /**
     * Most recently created checkpoint, if any.
     */
    public Optional<Checkpoint> latest() {
        return readIndex().stream()
                .max(Comparator.comparing(CheckpointIndexEntry::getCreatedAt))
                .map(entry -> readPayload(entry.getCheckpointId()));
    }

    /**
     * Most recent checkpoint taken after {@code stageName} completed, if any.
     */
    public Optional<Checkpoint> forStage(String stageName) {
        return readIndex().stream()
                .filter(entry -> entry.getStageName().equals(stageName))
                .max(Comparator.comparing(CheckpointIndexEntry::getCreatedAt))
                .map(entry -> readPayload(entry.getCheckpointId()));
    }

    /**
     * Index entries, oldest first.
     */
    public List<CheckpointIndexEntry> list() {
        List<CheckpointIndexEntry> entries = new ArrayList<>(readIndex());
        entries.sort(Comparator.comparing(CheckpointIndexEntry::getCreatedAt));
        return entries;
    }

    /**
     * Delete all but the {@code keep} most recently created checkpoints.
     *
     * @return number of checkpoints removed
     */
    public synchronized int cleanup(int keep) {
        if (keep < 0) {
            throw new IllegalArgumentException("keep must not be negative: " + keep);
        }
        List<CheckpointIndexEntry> newestFirst = new ArrayList<>(readIndex());
        if (newestFirst.size() <= keep) {
            return 0;
        }
        newestFirst.sort(Comparator.comparing(CheckpointIndexEntry::getCreatedAt).reversed());

        List<CheckpointIndexEntry> kept = new ArrayList<>(newestFirst.subList(0, keep));
        List<CheckpointIndexEntry> removed = newestFirst.subList(keep, newestFirst.size());
        kept.sort(Comparator.comparing(CheckpointIndexEntry::getCreatedAt));

        // Index first, payloads second
        writeIndex(kept);
        for (CheckpointIndexEntry entry : removed) {
            try {
                Files.deleteIfExists(payloadPath(entry.getCheckpointId()));
            } catch (IOException e) {
                log.warn("[CHECKPOINT] Could not delete payload of pruned checkpoint {}: {}",
                        entry.getCheckpointId(), e.getMessage());
            }
        }

        log.debug("[CHECKPOINT] Pruned {} checkpoint(s), kept {}", removed.size(), kept.size());
        return removed.size();
    }

    /**
     * Claim the directory for one run.
     *
     * @throws CheckpointError if another run already holds the lock
     */
    public RunLock acquireLock() {
        ensureDirectory();
        Path lockFile = directory.resolve(LOCK_FILE);
        try {
            Files.writeString(Files.createFile(lockFile),
                    "pid=" + ProcessHandle.current().pid() + "\nacquired=" + clock.instant() + "\n",
                    StandardCharsets.UTF_8);
        } catch (FileAlreadyExistsException e) {
            throw new CheckpointError("Checkpoint directory " + directory
                    + " is in use by another run (lock file " + lockFile
                    + "). Remove the lock if that run is no longer alive.", e);
        } catch (IOException e) {
            throw new CheckpointError("Failed to create run lock " + lockFile, e);
        }
        log.debug("[LOCK] Acquired {}", lockFile);
        return new RunLock(lockFile);
    }

    /**
     * Remove a lock left behind by a run that died.
     *
     * @return whether a lock file was present
     */
    public boolean breakLock() {
        try {
            boolean existed = Files.deleteIfExists(directory.resolve(LOCK_FILE));
            if (existed) {
                log.warn("[LOCK] Removed stale lock in {}", directory);
            }
            return existed;
        } catch (IOException e) {
            throw new CheckpointError("Failed to remove run lock in " + directory, e);
        }
    }

    private Instant nextCreatedAt() {
        if (lastCreatedAt == null) {
            lastCreatedAt = readIndex().stream()
                    .map(CheckpointIndexEntry::getCreatedAt)
                    .max(Comparator.naturalOrder())
                    .orElse(Instant.EPOCH);
        }
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        if (!now.isAfter(lastCreatedAt)) {
            now = lastCreatedAt.plus(1, ChronoUnit.MICROS);
        }
        lastCreatedAt = now;
        return now;
    }

    private List<CheckpointIndexEntry> readIndex() {
        Path indexFile = directory.resolve(INDEX_FILE);
        if (!Files.exists(indexFile)) {
            return List.of();
        }
        try {
            CheckpointIndex index = objectMapper.readValue(indexFile.toFile(), CheckpointIndex.class);
            return index.getCheckpoints() != null ? index.getCheckpoints() : List.of();
        } catch (IOException e) {
            throw new CheckpointError("Failed to read checkpoint index " + indexFile, e);
        }
    }

    private void writeIndex(List<CheckpointIndexEntry> entries) {
        CheckpointIndex index = CheckpointIndex.builder()
                .checkpoints(new ArrayList<>(entries))
                .lastUpdated(clock.instant())
                .build();
        writeAtomically(directory.resolve(INDEX_FILE), index);
    }

    private Checkpoint readPayload(String checkpointId) {
        Path payload = payloadPath(checkpointId);
        if (!Files.exists(payload)) {
            throw new CheckpointError("Checkpoint " + checkpointId + " is indexed but its payload is missing: " + payload);
        }
        try {
            return objectMapper.readValue(payload.toFile(), Checkpoint.class);
        } catch (IOException e) {
            throw new CheckpointError("Failed to read checkpoint " + checkpointId, e);
        }
    }

    private void writeAtomically(Path target, Object value) {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CheckpointError("Failed to write " + target, e);
        }
    }

    private Path payloadPath(String checkpointId) {
        return directory.resolve(checkpointId + ".json");
    }

    private void ensureDirectory() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CheckpointError("Failed to create checkpoint directory " + directory, e);
        }
    }
}
