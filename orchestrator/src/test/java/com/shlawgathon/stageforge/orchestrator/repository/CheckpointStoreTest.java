package com.shlawgathon.stageforge.orchestrator.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.stageforge.orchestrator.config.JsonConfig;
import com.shlawgathon.stageforge.orchestrator.exception.CheckpointError;
import com.shlawgathon.stageforge.orchestrator.exception.CheckpointNotFoundException;
import com.shlawgathon.stageforge.orchestrator.model.Checkpoint;
import com.shlawgathon.stageforge.orchestrator.model.CheckpointIndexEntry;
import com.shlawgathon.stageforge.orchestrator.model.PipelineConfig;
import com.shlawgathon.stageforge.orchestrator.model.StageResult;
import com.shlawgathon.stageforge.orchestrator.model.WorkingDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointStoreTest {

    private static final List<String> SEQUENCE = List.of("ingestion", "extraction", "transformation");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = JsonConfig.pipelineObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    private CheckpointStore store;
    private PipelineConfig config;

    @BeforeEach
    void setUp() {
        store = new CheckpointStore(tempDir, objectMapper, clock, 3);
        config = PipelineConfig.builder()
                .inputPath("deck.md")
                .outputPath("deck.json")
                .checkpointDir(tempDir.toString())
                .initialRetryDelay(Duration.ofMillis(250))
                .option("template", "modern")
                .build();
    }

    @Test
    void shouldSaveAndLoadCheckpoint() {
        // Given
        WorkingDocument document = WorkingDocument.empty()
                .with("title", "Quarterly review")
                .with("sections", List.of(Map.of("heading", "Intro", "items", List.of("a", "b"))))
                .with("section_count", 1);
        List<StageResult> results = List.of(result("ingestion", 0, document));

        // When
        String checkpointId = store.save("ingestion", config, SEQUENCE, results, document);
        Checkpoint loaded = store.load(checkpointId);

        // Then
        assertTrue(checkpointId.endsWith("_ingestion"));
        assertEquals(checkpointId, loaded.getCheckpointId());
        assertEquals("ingestion", loaded.getStageName());
        assertEquals(SEQUENCE, loaded.getStageSequence());
        assertEquals(document, loaded.getWorkingDocument());
        assertEquals(config, loaded.getConfig());
        assertEquals(1, loaded.getStageResults().size());
        assertEquals(document, loaded.getStageResults().get(0).getOutput());
        assertTrue(Files.exists(tempDir.resolve(CheckpointStore.INDEX_FILE)));
        assertTrue(Files.exists(tempDir.resolve(checkpointId + ".json")));
    }

    @Test
    void shouldIssueUniqueSortableIdsUnderAFrozenClock() {
        // When
        String first = save("ingestion");
        String second = save("extraction");
        String third = save("transformation");

        // Then
        assertTrue(first.compareTo(second) < 0);
        assertTrue(second.compareTo(third) < 0);
        List<CheckpointIndexEntry> entries = store.list();
        assertEquals(List.of(first, second, third), entries.stream().map(CheckpointIndexEntry::getCheckpointId).toList());
        assertTrue(entries.get(0).getCreatedAt().isBefore(entries.get(1).getCreatedAt()));
    }

    @Test
    void shouldReturnLatestCheckpoint() {
        // Given
        save("ingestion");
        String newest = save("extraction");

        // When
        Optional<Checkpoint> latest = store.latest();

        // Then
        assertTrue(latest.isPresent());
        assertEquals(newest, latest.get().getCheckpointId());
    }

    @Test
    void shouldReturnEmptyWhenDirectoryHasNoCheckpoints() {
        assertTrue(store.latest().isEmpty());
        assertTrue(store.forStage("ingestion").isEmpty());
        assertTrue(store.list().isEmpty());
    }

    @Test
    void shouldFindMostRecentCheckpointForStage() {
        // Given
        save("ingestion");
        String extraction = save("extraction");
        save("ingestion");

        // When
        Optional<Checkpoint> found = store.forStage("extraction");

        // Then
        assertTrue(found.isPresent());
        assertEquals(extraction, found.get().getCheckpointId());
        assertTrue(store.forStage("transformation").isEmpty());
    }

    @Test
    void shouldKeepOnlyThreeMostRecentCheckpoints() {
        // Given
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(save(SEQUENCE.get(i % SEQUENCE.size())));
        }

        // When
        List<CheckpointIndexEntry> remaining = store.list();

        // Then
        assertEquals(ids.subList(2, 5), remaining.stream().map(CheckpointIndexEntry::getCheckpointId).toList());
        assertFalse(Files.exists(tempDir.resolve(ids.get(0) + ".json")));
        assertFalse(Files.exists(tempDir.resolve(ids.get(1) + ".json")));
        for (String kept : ids.subList(2, 5)) {
            assertTrue(Files.exists(tempDir.resolve(kept + ".json")));
        }
    }

    @Test
    void shouldLeaveEverythingWhenFewerThanKeep() {
        // Given
        CheckpointStore roomy = new CheckpointStore(tempDir, objectMapper, clock, 10);
        roomy.save("ingestion", config, SEQUENCE, List.of(), WorkingDocument.empty());
        roomy.save("extraction", config, SEQUENCE, List.of(), WorkingDocument.empty());

        // When
        int removed = roomy.cleanup(3);

        // Then
        assertEquals(0, removed);
        assertEquals(2, roomy.list().size());
    }

    @Test
    void shouldPruneOnDemand() {
        // Given
        CheckpointStore roomy = new CheckpointStore(tempDir, objectMapper, clock, 10);
        for (String stage : SEQUENCE) {
            roomy.save(stage, config, SEQUENCE, List.of(), WorkingDocument.empty());
        }

        // When
        int removed = roomy.cleanup(1);

        // Then
        assertEquals(2, removed);
        List<CheckpointIndexEntry> remaining = roomy.list();
        assertEquals(1, remaining.size());
        assertEquals("transformation", remaining.get(0).getStageName());
    }

    @Test
    void shouldThrowNotFoundForUnknownId() {
        // Given
        save("ingestion");

        // When
        CheckpointNotFoundException thrown = assertThrows(CheckpointNotFoundException.class,
                () -> store.load("20260301T101530.000000_missing"));

        // Then
        assertEquals("20260301T101530.000000_missing", thrown.getCheckpointId());
        assertInstanceOf(CheckpointError.class, thrown);
    }

    @Test
    void shouldNotLoadPrunedCheckpoint() {
        // Given
        String oldest = save("ingestion");
        for (int i = 0; i < 3; i++) {
            save("extraction");
        }

        // Then
        assertThrows(CheckpointNotFoundException.class, () -> store.load(oldest));
    }

    @Test
    void shouldIgnoreOrphanPayloads() throws Exception {
        // Given
        String id = save("ingestion");
        Files.writeString(tempDir.resolve("20200101T000000.000000_orphan.json"), "{}");

        // When
        List<CheckpointIndexEntry> entries = store.list();

        // Then
        assertEquals(1, entries.size());
        assertEquals(id, entries.get(0).getCheckpointId());
        assertEquals(id, store.latest().orElseThrow().getCheckpointId());
    }

    @Test
    void shouldFailFastWhenDirectoryIsLocked() {
        // Given
        RunLock lock = store.acquireLock();

        // When
        CheckpointError thrown = assertThrows(CheckpointError.class, () -> store.acquireLock());

        // Then
        assertTrue(thrown.getMessage().contains("in use by another run"));
        lock.close();
        assertFalse(Files.exists(tempDir.resolve(CheckpointStore.LOCK_FILE)));
    }

    @Test
    void shouldReleaseLockForNextRun() {
        // Given
        try (RunLock lock = store.acquireLock()) {
            assertTrue(Files.exists(lock.getLockFile()));
        }

        // When
        RunLock next = store.acquireLock();

        // Then
        assertNotNull(next);
        next.close();
    }

    @Test
    void shouldBreakStaleLock() {
        // Given
        store.acquireLock();

        // When
        boolean broken = store.breakLock();

        // Then
        assertTrue(broken);
        assertFalse(store.breakLock());
        store.acquireLock().close();
    }

    @Test
    void shouldContinueIdsAfterReopeningStore() {
        // Given
        String first = save("ingestion");
        CheckpointStore reopened = new CheckpointStore(tempDir, objectMapper, clock, 3);

        // When
        String second = reopened.save("extraction", config, SEQUENCE, List.of(), WorkingDocument.empty());

        // Then
        assertTrue(first.compareTo(second) < 0);
        assertEquals(2, reopened.list().size());
    }

    @Test
    void shouldKeepSavedCheckpointWhenPruningFails() {
        // Given
        CheckpointStore failingPrune = new CheckpointStore(tempDir, objectMapper, clock, 3) {
            @Override
            public synchronized int cleanup(int keep) {
                throw new CheckpointError("index unreadable during prune");
            }
        };

        // When
        String checkpointId = failingPrune.save("ingestion", config, SEQUENCE, List.of(), WorkingDocument.empty());

        // Then
        assertEquals(1, failingPrune.list().size());
        assertEquals(checkpointId, failingPrune.list().get(0).getCheckpointId());
        assertEquals("ingestion", failingPrune.load(checkpointId).getStageName());
    }

    private String save(String stage) {
        return store.save(stage, config, SEQUENCE, List.of(), WorkingDocument.empty().with("stage", stage));
    }

    private StageResult result(String stage, int index, WorkingDocument output) {
        return StageResult.builder()
                .stageName(stage)
                .stageIndex(index)
                .attempts(1)
                .durationMs(5)
                .success(true)
                .output(output)
                .inputHash("in")
                .outputHash("out")
                .completedAt(clock.instant())
                .build();
    }
}
