package com.shlawgathon.stageforge.orchestrator.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Marker file held by the run that owns a checkpoint directory.
 */
public class RunLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunLock.class);

    private final Path lockFile;
    private boolean released;

    RunLock(Path lockFile) {
        this.lockFile = lockFile;
    }

    public Path getLockFile() {
        return lockFile;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        try {
            Files.deleteIfExists(lockFile);
            released = true;
            log.debug("[LOCK] Released {}", lockFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to release run lock " + lockFile, e);
        }
    }
}
