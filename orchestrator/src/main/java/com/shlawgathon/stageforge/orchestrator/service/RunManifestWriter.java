package com.shlawgathon.stageforge.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.stageforge.orchestrator.model.RunManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the processing manifest of a finished run.
 */
public class RunManifestWriter {

    private static final Logger log = LoggerFactory.getLogger(RunManifestWriter.class);

    private final ObjectMapper objectMapper;

    public RunManifestWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return where the manifest was written, or null if it could not be
     */
    public Path write(Path target, RunManifest manifest) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(target.toFile(), manifest);
            log.info("[MANIFEST] Run {} manifest written to {}", manifest.getRunId(), target);
            return target;
        } catch (IOException e) {
            log.error("[MANIFEST] Failed to write manifest {}: {}", target, e.getMessage(), e);
            return null;
        }
    }

    public RunManifest read(Path source) throws IOException {
        return objectMapper.readValue(source.toFile(), RunManifest.class);
    }
}
