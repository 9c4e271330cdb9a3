package com.shlawgathon.stageforge.orchestrator.stage;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Input formats the ingestion stage accepts, recognised by file extension.
 */
public enum SourceFormat {
    MARKDOWN("md", "markdown"),
    HTML("html", "htm"),
    TEXT("txt", "text"),
    JSON("json");

    private final String[] extensions;

    SourceFormat(String... extensions) {
        this.extensions = extensions;
    }

    public static Optional<SourceFormat> fromPath(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String extension = name.substring(dot + 1);
        for (SourceFormat format : values()) {
            for (String candidate : format.extensions) {
                if (candidate.equals(extension)) {
                    return Optional.of(format);
                }
            }
        }
        return Optional.empty();
    }
}
