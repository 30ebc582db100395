package com.yamlguard.plugins;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Supported file types, detected from the file name.
 */
public enum FileType {
    YAML("yaml", "yml"),
    UNKNOWN;

    private final String[] extensions;

    FileType(String... extensions) {
        this.extensions = extensions;
    }

    public String[] getExtensions() {
        return extensions.clone();
    }

    /**
     * Detects the file type from the extension.
     *
     * @param filePath the path to the file
     * @return the detected FileType, {@link #UNKNOWN} for anything unrecognised
     */
    public static FileType detect(Path filePath) {
        if (filePath == null || filePath.getFileName() == null) {
            return UNKNOWN;
        }
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }

        String extension = fileName.substring(dot + 1);
        return switch (extension) {
            case "yaml", "yml" -> YAML;
            default -> UNKNOWN;
        };
    }

    /**
     * Get a human-readable description of the file type.
     */
    public String getDescription() {
        return switch (this) {
            case YAML -> "YAML document";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
