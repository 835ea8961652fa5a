package com.ecoauditor.core.renderer;

import java.util.Objects;

/**
 * Represents a generated file to be rendered.
 *
 * @param relativePath relative path for the file (e.g., "ecosystem-graph.mmd")
 * @param content file content
 * @param contentType content type, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    /**
     * Derives a content type from a file extension.
     *
     * @param extension file extension without leading dot
     * @return MIME type
     */
    public static String contentTypeFor(String extension) {
        return switch (extension) {
            case "json" -> "application/json";
            case "mmd" -> "text/vnd.mermaid";
            default -> "text/plain";
        };
    }
}
