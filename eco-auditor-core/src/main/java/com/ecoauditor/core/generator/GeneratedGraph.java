package com.ecoauditor.core.generator;

import java.util.Objects;

/**
 * Represents a generated graph description.
 *
 * @param name base file name, without extension
 * @param content description content (Mermaid, JSON, ...)
 * @param fileExtension file extension for this content
 */
public record GeneratedGraph(
    String name,
    String content,
    String fileExtension
) {
    public static final String DEFAULT_NAME = "ecosystem-graph";

    /**
     * Compact constructor with validation.
     */
    public GeneratedGraph {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    public String fileName() {
        return name + "." + fileExtension;
    }
}
