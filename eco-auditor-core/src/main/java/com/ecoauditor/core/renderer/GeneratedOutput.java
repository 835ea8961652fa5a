package com.ecoauditor.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Collection of generated files to be rendered.
 *
 * @param files list of generated files
 */
public record GeneratedOutput(List<GeneratedFile> files) {

    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile file) {
        return new GeneratedOutput(List.of(file));
    }
}
