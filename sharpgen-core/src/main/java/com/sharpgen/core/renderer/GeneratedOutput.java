package com.sharpgen.core.renderer;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collection of generated files to be rendered.
 *
 * @param files generated files; relative paths must be unique
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);

        Set<String> paths = new HashSet<>();
        for (GeneratedFile file : files) {
            if (!paths.add(file.relativePath())) {
                throw new IllegalArgumentException("Duplicate output path: " + file.relativePath());
            }
        }
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public long totalBytes() {
        return files.stream().mapToLong(GeneratedFile::sizeInBytes).sum();
    }
}
