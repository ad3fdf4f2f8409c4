package com.sharpgen.core.renderer;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A generated source file ready to be rendered.
 *
 * @param relativePath path relative to the output directory (e.g., "Models/Widget.cs")
 * @param content file content
 * @param generatorId id of the generator that produced the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String generatorId
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
     * Returns the size of the content encoded as UTF-8.
     *
     * @return size in bytes
     */
    public int sizeInBytes() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }
}
