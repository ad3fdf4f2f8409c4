package com.sharpgen.core.json;

import java.util.List;
import java.util.Objects;

import com.sharpgen.core.ast.AstNode;

/**
 * One output file of a model document.
 *
 * @param path output path relative to the output directory, e.g. {@code Models/Widget.cs}
 * @param nodes nodes rendered into the file, in order
 */
public record SourceFileModel(
    String path,
    List<AstNode> nodes
) {
    public SourceFileModel {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }
}
