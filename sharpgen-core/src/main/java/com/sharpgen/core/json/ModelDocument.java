package com.sharpgen.core.json;

import java.util.List;

/**
 * Parsed model file: the set of source files to generate.
 *
 * @param files files in document order
 */
public record ModelDocument(
    List<SourceFileModel> files
) {
    public ModelDocument {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Returns the total number of top-level nodes across all files.
     *
     * @return node count
     */
    public int nodeCount() {
        return files.stream().mapToInt(file -> file.nodes().size()).sum();
    }
}
