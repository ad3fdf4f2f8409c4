package com.sharpgen.core.generator;

import java.util.Objects;

/**
 * Options controlling how source code is rendered.
 *
 * <p><b>Defaults:</b>
 * <ul>
 *   <li>{@code generateDocumentation} - true</li>
 *   <li>{@code generateAttributes} - true</li>
 *   <li>{@code indentation} - four spaces</li>
 *   <li>{@code maxLineLength} - 120 (zero or negative disables wrapping)</li>
 *   <li>{@code lineEndings} - {@link LineEndingStyle#PLATFORM_DEFAULT}</li>
 *   <li>{@code sortUsings} - false</li>
 *   <li>{@code fileScopedNamespaces} - true</li>
 * </ul>
 *
 * @param generateDocumentation whether documentation comments are emitted
 * @param generateAttributes whether attributes are emitted
 * @param indentation unit repeated once per indentation level
 * @param maxLineLength column budget for parameter lists and documentation text
 * @param lineEndings line terminator style of the output
 * @param sortUsings whether import directives are sorted and de-duplicated
 * @param fileScopedNamespaces whether namespaces use the {@code namespace X;} form
 */
public record GeneratorOptions(
    boolean generateDocumentation,
    boolean generateAttributes,
    String indentation,
    int maxLineLength,
    LineEndingStyle lineEndings,
    boolean sortUsings,
    boolean fileScopedNamespaces
) {
    public static final String DEFAULT_INDENTATION = "    ";
    public static final int DEFAULT_MAX_LINE_LENGTH = 120;

    /**
     * Compact constructor with validation.
     */
    public GeneratorOptions {
        Objects.requireNonNull(indentation, "indentation must not be null");
        Objects.requireNonNull(lineEndings, "lineEndings must not be null");
    }

    /**
     * Creates the default options.
     *
     * @return default generator options
     */
    public static GeneratorOptions defaults() {
        return new GeneratorOptions(true, true, DEFAULT_INDENTATION, DEFAULT_MAX_LINE_LENGTH,
            LineEndingStyle.PLATFORM_DEFAULT, false, true);
    }

    /**
     * Whether parameter lists and text may be wrapped.
     *
     * @return true if {@code maxLineLength} is positive
     */
    public boolean wrappingEnabled() {
        return maxLineLength > 0;
    }

    public static Builder builder() {
        return defaults().toBuilder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Builder for deriving options from the defaults or another instance.
     */
    public static class Builder {
        private boolean generateDocumentation;
        private boolean generateAttributes;
        private String indentation;
        private int maxLineLength;
        private LineEndingStyle lineEndings;
        private boolean sortUsings;
        private boolean fileScopedNamespaces;

        private Builder(GeneratorOptions source) {
            this.generateDocumentation = source.generateDocumentation;
            this.generateAttributes = source.generateAttributes;
            this.indentation = source.indentation;
            this.maxLineLength = source.maxLineLength;
            this.lineEndings = source.lineEndings;
            this.sortUsings = source.sortUsings;
            this.fileScopedNamespaces = source.fileScopedNamespaces;
        }

        public Builder generateDocumentation(boolean generateDocumentation) {
            this.generateDocumentation = generateDocumentation;
            return this;
        }

        public Builder generateAttributes(boolean generateAttributes) {
            this.generateAttributes = generateAttributes;
            return this;
        }

        public Builder indentation(String indentation) {
            this.indentation = indentation;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder lineEndings(LineEndingStyle lineEndings) {
            this.lineEndings = lineEndings;
            return this;
        }

        public Builder sortUsings(boolean sortUsings) {
            this.sortUsings = sortUsings;
            return this;
        }

        public Builder fileScopedNamespaces(boolean fileScopedNamespaces) {
            this.fileScopedNamespaces = fileScopedNamespaces;
            return this;
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(generateDocumentation, generateAttributes, indentation,
                maxLineLength, lineEndings, sortUsings, fileScopedNamespaces);
        }
    }
}
