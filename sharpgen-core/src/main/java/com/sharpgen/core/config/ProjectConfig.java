package com.sharpgen.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sharpgen.core.generator.GeneratorOptions;
import com.sharpgen.core.generator.LineEndingStyle;

/**
 * Root configuration for SharpGen projects.
 *
 * <p>Loaded from {@code sharpgen.yaml}. Defines project metadata, the generator and its
 * rendering options, and where generated files go. Every section and every setting is
 * optional; anything left out falls back to the defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Inventory"
 *   version: "1.0.0"
 *
 * generator:
 *   id: csharp
 *   generateDocumentation: true
 *   indentation: "    "
 *   maxLineLength: 100
 *   lineEndings: unix
 *   sortUsings: true
 *
 * output:
 *   directory: "./generated"
 *   renderer: filesystem
 *   overwrite: true
 * }</pre>
 *
 * @param project project metadata
 * @param generator generator selection and options
 * @param output output configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("generator") GeneratorSettings generator,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_GENERATOR = "csharp";
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./generated";
    public static final String DEFAULT_RENDERER = "filesystem";

    /**
     * Compact constructor filling missing sections with their defaults.
     */
    public ProjectConfig {
        project = project == null ? new ProjectInfo("project", "1.0.0", null) : project;
        generator = generator == null ? GeneratorSettings.empty() : generator;
        output = output == null ? new OutputConfig(null, null, null) : output;
    }

    /**
     * Creates the default configuration: C# generator with default options, writing to
     * {@value #DEFAULT_OUTPUT_DIRECTORY}.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     * @param description optional project description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
    ) {}

    /**
     * Generator selection and rendering options.
     *
     * <p>Option values are boxed: {@code null} means "not configured" and keeps the value
     * from {@link GeneratorOptions#defaults()}.
     *
     * @param id generator identifier, {@value ProjectConfig#DEFAULT_GENERATOR} when absent
     * @param generateDocumentation whether documentation comments are emitted
     * @param generateAttributes whether attributes are emitted
     * @param indentation indentation unit
     * @param maxLineLength column budget, zero or negative disables wrapping
     * @param lineEndings line terminator style
     * @param sortUsings whether import directives are sorted and de-duplicated
     * @param fileScopedNamespaces whether namespaces use the file-scoped form
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("id") String id,
        @JsonProperty("generateDocumentation") Boolean generateDocumentation,
        @JsonProperty("generateAttributes") Boolean generateAttributes,
        @JsonProperty("indentation") String indentation,
        @JsonProperty("maxLineLength") Integer maxLineLength,
        @JsonProperty("lineEndings") LineEndingStyle lineEndings,
        @JsonProperty("sortUsings") Boolean sortUsings,
        @JsonProperty("fileScopedNamespaces") Boolean fileScopedNamespaces
    ) {
        public static GeneratorSettings empty() {
            return new GeneratorSettings(null, null, null, null, null, null, null, null);
        }

        /**
         * Returns the configured generator id or the default one.
         *
         * @return generator identifier
         */
        public String effectiveId() {
            return id == null || id.isBlank() ? DEFAULT_GENERATOR : id;
        }

        /**
         * Merges the configured values over {@link GeneratorOptions#defaults()}.
         *
         * @return generator options
         */
        public GeneratorOptions toOptions() {
            GeneratorOptions.Builder builder = GeneratorOptions.builder();
            if (generateDocumentation != null) {
                builder.generateDocumentation(generateDocumentation);
            }
            if (generateAttributes != null) {
                builder.generateAttributes(generateAttributes);
            }
            if (indentation != null) {
                builder.indentation(indentation);
            }
            if (maxLineLength != null) {
                builder.maxLineLength(maxLineLength);
            }
            if (lineEndings != null) {
                builder.lineEndings(lineEndings);
            }
            if (sortUsings != null) {
                builder.sortUsings(sortUsings);
            }
            if (fileScopedNamespaces != null) {
                builder.fileScopedNamespaces(fileScopedNamespaces);
            }
            return builder.build();
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param renderer output renderer id
     * @param overwrite whether existing files are replaced
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("renderer") String renderer,
        @JsonProperty("overwrite") Boolean overwrite
    ) {
        public OutputConfig {
            directory = directory == null || directory.isBlank() ? DEFAULT_OUTPUT_DIRECTORY : directory;
            renderer = renderer == null || renderer.isBlank() ? DEFAULT_RENDERER : renderer;
            overwrite = overwrite == null ? Boolean.TRUE : overwrite;
        }
    }
}
