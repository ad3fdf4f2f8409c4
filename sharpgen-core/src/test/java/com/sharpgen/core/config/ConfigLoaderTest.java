package com.sharpgen.core.config;

import com.sharpgen.core.generator.GeneratorOptions;
import com.sharpgen.core.generator.LineEndingStyle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("sharpgen.yaml");
        Files.writeString(configFile, """
            project:
              name: "Inventory"
              version: "2.1.0"
              description: "Inventory models"

            generator:
              id: csharp
              generateDocumentation: false
              indentation: "\\t"
              maxLineLength: 80
              lineEndings: unix
              sortUsings: true
              fileScopedNamespaces: false

            output:
              directory: "./src/Generated"
              renderer: console
              overwrite: false
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Inventory");
        assertThat(config.project().version()).isEqualTo("2.1.0");
        assertThat(config.project().description()).isEqualTo("Inventory models");
        assertThat(config.generator().effectiveId()).isEqualTo("csharp");
        assertThat(config.generator().lineEndings()).isEqualTo(LineEndingStyle.UNIX);
        assertThat(config.output().directory()).isEqualTo("./src/Generated");
        assertThat(config.output().renderer()).isEqualTo("console");
        assertThat(config.output().overwrite()).isFalse();

        GeneratorOptions options = config.generator().toOptions();
        assertThat(options.generateDocumentation()).isFalse();
        assertThat(options.generateAttributes()).isTrue();
        assertThat(options.indentation()).isEqualTo("\t");
        assertThat(options.maxLineLength()).isEqualTo(80);
        assertThat(options.sortUsings()).isTrue();
        assertThat(options.fileScopedNamespaces()).isFalse();
    }

    @Test
    void load_minimalYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("sharpgen.yaml");
        Files.writeString(configFile, """
            project:
              name: "Minimal"
              version: "1.0.0"
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Minimal");
        assertThat(config.project().description()).isNull();
        assertThat(config.generator().effectiveId()).isEqualTo(ProjectConfig.DEFAULT_GENERATOR);
        assertThat(config.generator().toOptions()).isEqualTo(GeneratorOptions.defaults());
        assertThat(config.output().directory()).isEqualTo(ProjectConfig.DEFAULT_OUTPUT_DIRECTORY);
        assertThat(config.output().renderer()).isEqualTo(ProjectConfig.DEFAULT_RENDERER);
        assertThat(config.output().overwrite()).isTrue();
    }

    @Test
    void load_lineEndingsInAnyCase_areAccepted() throws IOException {
        Path configFile = tempDir.resolve("sharpgen.yaml");
        Files.writeString(configFile, """
            generator:
              lineEndings: Windows
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.generator().lineEndings()).isEqualTo(LineEndingStyle.WINDOWS);
    }

    @Test
    void load_unknownFields_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("sharpgen.yaml");
        Files.writeString(configFile, """
            project:
              name: "Extra"
              owner: "someone"
            plugins:
              - formatter
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Extra");
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        Path nonExistentFile = tempDir.resolve("nonexistent.yaml");

        ProjectConfig config = ConfigLoader.load(nonExistentFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("sharpgen.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("project");
        assertThat(config.project().version()).isEqualTo("1.0.0");
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("sharpgen.yaml");
        Files.writeString(configFile, "");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }
}
