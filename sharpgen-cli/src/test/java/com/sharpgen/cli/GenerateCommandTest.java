package com.sharpgen.cli;

import com.sharpgen.SharpGenCLI;
import com.sharpgen.core.config.ProjectConfig;
import com.sharpgen.core.generator.GeneratorOptions;
import com.sharpgen.core.generator.LineEndingStyle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GenerateCommand}.
 */
class GenerateCommandTest {

    private static final String MODEL = """
        {
          "files": [
            {
              "path": "Models/Widget.cs",
              "nodes": [
                {
                  "kind": "compilationUnit",
                  "usings": ["System"],
                  "namespaces": [
                    {
                      "name": "Acme.Models",
                      "classes": [
                        {
                          "name": "Widget",
                          "access": "public",
                          "properties": [
                            {
                              "name": "Count",
                              "type": "int",
                              "access": "public",
                              "getter": { "kind": "get" },
                              "setter": { "kind": "set" }
                            }
                          ]
                        }
                      ]
                    }
                  ]
                }
              ]
            }
          ]
        }
        """;

    private static final String EXPECTED = String.join("\n",
        "using System;",
        "",
        "namespace Acme.Models;",
        "",
        "public class Widget",
        "{",
        "    public int Count { get; set; }",
        "}",
        "");

    @TempDir
    Path tempDir;

    private Path model;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        model = tempDir.resolve("model.json");
        Files.writeString(model, MODEL);
        outputDir = tempDir.resolve("out");
    }

    private int execute(String... args) {
        return SharpGenCLI.createCommandLine().execute(args);
    }

    @Test
    void generate_validModel_writesSourceFile() throws IOException {
        // When
        int exitCode = execute("-q", "generate", "-i", model.toString(), "-o", outputDir.toString(),
            "--line-endings", "unix");

        // Then
        assertThat(exitCode).isZero();
        Path generated = outputDir.resolve("Models/Widget.cs");
        assertThat(generated).exists();
        assertThat(Files.readString(generated)).isEqualTo(EXPECTED);
    }

    @Test
    void generate_windowsLineEndings_usesCrLfThroughout() throws IOException {
        int exitCode = execute("-q", "generate", "-i", model.toString(), "-o", outputDir.toString(),
            "--line-endings", "WINDOWS");

        assertThat(exitCode).isZero();
        String content = Files.readString(outputDir.resolve("Models/Widget.cs"));
        assertThat(content).isEqualTo(EXPECTED.replace("\n", "\r\n"));
    }

    @Test
    void generate_withConfigFile_appliesConfiguredOptions() throws IOException {
        // Given
        Path config = tempDir.resolve("sharpgen.yaml");
        Files.writeString(config, """
            generator:
              indentation: "  "
              lineEndings: unix
              fileScopedNamespaces: false
            output:
              directory: "%s"
            """.formatted(outputDir.toString().replace("\\", "/")));

        // When
        int exitCode = execute("-q", "generate", "-i", model.toString(), "-c", config.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(Files.readString(outputDir.resolve("Models/Widget.cs"))).isEqualTo(String.join("\n",
            "using System;",
            "",
            "namespace Acme.Models",
            "{",
            "  public class Widget",
            "  {",
            "    public int Count { get; set; }",
            "  }",
            "}",
            ""));
    }

    @Test
    void generate_noOverwrite_keepsExistingFile() throws IOException {
        // Given
        Path existing = outputDir.resolve("Models/Widget.cs");
        Files.createDirectories(existing.getParent());
        Files.writeString(existing, "// hand-written");

        // When
        int exitCode = execute("-q", "generate", "-i", model.toString(), "-o", outputDir.toString(),
            "--no-overwrite");

        // Then
        assertThat(exitCode).isZero();
        assertThat(Files.readString(existing)).isEqualTo("// hand-written");
    }

    @Test
    void generate_missingModel_returnsFailure() {
        int exitCode = execute("-q", "generate", "-i", tempDir.resolve("missing.json").toString(),
            "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void generate_unknownNodeKind_returnsFailure() throws IOException {
        Files.writeString(model, """
            {"files": [{"path": "Color.cs", "nodes": [{"kind": "enum", "name": "Color"}]}]}
            """);

        int exitCode = execute("-q", "generate", "-i", model.toString(), "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void generate_unknownGenerator_returnsFailure() {
        int exitCode = execute("-q", "generate", "-i", model.toString(), "-o", outputDir.toString(),
            "-g", "typescript");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void generate_withoutInput_isUsageError() {
        int exitCode = execute("generate");

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void resolveOptions_commandLineOverridesConfiguration() {
        // Given
        GenerateCommand command = new GenerateCommand();
        new CommandLine(command)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .parseArgs("-i", "model.json", "--line-endings", "unix", "--max-line-length", "60",
                "--sort-usings", "--no-docs", "--no-attributes");
        ProjectConfig config = new ProjectConfig(null,
            new ProjectConfig.GeneratorSettings(null, true, true, "\t", 100, LineEndingStyle.WINDOWS, false, null),
            null);

        // When
        GeneratorOptions options = command.resolveOptions(config);

        // Then
        assertThat(options.lineEndings()).isEqualTo(LineEndingStyle.UNIX);
        assertThat(options.maxLineLength()).isEqualTo(60);
        assertThat(options.sortUsings()).isTrue();
        assertThat(options.generateDocumentation()).isFalse();
        assertThat(options.generateAttributes()).isFalse();
        assertThat(options.indentation()).isEqualTo("\t");
    }

    @Test
    void resolveOptions_withoutOverrides_keepsConfiguration() {
        GenerateCommand command = new GenerateCommand();
        new CommandLine(command).parseArgs("-i", "model.json");

        GeneratorOptions options = command.resolveOptions(ProjectConfig.defaults());

        assertThat(options).isEqualTo(GeneratorOptions.defaults());
    }
}
