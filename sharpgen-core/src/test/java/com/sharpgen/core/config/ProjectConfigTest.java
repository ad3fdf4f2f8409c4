package com.sharpgen.core.config;

import com.sharpgen.core.generator.GeneratorOptions;
import com.sharpgen.core.generator.LineEndingStyle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProjectConfig}.
 */
class ProjectConfigTest {

    @Test
    void defaults_usesCSharpGeneratorAndFilesystemOutput() {
        ProjectConfig config = ProjectConfig.defaults();

        assertThat(config.project().name()).isEqualTo("project");
        assertThat(config.project().version()).isEqualTo("1.0.0");
        assertThat(config.generator().effectiveId()).isEqualTo("csharp");
        assertThat(config.generator().toOptions()).isEqualTo(GeneratorOptions.defaults());
        assertThat(config.output().directory()).isEqualTo("./generated");
        assertThat(config.output().renderer()).isEqualTo("filesystem");
        assertThat(config.output().overwrite()).isTrue();
    }

    @Test
    void effectiveId_blankId_fallsBackToDefault() {
        ProjectConfig.GeneratorSettings settings =
            new ProjectConfig.GeneratorSettings("  ", null, null, null, null, null, null, null);

        assertThat(settings.effectiveId()).isEqualTo(ProjectConfig.DEFAULT_GENERATOR);
    }

    @Test
    void toOptions_mergesConfiguredValuesOverDefaults() {
        ProjectConfig.GeneratorSettings settings = new ProjectConfig.GeneratorSettings(
            "csharp", null, false, "  ", 0, LineEndingStyle.WINDOWS, null, null);

        GeneratorOptions options = settings.toOptions();

        assertThat(options.generateDocumentation()).isTrue();
        assertThat(options.generateAttributes()).isFalse();
        assertThat(options.indentation()).isEqualTo("  ");
        assertThat(options.maxLineLength()).isZero();
        assertThat(options.wrappingEnabled()).isFalse();
        assertThat(options.lineEndings()).isEqualTo(LineEndingStyle.WINDOWS);
        assertThat(options.sortUsings()).isFalse();
        assertThat(options.fileScopedNamespaces()).isTrue();
    }

    @Test
    void outputConfig_blankValues_useDefaults() {
        ProjectConfig.OutputConfig output = new ProjectConfig.OutputConfig(" ", "", null);

        assertThat(output.directory()).isEqualTo(ProjectConfig.DEFAULT_OUTPUT_DIRECTORY);
        assertThat(output.renderer()).isEqualTo(ProjectConfig.DEFAULT_RENDERER);
        assertThat(output.overwrite()).isTrue();
    }
}
