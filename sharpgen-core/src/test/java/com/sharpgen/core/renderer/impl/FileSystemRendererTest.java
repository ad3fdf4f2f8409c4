package com.sharpgen.core.renderer.impl;

import com.sharpgen.core.renderer.GeneratedFile;
import com.sharpgen.core.renderer.GeneratedOutput;
import com.sharpgen.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withSingleFile_writesFileToOutputDirectory() throws IOException {
        // Given
        String content = "public class Widget\n{\n}\n";
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("Widget.cs", content, "csharp")));
        RenderContext context = new RenderContext(tempDir.toString(), Map.of());

        // When
        renderer.render(output, context);

        // Then
        Path expectedFile = tempDir.resolve("Widget.cs");
        assertThat(expectedFile).exists();
        assertThat(Files.readString(expectedFile)).isEqualTo(content);
    }

    @Test
    void render_withNestedPath_createsDirectoryStructure() throws IOException {
        // Given
        String relativePath = "Models/Orders/Order.cs";
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile(relativePath, "class Order { }", "csharp")));
        RenderContext context = new RenderContext(tempDir.resolve("out").toString(), Map.of());

        // When
        renderer.render(output, context);

        // Then
        Path expectedFile = tempDir.resolve("out").resolve(relativePath);
        assertThat(expectedFile).exists();
        assertThat(Files.readString(expectedFile)).isEqualTo("class Order { }");
    }

    @Test
    void render_withExistingFile_overwritesByDefault() throws IOException {
        // Given
        Path existingFile = tempDir.resolve("Widget.cs");
        Files.writeString(existingFile, "old");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("Widget.cs", "new", "csharp")));

        // When
        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(existingFile)).isEqualTo("new");
    }

    @Test
    void render_withOverwriteDisabled_skipsExistingFilesOnly() throws IOException {
        // Given
        Path existingFile = tempDir.resolve("Widget.cs");
        Files.writeString(existingFile, "old");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("Widget.cs", "new", "csharp"),
            new GeneratedFile("Gadget.cs", "gadget", "csharp")));
        RenderContext context = new RenderContext(tempDir.toString(),
            Map.of(FileSystemRenderer.OVERWRITE_SETTING, "false"));

        // When
        renderer.render(output, context);

        // Then
        assertThat(Files.readString(existingFile)).isEqualTo("old");
        assertThat(Files.readString(tempDir.resolve("Gadget.cs"))).isEqualTo("gadget");
    }

    @Test
    void render_withPathEscapingOutputDirectory_throwsException() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("../Escape.cs", "x", "csharp")));
        RenderContext context = new RenderContext(tempDir.resolve("out").toString(), Map.of());

        assertThatThrownBy(() -> renderer.render(output, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("../Escape.cs");
        assertThat(tempDir.resolve("Escape.cs")).doesNotExist();
    }

    @Test
    void render_withUnicodeContent_writesUtf8() throws IOException {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("Note.cs", "// Grüße", "csharp")));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readAllBytes(tempDir.resolve("Note.cs"))).hasSize(10);
    }

    @Test
    void render_withEmptyOutput_createsOutputDirectory() {
        Path outputDir = tempDir.resolve("empty");

        renderer.render(new GeneratedOutput(List.of()), new RenderContext(outputDir.toString(), Map.of()));

        assertThat(outputDir).isDirectory();
    }
}
