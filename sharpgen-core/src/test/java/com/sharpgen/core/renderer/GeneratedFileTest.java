package com.sharpgen.core.renderer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GeneratedFile}.
 */
class GeneratedFileTest {

    @Test
    void constructor_withValidValues_createsFile() {
        GeneratedFile file = new GeneratedFile("Models/Widget.cs", "class Widget\n{\n}\n", "csharp");

        assertThat(file.relativePath()).isEqualTo("Models/Widget.cs");
        assertThat(file.generatorId()).isEqualTo("csharp");
    }

    @Test
    void constructor_withNullPath_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile(null, "content", "csharp"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("relativePath");
    }

    @Test
    void constructor_withNullContent_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile("A.cs", null, "csharp"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("content");
    }

    @Test
    void constructor_withBlankPath_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile("  ", "content", "csharp"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("blank");
    }

    @Test
    void sizeInBytes_countsUtf8Bytes() {
        GeneratedFile file = new GeneratedFile("A.cs", "// ✓", "csharp");

        assertThat(file.sizeInBytes()).isEqualTo(6);
    }
}
