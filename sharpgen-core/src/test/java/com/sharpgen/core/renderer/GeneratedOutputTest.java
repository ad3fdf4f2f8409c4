package com.sharpgen.core.renderer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GeneratedOutput}.
 */
class GeneratedOutputTest {

    @Test
    void constructor_copiesFiles() {
        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile("A.cs", "a", "csharp"));

        GeneratedOutput output = new GeneratedOutput(files);
        files.add(new GeneratedFile("B.cs", "b", "csharp"));

        assertThat(output.files()).hasSize(1);
        assertThatThrownBy(() -> output.files().add(new GeneratedFile("C.cs", "c", "csharp")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void constructor_withDuplicatePaths_throwsException() {
        List<GeneratedFile> files = List.of(
            new GeneratedFile("A.cs", "first", "csharp"),
            new GeneratedFile("A.cs", "second", "csharp"));

        assertThatThrownBy(() -> new GeneratedOutput(files))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("A.cs");
    }

    @Test
    void constructor_withNullFiles_throwsException() {
        assertThatThrownBy(() -> new GeneratedOutput(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void isEmpty_andTotalBytes() {
        GeneratedOutput empty = new GeneratedOutput(List.of());
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("A.cs", "abc", "csharp"),
            new GeneratedFile("B.cs", "de", "csharp")));

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.totalBytes()).isZero();
        assertThat(output.isEmpty()).isFalse();
        assertThat(output.totalBytes()).isEqualTo(5);
    }
}
