package com.sharpgen.core.generator.impl;

import com.sharpgen.core.ast.AccessModifier;
import com.sharpgen.core.ast.CodeExpression;
import com.sharpgen.core.ast.Modifier;
import com.sharpgen.core.generator.LineEndingStyle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CSharpSyntax}.
 */
class CSharpSyntaxTest {

    static Stream<Arguments> literals() {
        return Stream.of(
            Arguments.of("old", "\"old\""),
            Arguments.of("say \"hi\"", "\"say \\\"hi\\\"\""),
            Arguments.of("C:\\temp\n", "\"C:\\\\temp\\n\""),
            Arguments.of('x', "'x'"),
            Arguments.of('\'', "'\\''"),
            Arguments.of(true, "true"),
            Arguments.of(42, "42"),
            Arguments.of(10L, "10L"),
            Arguments.of(1.5f, "1.5f"),
            Arguments.of(2.5d, "2.5"),
            Arguments.of(new BigDecimal("2.50"), "2.50m"),
            Arguments.of(LineEndingStyle.UNIX, "UNIX"),
            Arguments.of(CodeExpression.of("typeof(string)"), "typeof(string)")
        );
    }

    @ParameterizedTest
    @MethodSource("literals")
    void literal_formatsValueAsSourceLiteral(Object value, String expected) {
        assertThat(CSharpSyntax.literal(value)).isEqualTo(expected);
    }

    @Test
    void literal_null_returnsNullKeyword() {
        assertThat(CSharpSyntax.literal(null)).isEqualTo("null");
    }

    @Test
    void modifierPrefix_emitsAccessThenModifiersInGivenOrder() {
        String prefix = CSharpSyntax.modifierPrefix(AccessModifier.PROTECTED_INTERNAL,
            Set.of(Modifier.ASYNC, Modifier.STATIC), CSharpSyntax.METHOD_MODIFIERS);

        assertThat(prefix).isEqualTo("protected internal static async ");
    }

    @Test
    void modifierPrefix_ignoresModifiersNotApplicableToTheKind() {
        String prefix = CSharpSyntax.modifierPrefix(AccessModifier.NONE,
            Set.of(Modifier.ASYNC, Modifier.READONLY), CSharpSyntax.FIELD_MODIFIERS);

        assertThat(prefix).isEqualTo("readonly ");
    }

    @Test
    void accessPrefix_none_isEmpty() {
        assertThat(CSharpSyntax.accessPrefix(AccessModifier.NONE)).isEmpty();
        assertThat(CSharpSyntax.accessPrefix(null)).isEmpty();
        assertThat(CSharpSyntax.accessPrefix(AccessModifier.PRIVATE)).isEqualTo("private ");
    }
}
