package com.sharpgen.core.generator.impl;

import com.sharpgen.core.ast.AccessModifier;
import com.sharpgen.core.ast.CodeExpression;
import com.sharpgen.core.ast.Modifier;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Keyword ordering and literal formatting rules of the C# language.
 */
final class CSharpSyntax {

    static final List<Modifier> CLASS_MODIFIERS = List.of(
        Modifier.STATIC, Modifier.ABSTRACT, Modifier.SEALED, Modifier.PARTIAL);

    static final List<Modifier> METHOD_MODIFIERS = List.of(
        Modifier.STATIC, Modifier.ABSTRACT, Modifier.VIRTUAL, Modifier.OVERRIDE, Modifier.SEALED, Modifier.ASYNC);

    static final List<Modifier> PROPERTY_MODIFIERS = List.of(
        Modifier.STATIC, Modifier.ABSTRACT, Modifier.VIRTUAL, Modifier.OVERRIDE, Modifier.SEALED);

    static final List<Modifier> FIELD_MODIFIERS = List.of(
        Modifier.STATIC, Modifier.CONST, Modifier.READONLY);

    private CSharpSyntax() {
    }

    static String accessPrefix(AccessModifier access) {
        return access == null || access == AccessModifier.NONE ? "" : access.keyword() + " ";
    }

    /**
     * Builds the modifier prefix of a declaration: access keyword first, then every set
     * modifier in the given order, each followed by a space.
     */
    static String modifierPrefix(AccessModifier access, Set<Modifier> modifiers, List<Modifier> order) {
        StringBuilder prefix = new StringBuilder(accessPrefix(access));
        for (Modifier modifier : order) {
            if (modifiers.contains(modifier)) {
                prefix.append(modifier.keyword()).append(' ');
            }
        }
        return prefix.toString();
    }

    /**
     * Formats an attribute argument as a source literal.
     *
     * @param value argument value, may be null
     * @return literal source text
     */
    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CodeExpression expression) {
            return expression.code();
        }
        if (value instanceof CharSequence text) {
            return '"' + escape(text.toString(), '"') + '"';
        }
        if (value instanceof Character character) {
            return "'" + escape(character.toString(), '\'') + "'";
        }
        if (value instanceof Float number) {
            return number + "f";
        }
        if (value instanceof Long number) {
            return number + "L";
        }
        if (value instanceof BigDecimal number) {
            return number.toPlainString() + "m";
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return value.toString();
    }

    private static String escape(String text, char quote) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> escaped.append("\\\\");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                case '\0' -> escaped.append("\\0");
                default -> {
                    if (c == quote) {
                        escaped.append('\\');
                    }
                    escaped.append(c);
                }
            }
        }
        return escaped.toString();
    }
}
