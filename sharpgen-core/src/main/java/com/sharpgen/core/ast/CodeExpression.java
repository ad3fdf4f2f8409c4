package com.sharpgen.core.ast;

import java.util.Objects;

/**
 * Attribute argument that is emitted verbatim instead of as a literal.
 *
 * <p>Use for expressions such as {@code typeof(Order)}, {@code AttributeTargets.Class} or
 * named arguments like {@code AllowMultiple = true}.
 *
 * @param code expression source text
 */
public record CodeExpression(String code) {

    public CodeExpression {
        Objects.requireNonNull(code, "code must not be null");
    }

    public static CodeExpression of(String code) {
        return new CodeExpression(code);
    }

    @Override
    public String toString() {
        return code;
    }
}
