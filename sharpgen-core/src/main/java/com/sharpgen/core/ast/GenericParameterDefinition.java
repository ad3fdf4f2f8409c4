package com.sharpgen.core.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Generic type parameter of a class, interface or method.
 *
 * <p>The name is emitted inline in the declaration's type parameter list. Constraints are
 * emitted separately as a {@code where T : ...} clause attached to the owning declaration.
 *
 * @param name type parameter name
 * @param constraints ordered constraint expressions ({@code class}, {@code new()}, type names)
 */
public record GenericParameterDefinition(
    String name,
    List<String> constraints
) implements AstNode {

    public GenericParameterDefinition {
        Objects.requireNonNull(name, "name must not be null");
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    public static GenericParameterDefinition of(String name, String... constraints) {
        return new GenericParameterDefinition(name, Arrays.asList(constraints));
    }

    @Override
    public String nodeKind() {
        return "genericParameter";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitGenericParameter(this);
    }
}
