package com.sharpgen.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Attribute applied to a type, member or parameter, e.g. {@code [Obsolete("old")]}.
 *
 * <p>Arguments are rendered by literal rules: strings are quoted, characters single-quoted,
 * {@link CodeExpression}s emitted verbatim and everything else in its natural form.
 * {@code null} arguments are allowed and render as {@code null}.
 *
 * @param name attribute name, without the {@code Attribute} suffix if desired
 * @param arguments ordered positional arguments
 */
public record AttributeDefinition(
    String name,
    List<Object> arguments
) implements AstNode {

    public AttributeDefinition {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    /**
     * Creates an attribute with the given positional arguments.
     *
     * @param name attribute name
     * @param arguments argument values
     * @return attribute definition
     */
    public static AttributeDefinition of(String name, Object... arguments) {
        return new AttributeDefinition(name, Arrays.asList(arguments));
    }

    @Override
    public String nodeKind() {
        return "attribute";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }
}
