package com.sharpgen.core.ast;

import java.util.Objects;

/**
 * A {@code get}, {@code set} or {@code init} accessor of a property.
 *
 * @param kind accessor kind
 * @param access optional narrower access, {@code null} or {@link AccessModifier#NONE} for none
 * @param body optional accessor body statements; absent for auto-implemented accessors
 */
public record AccessorDefinition(
    AccessorKind kind,
    AccessModifier access,
    String body
) implements AstNode {

    public AccessorDefinition {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static AccessorDefinition get() {
        return new AccessorDefinition(AccessorKind.GET, null, null);
    }

    public static AccessorDefinition get(String body) {
        return new AccessorDefinition(AccessorKind.GET, null, body);
    }

    public static AccessorDefinition set() {
        return new AccessorDefinition(AccessorKind.SET, null, null);
    }

    public static AccessorDefinition set(String body) {
        return new AccessorDefinition(AccessorKind.SET, null, body);
    }

    public static AccessorDefinition init() {
        return new AccessorDefinition(AccessorKind.INIT, null, null);
    }

    /**
     * Returns a copy of this accessor with the given access modifier.
     *
     * @param access accessor access modifier
     * @return new accessor definition
     */
    public AccessorDefinition withAccess(AccessModifier access) {
        return new AccessorDefinition(kind, access, body);
    }

    /**
     * Whether this accessor carries a non-blank body.
     *
     * @return true if the accessor must be rendered as an explicit block
     */
    public boolean hasBody() {
        return body != null && !body.isBlank();
    }

    @Override
    public String nodeKind() {
        return "accessor";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAccessor(this);
    }
}
