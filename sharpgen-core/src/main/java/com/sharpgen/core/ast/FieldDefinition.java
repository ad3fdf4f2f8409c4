package com.sharpgen.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Field of a class.
 *
 * <p>Applicable modifiers: {@link Modifier#STATIC}, {@link Modifier#CONST},
 * {@link Modifier#READONLY}.
 *
 * @param name field name
 * @param type field type name
 * @param access access modifier
 * @param modifiers declaration modifiers
 * @param initialValue optional initializer expression
 * @param documentation optional documentation
 * @param attributes attributes applied to the field
 */
public record FieldDefinition(
    String name,
    String type,
    AccessModifier access,
    Set<Modifier> modifiers,
    String initialValue,
    DocComment documentation,
    List<AttributeDefinition> attributes
) implements AstNode {

    public FieldDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        access = access == null ? AccessModifier.NONE : access;
        modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public static Builder builder(String name, String type) {
        return new Builder(name, type);
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    @Override
    public String nodeKind() {
        return "field";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitField(this);
    }

    /**
     * Builder for constructing FieldDefinition incrementally.
     */
    public static class Builder {
        private final String name;
        private final String type;
        private AccessModifier access = AccessModifier.NONE;
        private final Set<Modifier> modifiers = new HashSet<>();
        private String initialValue;
        private DocComment documentation;
        private final List<AttributeDefinition> attributes = new ArrayList<>();

        private Builder(String name, String type) {
            this.name = name;
            this.type = type;
        }

        public Builder access(AccessModifier access) {
            this.access = access;
            return this;
        }

        public Builder modifiers(Modifier... modifiers) {
            this.modifiers.addAll(Arrays.asList(modifiers));
            return this;
        }

        public Builder initialValue(String initialValue) {
            this.initialValue = initialValue;
            return this;
        }

        public Builder documentation(DocComment documentation) {
            this.documentation = documentation;
            return this;
        }

        public Builder documentation(String summary) {
            return documentation(DocComment.of(summary));
        }

        public Builder addAttribute(AttributeDefinition attribute) {
            this.attributes.add(attribute);
            return this;
        }

        public FieldDefinition build() {
            return new FieldDefinition(name, type, access, modifiers, initialValue, documentation, attributes);
        }
    }
}
