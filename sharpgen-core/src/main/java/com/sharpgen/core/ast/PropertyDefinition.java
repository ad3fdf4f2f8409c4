package com.sharpgen.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Property of a class or interface.
 *
 * <p>A property is rendered in auto-implemented form ({@code { get; set; }}) when none of its
 * present accessors carries a body, and with every accessor as an explicit block otherwise.
 * Mixing auto and explicit accessors on one property is a caller convention, not something
 * the generator enforces.
 *
 * <p>Applicable modifiers: {@link Modifier#STATIC}, {@link Modifier#VIRTUAL},
 * {@link Modifier#OVERRIDE}, {@link Modifier#ABSTRACT}.
 *
 * @param name property name
 * @param type property type name
 * @param access access modifier
 * @param modifiers declaration modifiers
 * @param getter optional get accessor
 * @param setter optional set accessor
 * @param init optional init accessor
 * @param documentation optional documentation
 * @param attributes attributes applied to the property
 */
public record PropertyDefinition(
    String name,
    String type,
    AccessModifier access,
    Set<Modifier> modifiers,
    AccessorDefinition getter,
    AccessorDefinition setter,
    AccessorDefinition init,
    DocComment documentation,
    List<AttributeDefinition> attributes
) implements AstNode {

    public PropertyDefinition {
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

    /**
     * Returns the present accessors in emission order: get, set, init.
     *
     * @return present accessors
     */
    public List<AccessorDefinition> accessors() {
        return Stream.of(getter, setter, init)
            .filter(Objects::nonNull)
            .toList();
    }

    /**
     * Whether every present accessor lacks a body.
     *
     * @return true if the property renders in auto-implemented form
     */
    public boolean isAutoImplemented() {
        return accessors().stream().noneMatch(AccessorDefinition::hasBody);
    }

    @Override
    public String nodeKind() {
        return "property";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProperty(this);
    }

    /**
     * Builder for constructing PropertyDefinition incrementally.
     */
    public static class Builder {
        private final String name;
        private final String type;
        private AccessModifier access = AccessModifier.NONE;
        private final Set<Modifier> modifiers = new HashSet<>();
        private AccessorDefinition getter;
        private AccessorDefinition setter;
        private AccessorDefinition init;
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

        public Builder getter() {
            return getter(AccessorDefinition.get());
        }

        public Builder getter(AccessorDefinition getter) {
            this.getter = getter;
            return this;
        }

        public Builder setter() {
            return setter(AccessorDefinition.set());
        }

        public Builder setter(AccessorDefinition setter) {
            this.setter = setter;
            return this;
        }

        public Builder init() {
            return init(AccessorDefinition.init());
        }

        public Builder init(AccessorDefinition init) {
            this.init = init;
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

        public PropertyDefinition build() {
            return new PropertyDefinition(name, type, access, modifiers, getter, setter, init,
                documentation, attributes);
        }
    }
}
