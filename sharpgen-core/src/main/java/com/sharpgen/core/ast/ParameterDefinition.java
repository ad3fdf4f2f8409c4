package com.sharpgen.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parameter of a method or constructor.
 *
 * @param name parameter name
 * @param type parameter type name
 * @param defaultValue optional default value expression
 * @param modifiers passing modifiers; every modifier present is emitted
 * @param attributes attributes rendered inline before the parameter
 */
public record ParameterDefinition(
    String name,
    String type,
    String defaultValue,
    Set<ParameterModifier> modifiers,
    List<AttributeDefinition> attributes
) implements AstNode {

    public ParameterDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    /**
     * Creates a plain parameter.
     *
     * @param name parameter name
     * @param type parameter type
     * @return parameter definition
     */
    public static ParameterDefinition of(String name, String type) {
        return new ParameterDefinition(name, type, null, Set.of(), List.of());
    }

    public static Builder builder(String name, String type) {
        return new Builder(name, type);
    }

    public boolean hasModifier(ParameterModifier modifier) {
        return modifiers.contains(modifier);
    }

    @Override
    public String nodeKind() {
        return "parameter";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }

    /**
     * Builder for parameters with default values, modifiers or attributes.
     */
    public static class Builder {
        private final String name;
        private final String type;
        private String defaultValue;
        private final Set<ParameterModifier> modifiers = new HashSet<>();
        private final List<AttributeDefinition> attributes = new ArrayList<>();

        private Builder(String name, String type) {
            this.name = name;
            this.type = type;
        }

        public Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder modifiers(ParameterModifier... modifiers) {
            this.modifiers.addAll(Arrays.asList(modifiers));
            return this;
        }

        public Builder addAttribute(AttributeDefinition attribute) {
            this.attributes.add(attribute);
            return this;
        }

        public ParameterDefinition build() {
            return new ParameterDefinition(name, type, defaultValue, modifiers, attributes);
        }
    }
}
