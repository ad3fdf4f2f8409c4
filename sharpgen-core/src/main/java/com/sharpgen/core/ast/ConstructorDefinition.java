package com.sharpgen.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Constructor of a class.
 *
 * <p>A static constructor ({@link Modifier#STATIC}) is rendered without access modifier,
 * parameters or base call, as the language requires.
 *
 * @param name constructor identifier, normally the declaring class name
 * @param access access modifier
 * @param modifiers declaration modifiers; only {@link Modifier#STATIC} applies
 * @param parameters ordered parameters
 * @param baseCall optional initializer call such as {@code base(name)} or {@code this(0)}
 * @param body optional body statements
 * @param documentation optional documentation
 * @param attributes attributes applied to the constructor
 */
public record ConstructorDefinition(
    String name,
    AccessModifier access,
    Set<Modifier> modifiers,
    List<ParameterDefinition> parameters,
    String baseCall,
    String body,
    DocComment documentation,
    List<AttributeDefinition> attributes
) implements AstNode {

    public ConstructorDefinition {
        Objects.requireNonNull(name, "name must not be null");
        access = access == null ? AccessModifier.NONE : access;
        modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }

    @Override
    public String nodeKind() {
        return "constructor";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitConstructor(this);
    }

    /**
     * Builder for constructing ConstructorDefinition incrementally.
     */
    public static class Builder {
        private final String name;
        private AccessModifier access = AccessModifier.NONE;
        private final Set<Modifier> modifiers = new HashSet<>();
        private final List<ParameterDefinition> parameters = new ArrayList<>();
        private String baseCall;
        private String body;
        private DocComment documentation;
        private final List<AttributeDefinition> attributes = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder access(AccessModifier access) {
            this.access = access;
            return this;
        }

        public Builder modifiers(Modifier... modifiers) {
            this.modifiers.addAll(Arrays.asList(modifiers));
            return this;
        }

        public Builder addParameter(ParameterDefinition parameter) {
            this.parameters.add(parameter);
            return this;
        }

        public Builder addParameter(String name, String type) {
            return addParameter(ParameterDefinition.of(name, type));
        }

        public Builder baseCall(String baseCall) {
            this.baseCall = baseCall;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
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

        public ConstructorDefinition build() {
            return new ConstructorDefinition(name, access, modifiers, parameters, baseCall, body,
                documentation, attributes);
        }
    }
}
