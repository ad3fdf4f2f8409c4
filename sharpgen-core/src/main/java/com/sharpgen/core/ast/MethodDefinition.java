package com.sharpgen.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Method of a class or interface.
 *
 * <p>An abstract method, or one without a body, renders as a signature followed by
 * {@code ;}. Otherwise a block is opened and the body text is indented inside it. The body is
 * free-form, pre-formatted statement text; its relative indentation is preserved.
 *
 * <p>Applicable modifiers, in emission order: {@link Modifier#STATIC},
 * {@link Modifier#ABSTRACT}, {@link Modifier#VIRTUAL}, {@link Modifier#OVERRIDE},
 * {@link Modifier#SEALED}, {@link Modifier#ASYNC}.
 *
 * @param name method name
 * @param returnType return type name, {@code void} when not given
 * @param access access modifier
 * @param modifiers declaration modifiers
 * @param parameters ordered parameters
 * @param genericParameters ordered generic type parameters
 * @param body optional body statements
 * @param documentation optional documentation
 * @param attributes attributes applied to the method
 */
public record MethodDefinition(
    String name,
    String returnType,
    AccessModifier access,
    Set<Modifier> modifiers,
    List<ParameterDefinition> parameters,
    List<GenericParameterDefinition> genericParameters,
    String body,
    DocComment documentation,
    List<AttributeDefinition> attributes
) implements AstNode {

    public MethodDefinition {
        Objects.requireNonNull(name, "name must not be null");
        returnType = returnType == null ? "void" : returnType;
        access = access == null ? AccessModifier.NONE : access;
        modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        genericParameters = genericParameters == null ? List.of() : List.copyOf(genericParameters);
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
        return "method";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitMethod(this);
    }

    /**
     * Builder for constructing MethodDefinition incrementally.
     */
    public static class Builder {
        private final String name;
        private String returnType = "void";
        private AccessModifier access = AccessModifier.NONE;
        private final Set<Modifier> modifiers = new HashSet<>();
        private final List<ParameterDefinition> parameters = new ArrayList<>();
        private final List<GenericParameterDefinition> genericParameters = new ArrayList<>();
        private String body;
        private DocComment documentation;
        private final List<AttributeDefinition> attributes = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder returnType(String returnType) {
            this.returnType = returnType;
            return this;
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

        public Builder addGenericParameter(GenericParameterDefinition genericParameter) {
            this.genericParameters.add(genericParameter);
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

        public MethodDefinition build() {
            return new MethodDefinition(name, returnType, access, modifiers, parameters,
                genericParameters, body, documentation, attributes);
        }
    }
}
