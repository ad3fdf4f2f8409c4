package com.sharpgen.core.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Interface declaration.
 *
 * <p>Interface members are declarations only: properties contribute the presence of their
 * accessors, never bodies or accessor access, and methods contribute their signature.
 *
 * @param name interface name
 * @param access access modifier
 * @param genericParameters ordered generic type parameters
 * @param baseInterfaces ordered base interface names
 * @param properties ordered properties
 * @param methods ordered methods
 * @param documentation optional documentation
 * @param attributes attributes applied to the interface
 */
public record InterfaceDefinition(
    String name,
    AccessModifier access,
    List<GenericParameterDefinition> genericParameters,
    List<String> baseInterfaces,
    List<PropertyDefinition> properties,
    List<MethodDefinition> methods,
    DocComment documentation,
    List<AttributeDefinition> attributes
) implements AstNode {

    public InterfaceDefinition {
        Objects.requireNonNull(name, "name must not be null");
        access = access == null ? AccessModifier.NONE : access;
        genericParameters = genericParameters == null ? List.of() : List.copyOf(genericParameters);
        baseInterfaces = baseInterfaces == null ? List.of() : List.copyOf(baseInterfaces);
        properties = properties == null ? List.of() : List.copyOf(properties);
        methods = methods == null ? List.of() : List.copyOf(methods);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String nodeKind() {
        return "interface";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitInterface(this);
    }

    /**
     * Builder for constructing InterfaceDefinition incrementally.
     */
    public static class Builder {
        private final String name;
        private AccessModifier access = AccessModifier.NONE;
        private final List<GenericParameterDefinition> genericParameters = new ArrayList<>();
        private final List<String> baseInterfaces = new ArrayList<>();
        private final List<PropertyDefinition> properties = new ArrayList<>();
        private final List<MethodDefinition> methods = new ArrayList<>();
        private DocComment documentation;
        private final List<AttributeDefinition> attributes = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder access(AccessModifier access) {
            this.access = access;
            return this;
        }

        public Builder addGenericParameter(GenericParameterDefinition genericParameter) {
            this.genericParameters.add(genericParameter);
            return this;
        }

        public Builder addBaseInterface(String baseInterface) {
            this.baseInterfaces.add(baseInterface);
            return this;
        }

        public Builder addProperty(PropertyDefinition property) {
            this.properties.add(property);
            return this;
        }

        public Builder addMethod(MethodDefinition method) {
            this.methods.add(method);
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

        public InterfaceDefinition build() {
            return new InterfaceDefinition(name, access, genericParameters, baseInterfaces, properties,
                methods, documentation, attributes);
        }
    }
}
