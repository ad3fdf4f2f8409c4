package com.sharpgen.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Class declaration.
 *
 * <p>Members are rendered in a fixed order regardless of how they were added: fields,
 * constructors, properties, methods.
 *
 * <p>Applicable modifiers, in emission order: {@link Modifier#STATIC},
 * {@link Modifier#ABSTRACT}, {@link Modifier#SEALED} (mutually exclusive by convention) and
 * {@link Modifier#PARTIAL}.
 *
 * @param name class name
 * @param access access modifier
 * @param modifiers declaration modifiers
 * @param baseClass optional base class name
 * @param interfaces ordered implemented interface names
 * @param genericParameters ordered generic type parameters
 * @param fields ordered fields
 * @param constructors ordered constructors
 * @param properties ordered properties
 * @param methods ordered methods
 * @param documentation optional documentation
 * @param attributes attributes applied to the class
 */
public record ClassDefinition(
    String name,
    AccessModifier access,
    Set<Modifier> modifiers,
    String baseClass,
    List<String> interfaces,
    List<GenericParameterDefinition> genericParameters,
    List<FieldDefinition> fields,
    List<ConstructorDefinition> constructors,
    List<PropertyDefinition> properties,
    List<MethodDefinition> methods,
    DocComment documentation,
    List<AttributeDefinition> attributes
) implements AstNode {

    public ClassDefinition {
        Objects.requireNonNull(name, "name must not be null");
        access = access == null ? AccessModifier.NONE : access;
        modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
        genericParameters = genericParameters == null ? List.of() : List.copyOf(genericParameters);
        fields = fields == null ? List.of() : List.copyOf(fields);
        constructors = constructors == null ? List.of() : List.copyOf(constructors);
        properties = properties == null ? List.of() : List.copyOf(properties);
        methods = methods == null ? List.of() : List.copyOf(methods);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean hasModifier(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    /**
     * Whether the class declares no members at all.
     *
     * @return true if fields, constructors, properties and methods are all empty
     */
    public boolean hasNoMembers() {
        return fields.isEmpty() && constructors.isEmpty() && properties.isEmpty() && methods.isEmpty();
    }

    @Override
    public String nodeKind() {
        return "class";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitClass(this);
    }

    /**
     * Builder for constructing ClassDefinition incrementally.
     */
    public static class Builder {
        private final String name;
        private AccessModifier access = AccessModifier.NONE;
        private final Set<Modifier> modifiers = new HashSet<>();
        private String baseClass;
        private final List<String> interfaces = new ArrayList<>();
        private final List<GenericParameterDefinition> genericParameters = new ArrayList<>();
        private final List<FieldDefinition> fields = new ArrayList<>();
        private final List<ConstructorDefinition> constructors = new ArrayList<>();
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

        public Builder modifiers(Modifier... modifiers) {
            this.modifiers.addAll(Arrays.asList(modifiers));
            return this;
        }

        public Builder baseClass(String baseClass) {
            this.baseClass = baseClass;
            return this;
        }

        public Builder addInterface(String interfaceName) {
            this.interfaces.add(interfaceName);
            return this;
        }

        public Builder addGenericParameter(GenericParameterDefinition genericParameter) {
            this.genericParameters.add(genericParameter);
            return this;
        }

        public Builder addField(FieldDefinition field) {
            this.fields.add(field);
            return this;
        }

        public Builder addConstructor(ConstructorDefinition constructor) {
            this.constructors.add(constructor);
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

        public ClassDefinition build() {
            return new ClassDefinition(name, access, modifiers, baseClass, interfaces, genericParameters,
                fields, constructors, properties, methods, documentation, attributes);
        }
    }
}
