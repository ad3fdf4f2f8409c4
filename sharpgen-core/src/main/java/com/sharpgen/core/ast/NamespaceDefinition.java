package com.sharpgen.core.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Namespace grouping classes and interfaces.
 *
 * @param name dotted namespace name
 * @param classes ordered classes
 * @param interfaces ordered interfaces, emitted after the classes
 */
public record NamespaceDefinition(
    String name,
    List<ClassDefinition> classes,
    List<InterfaceDefinition> interfaces
) implements AstNode {

    public NamespaceDefinition {
        Objects.requireNonNull(name, "name must not be null");
        classes = classes == null ? List.of() : List.copyOf(classes);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String nodeKind() {
        return "namespace";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNamespace(this);
    }

    public static class Builder {
        private final String name;
        private final List<ClassDefinition> classes = new ArrayList<>();
        private final List<InterfaceDefinition> interfaces = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder addClass(ClassDefinition classDefinition) {
            this.classes.add(classDefinition);
            return this;
        }

        public Builder addInterface(InterfaceDefinition interfaceDefinition) {
            this.interfaces.add(interfaceDefinition);
            return this;
        }

        public NamespaceDefinition build() {
            return new NamespaceDefinition(name, classes, interfaces);
        }
    }
}
