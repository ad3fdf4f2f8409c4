package com.sharpgen.core.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Root of a source file: import directives followed by namespaces and top-level types.
 *
 * <p>Order is emission order. Import directives are neither sorted nor de-duplicated unless
 * the generator options request sorting.
 *
 * @param usings ordered import directives, either bare ({@code System.Text}) or complete
 *               ({@code using static System.Math;})
 * @param namespaces ordered namespaces
 * @param classes ordered top-level classes
 * @param interfaces ordered top-level interfaces
 */
public record CompilationUnit(
    List<String> usings,
    List<NamespaceDefinition> namespaces,
    List<ClassDefinition> classes,
    List<InterfaceDefinition> interfaces
) implements AstNode {

    public CompilationUnit {
        usings = usings == null ? List.of() : List.copyOf(usings);
        namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
        classes = classes == null ? List.of() : List.copyOf(classes);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String nodeKind() {
        return "compilationUnit";
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCompilationUnit(this);
    }

    public static class Builder {
        private final List<String> usings = new ArrayList<>();
        private final List<NamespaceDefinition> namespaces = new ArrayList<>();
        private final List<ClassDefinition> classes = new ArrayList<>();
        private final List<InterfaceDefinition> interfaces = new ArrayList<>();

        private Builder() {
        }

        public Builder addUsings(String... usings) {
            this.usings.addAll(Arrays.asList(usings));
            return this;
        }

        public Builder addNamespace(NamespaceDefinition namespace) {
            this.namespaces.add(namespace);
            return this;
        }

        public Builder addClass(ClassDefinition classDefinition) {
            this.classes.add(classDefinition);
            return this;
        }

        public Builder addInterface(InterfaceDefinition interfaceDefinition) {
            this.interfaces.add(interfaceDefinition);
            return this;
        }

        public CompilationUnit build() {
            return new CompilationUnit(usings, namespaces, classes, interfaces);
        }
    }
}
