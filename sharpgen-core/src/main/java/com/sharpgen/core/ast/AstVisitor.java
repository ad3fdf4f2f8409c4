package com.sharpgen.core.ast;

/**
 * Visitor over the closed set of {@link AstNode} kinds.
 *
 * <p>One method per node kind. Implementations are the single extension point for new
 * behaviour over the tree (rendering, counting, transformation).
 *
 * @param <R> result type
 */
public interface AstVisitor<R> {

    R visitCompilationUnit(CompilationUnit node);

    R visitNamespace(NamespaceDefinition node);

    R visitClass(ClassDefinition node);

    R visitInterface(InterfaceDefinition node);

    R visitField(FieldDefinition node);

    R visitConstructor(ConstructorDefinition node);

    R visitProperty(PropertyDefinition node);

    R visitAccessor(AccessorDefinition node);

    R visitMethod(MethodDefinition node);

    R visitParameter(ParameterDefinition node);

    R visitAttribute(AttributeDefinition node);

    R visitGenericParameter(GenericParameterDefinition node);
}
