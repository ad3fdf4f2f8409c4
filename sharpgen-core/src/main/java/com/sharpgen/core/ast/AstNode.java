package com.sharpgen.core.ast;

/**
 * Base interface for all nodes of the code model.
 *
 * <p>The set of node kinds is closed: every implementation is listed in the {@code permits}
 * clause and every implementation has a matching method on {@link AstVisitor}. Adding a node
 * kind therefore breaks every visitor at compile time until it handles the new kind, which is
 * how the generator guarantees that no node reaches it without a renderer.
 *
 * <p>Nodes are immutable records. A generator never mutates the nodes it is given, so the same
 * tree can be rendered any number of times, from any number of threads.
 *
 * @see AstVisitor
 * @see com.sharpgen.core.json.AstNodeKinds
 */
public sealed interface AstNode permits
    CompilationUnit,
    NamespaceDefinition,
    ClassDefinition,
    InterfaceDefinition,
    FieldDefinition,
    ConstructorDefinition,
    PropertyDefinition,
    AccessorDefinition,
    MethodDefinition,
    ParameterDefinition,
    AttributeDefinition,
    GenericParameterDefinition {

    /**
     * Returns the stable kind name of this node.
     *
     * <p>Kind names are lower camel case ({@code "class"}, {@code "genericParameter"}) and are
     * used as the {@code kind} discriminator in model files and in error messages.
     *
     * @return node kind name
     */
    String nodeKind();

    /**
     * Dispatches this node to the visitor method for its kind.
     *
     * @param visitor the visitor to dispatch to
     * @param <R> visitor result type
     * @return the visitor's result for this node
     */
    <R> R accept(AstVisitor<R> visitor);
}
