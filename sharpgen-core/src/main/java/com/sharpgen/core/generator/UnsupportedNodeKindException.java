package com.sharpgen.core.generator;

/**
 * Thrown when a node kind outside the closed set of {@link com.sharpgen.core.ast.AstNode}
 * kinds is handed to the engine.
 */
public class UnsupportedNodeKindException extends CodeGenerationException {

    private final String nodeKind;

    /**
     * Creates the exception for the given kind.
     *
     * @param nodeKind kind or runtime type name of the rejected node
     */
    public UnsupportedNodeKindException(String nodeKind) {
        super("Node kind '" + nodeKind + "' is not supported for code generation");
        this.nodeKind = nodeKind;
    }

    /**
     * Returns the kind or runtime type name of the rejected node.
     *
     * @return node kind
     */
    public String nodeKind() {
        return nodeKind;
    }
}
