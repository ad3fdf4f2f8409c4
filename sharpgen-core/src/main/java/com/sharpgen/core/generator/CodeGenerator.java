package com.sharpgen.core.generator;

import com.sharpgen.core.ast.AstNode;
import java.util.List;

/**
 * Interface for generators that render {@link AstNode} trees into source text.
 *
 * <p>A generator is a pure transformation: given the same node and options it always returns
 * the same text. Implementations hold no state between calls; every call creates its own
 * formatting session, so one generator instance can serve concurrent callers.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * CodeGenerator generator = new CSharpCodeGenerator();
 *
 * ClassDefinition widget = ClassDefinition.builder("Widget")
 *     .access(AccessModifier.PUBLIC)
 *     .addProperty(PropertyDefinition.builder("Count", "int")
 *         .access(AccessModifier.PUBLIC)
 *         .getter()
 *         .setter()
 *         .build())
 *     .build();
 *
 * String source = generator.generate(widget);
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sharpgen.core.generator.CodeGenerator}
 *
 * @see GeneratorOptions
 */
public interface CodeGenerator {

    /**
     * Returns unique identifier for this generator (e.g., "csharp").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated sources, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Renders a node with {@link GeneratorOptions#defaults()}.
     *
     * @param node node to render
     * @return generated source text
     * @throws NullPointerException if node is null
     */
    default String generate(AstNode node) {
        return generate(node, GeneratorOptions.defaults());
    }

    /**
     * Renders a node.
     *
     * <p>The returned text carries no leading indentation and no trailing line terminator.
     *
     * @param node node to render
     * @param options rendering options
     * @return generated source text
     * @throws NullPointerException if node or options is null
     * @throws UnsupportedNodeKindException if the node kind cannot be rendered
     */
    String generate(AstNode node, GeneratorOptions options);

    /**
     * Renders several nodes with {@link GeneratorOptions#defaults()}.
     *
     * @param nodes nodes to render
     * @return generated source text
     */
    default String generateMultiple(List<? extends AstNode> nodes) {
        return generateMultiple(nodes, GeneratorOptions.defaults());
    }

    /**
     * Renders each node independently and joins the non-empty results with exactly one
     * blank line between consecutive results.
     *
     * @param nodes nodes to render
     * @param options rendering options
     * @return generated source text
     * @throws NullPointerException if nodes, any node or options is null
     */
    String generateMultiple(List<? extends AstNode> nodes, GeneratorOptions options);
}
