package com.sharpgen.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sharpgen.core.ast.AstNode;
import com.sharpgen.core.format.CodeFormatter;
import com.sharpgen.core.generator.CodeGenerator;
import com.sharpgen.core.generator.GeneratorOptions;

/**
 * Generates C# source code from AST nodes.
 *
 * <p>Each call to {@link #generate(AstNode, GeneratorOptions)} or
 * {@link #generateMultiple(List, GeneratorOptions)} is one session: it owns a fresh
 * {@link CodeFormatter} and {@link CSharpRenderer}, renders at depth zero and converts line
 * breaks to the configured terminator once at the end. The generator itself is stateless.
 *
 * <h2>Output Shape</h2>
 * <ul>
 *   <li>Documentation comments and attributes precede each declaration</li>
 *   <li>Class members are emitted as fields, constructors, properties, then methods</li>
 *   <li>Consecutive members and types are separated by exactly one blank line</li>
 *   <li>Parameter lists wrap one per line once they exceed {@code maxLineLength}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CSharpCodeGenerator generator = new CSharpCodeGenerator();
 * MethodDefinition run = MethodDefinition.builder("Run")
 *     .access(AccessModifier.PUBLIC)
 *     .modifiers(Modifier.ABSTRACT)
 *     .build();
 *
 * generator.generate(run); // "public abstract void Run();"
 * }</pre>
 */
public class CSharpCodeGenerator implements CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CSharpCodeGenerator.class);

    private static final String GENERATOR_ID = "csharp";
    private static final String GENERATOR_DISPLAY_NAME = "C# Code Generator";
    private static final String FILE_EXTENSION = "cs";
    private static final String RESULT_SEPARATOR = "\n\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public String generate(AstNode node, GeneratorOptions options) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(options, "options must not be null");

        CodeFormatter formatter = new CodeFormatter(options);
        String code = render(node, formatter);
        return formatter.normalizeLineEndings(code);
    }

    @Override
    public String generateMultiple(List<? extends AstNode> nodes, GeneratorOptions options) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(options, "options must not be null");

        log.debug("Generating {} nodes", nodes.size());
        CodeFormatter formatter = new CodeFormatter(options);
        List<String> results = new ArrayList<>(nodes.size());
        for (AstNode node : nodes) {
            Objects.requireNonNull(node, "node must not be null");
            String code = render(node, formatter);
            if (!code.isBlank()) {
                results.add(code);
            }
        }
        return formatter.normalizeLineEndings(String.join(RESULT_SEPARATOR, results));
    }

    /**
     * Renders one node at the formatter's current depth, without line-ending conversion.
     *
     * @throws IllegalStateException if the render leaves the indentation depth changed
     */
    String render(AstNode node, CodeFormatter formatter) {
        int startDepth = formatter.depth();
        log.debug("Rendering {} node", node.nodeKind());

        String code = node.accept(new CSharpRenderer(formatter));

        if (formatter.depth() != startDepth) {
            throw new IllegalStateException("Unbalanced indentation after rendering " + node.nodeKind()
                + ": depth " + formatter.depth() + ", expected " + startDepth);
        }
        log.debug("Rendered {} node ({} indent scopes opened, {} closed)",
            node.nodeKind(), formatter.scopesOpened(), formatter.scopesClosed());
        return code;
    }
}
