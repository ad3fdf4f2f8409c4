package com.sharpgen.core.json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.sharpgen.core.ast.AccessorDefinition;
import com.sharpgen.core.ast.AstNode;
import com.sharpgen.core.ast.AttributeDefinition;
import com.sharpgen.core.ast.ClassDefinition;
import com.sharpgen.core.ast.CompilationUnit;
import com.sharpgen.core.ast.ConstructorDefinition;
import com.sharpgen.core.ast.FieldDefinition;
import com.sharpgen.core.ast.GenericParameterDefinition;
import com.sharpgen.core.ast.InterfaceDefinition;
import com.sharpgen.core.ast.MethodDefinition;
import com.sharpgen.core.ast.NamespaceDefinition;
import com.sharpgen.core.ast.ParameterDefinition;
import com.sharpgen.core.ast.PropertyDefinition;
import com.sharpgen.core.generator.UnsupportedNodeKindException;

/**
 * Registry of node kind names as they appear in model files.
 *
 * <p>The names match {@link AstNode#nodeKind()} of the corresponding record.
 */
public final class AstNodeKinds {

    private static final Map<String, Class<? extends AstNode>> KINDS;

    static {
        Map<String, Class<? extends AstNode>> kinds = new LinkedHashMap<>();
        kinds.put("compilationUnit", CompilationUnit.class);
        kinds.put("namespace", NamespaceDefinition.class);
        kinds.put("class", ClassDefinition.class);
        kinds.put("interface", InterfaceDefinition.class);
        kinds.put("field", FieldDefinition.class);
        kinds.put("constructor", ConstructorDefinition.class);
        kinds.put("property", PropertyDefinition.class);
        kinds.put("accessor", AccessorDefinition.class);
        kinds.put("method", MethodDefinition.class);
        kinds.put("parameter", ParameterDefinition.class);
        kinds.put("attribute", AttributeDefinition.class);
        kinds.put("genericParameter", GenericParameterDefinition.class);
        KINDS = Collections.unmodifiableMap(kinds);
    }

    private AstNodeKinds() {
    }

    /**
     * Resolves a kind name to its node type.
     *
     * @param kind kind name, e.g. {@code "class"}
     * @return node record type
     * @throws UnsupportedNodeKindException if the name is not a known kind
     */
    public static Class<? extends AstNode> typeOf(String kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        Class<? extends AstNode> type = KINDS.get(kind);
        if (type == null) {
            throw new UnsupportedNodeKindException(kind);
        }
        return type;
    }

    /**
     * Returns all known kind names in declaration order.
     *
     * @return kind names
     */
    public static Set<String> kinds() {
        return KINDS.keySet();
    }
}
