package com.sharpgen.core.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Documentation attached to a type or member, rendered as an XML doc comment.
 *
 * @param summary summary text, may span several lines
 * @param parameters parameter name to description, in emission order
 * @param returns optional description of the return value
 * @param remarks optional remarks text, may span several lines
 */
public record DocComment(
    String summary,
    Map<String, String> parameters,
    String returns,
    String remarks
) {
    /**
     * Compact constructor with validation.
     */
    public DocComment {
        Objects.requireNonNull(summary, "summary must not be null");
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Creates documentation consisting of a summary only.
     *
     * @param summary summary text
     * @return doc comment
     */
    public static DocComment of(String summary) {
        return new DocComment(summary, Map.of(), null, null);
    }

    /**
     * Returns a copy with an additional parameter description.
     *
     * @param name parameter name
     * @param description parameter description
     * @return new doc comment
     */
    public DocComment withParameter(String name, String description) {
        Map<String, String> copy = new LinkedHashMap<>(parameters);
        copy.put(name, description);
        return new DocComment(summary, copy, returns, remarks);
    }

    public DocComment withReturns(String returns) {
        return new DocComment(summary, parameters, returns, remarks);
    }

    public DocComment withRemarks(String remarks) {
        return new DocComment(summary, parameters, returns, remarks);
    }
}
