package com.sharpgen.core.ast;

/**
 * Passing modifiers of a method or constructor parameter.
 */
public enum ParameterModifier {
    REF("ref"),
    OUT("out"),
    IN("in"),
    PARAMS("params");

    private final String keyword;

    ParameterModifier(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
