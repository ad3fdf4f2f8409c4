package com.sharpgen.core.ast;

/**
 * Declaration modifiers carried by types and members.
 *
 * <p>Which modifiers apply to which node kind, and the order in which they are emitted, is
 * decided by the generator. Illegal combinations (for example {@link #CONST} together with
 * {@link #READONLY}) are not rejected; every applicable modifier that is set gets emitted.
 */
public enum Modifier {
    STATIC("static"),
    ABSTRACT("abstract"),
    VIRTUAL("virtual"),
    OVERRIDE("override"),
    SEALED("sealed"),
    PARTIAL("partial"),
    CONST("const"),
    READONLY("readonly"),
    ASYNC("async");

    private final String keyword;

    Modifier(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
