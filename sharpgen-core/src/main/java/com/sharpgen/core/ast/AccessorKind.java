package com.sharpgen.core.ast;

/**
 * Kind of a property accessor.
 */
public enum AccessorKind {
    GET("get"),
    SET("set"),
    INIT("init");

    private final String keyword;

    AccessorKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
