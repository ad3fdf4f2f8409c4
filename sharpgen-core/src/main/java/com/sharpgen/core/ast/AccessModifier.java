package com.sharpgen.core.ast;

/**
 * Declared accessibility of a type or member.
 */
public enum AccessModifier {
    /** No access keyword is emitted; the language default applies */
    NONE(""),

    PUBLIC("public"),

    PRIVATE("private"),

    PROTECTED("protected"),

    INTERNAL("internal"),

    PROTECTED_INTERNAL("protected internal"),

    PRIVATE_PROTECTED("private protected");

    private final String keyword;

    AccessModifier(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the source keyword(s) for this modifier.
     *
     * @return keyword text, empty for {@link #NONE}
     */
    public String keyword() {
        return keyword;
    }
}
