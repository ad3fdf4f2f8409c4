package com.sharpgen.core.format;

/**
 * Handle for one level of indentation opened by {@link CodeFormatter#indent()}.
 *
 * <p>Always used with try-with-resources so the level is released on every exit path,
 * including exceptions:
 * <pre>{@code
 * try (IndentScope scope = formatter.indent()) {
 *     code.append(formatter.indentLines(body));
 * }
 * }</pre>
 *
 * <p>Closing a scope more than once has no further effect.
 */
public final class IndentScope implements AutoCloseable {

    private final CodeFormatter formatter;
    private boolean closed;

    IndentScope(CodeFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            formatter.decreaseIndent();
        }
    }
}
