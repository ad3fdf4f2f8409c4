package com.sharpgen.core.format;

import com.sharpgen.core.ast.DocComment;
import com.sharpgen.core.generator.GeneratorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Session-scoped formatting state for generated source code.
 *
 * <p>Owns the current indentation depth so renderers do not have to thread it through every
 * call. Depth is changed only through {@link #indent()} scopes, which must be balanced: after
 * a complete render the depth is back at its starting value.
 *
 * <p>Text produced by this class always uses {@code \n} internally. Conversion to the
 * configured line terminator happens once, at the end of a session, via
 * {@link #normalizeLineEndings(String)}.
 *
 * <p>Instances are not thread-safe. One formatter belongs to exactly one generation session
 * and must not be shared between concurrent renders.
 */
public final class CodeFormatter {

    private static final Logger log = LoggerFactory.getLogger(CodeFormatter.class);

    static final String NEWLINE = "\n";
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");
    private static final String PARAMETER_SEPARATOR = ", ";
    private static final String DOC_PREFIX = "/// ";
    private static final String DOC_BLANK = "///";
    private static final String USING_KEYWORD = "using ";
    private static final String GLOBAL_USING_KEYWORD = "global using ";

    private final GeneratorOptions options;
    private int depth;
    private int scopesOpened;
    private int scopesClosed;

    /**
     * Creates a formatter at depth zero.
     *
     * @param options generator options supplying indentation, wrapping and line endings
     */
    public CodeFormatter(GeneratorOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Enters one indentation level.
     *
     * @return scope handle that leaves the level again when closed
     */
    public IndentScope indent() {
        depth++;
        scopesOpened++;
        return new IndentScope(this);
    }

    /**
     * Leaves one indentation level.
     *
     * <p>Clamped at zero: an unmatched call is logged and otherwise ignored.
     */
    public void decreaseIndent() {
        if (depth == 0) {
            log.warn("Indent depth already at zero, ignoring unmatched decrease");
            return;
        }
        depth--;
        scopesClosed++;
    }

    public int depth() {
        return depth;
    }

    public int scopesOpened() {
        return scopesOpened;
    }

    public int scopesClosed() {
        return scopesClosed;
    }

    public GeneratorOptions options() {
        return options;
    }

    /**
     * Returns the indentation prefix for the current depth.
     *
     * @return indentation unit repeated {@link #depth()} times
     */
    public String currentIndent() {
        return options.indentation().repeat(depth);
    }

    /**
     * Prefixes a single line with the current indentation.
     *
     * @param line line text without terminator
     * @return indented line, or the line unchanged if it is blank
     */
    public String indentText(String line) {
        if (line == null || line.isBlank()) {
            return line;
        }
        return currentIndent() + line;
    }

    /**
     * Prefixes every non-blank line of a block with the current indentation.
     *
     * <p>Blank lines are kept verbatim. Any of {@code \r\n}, {@code \r} and {@code \n} is
     * accepted as a line break in the input; the result uses {@code \n}.
     *
     * @param text multi-line text
     * @return indented text
     */
    public String indentLines(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String[] lines = LINE_BREAK.split(text, -1);
        List<String> indented = new ArrayList<>(lines.length);
        for (String line : lines) {
            indented.add(indentText(line));
        }
        return String.join(NEWLINE, indented);
    }

    /**
     * Returns the configured line terminator.
     *
     * @return line terminator characters
     */
    public String lineEnding() {
        return options.lineEndings().separator();
    }

    /**
     * Rewrites every line break in the text to the configured line terminator.
     *
     * @param code text with arbitrary line breaks
     * @return text with normalized line breaks
     */
    public String normalizeLineEndings(String code) {
        if (code == null || code.isEmpty()) {
            return code;
        }
        return LINE_BREAK.matcher(code).replaceAll(Matcher.quoteReplacement(lineEnding()));
    }

    /**
     * Formats rendered parameters for use between parentheses.
     *
     * <p>The list stays on one line when its single-line length is at most
     * {@code maxLineLength}, or when wrapping is disabled. Only when it is longer does it wrap:
     * every parameter then goes on its own line, one level deeper than the current depth,
     * terminated by a comma except for the last one. The wrapped form starts with a line
     * break so the caller can append it directly after the opening parenthesis.
     *
     * @param parameters rendered parameters
     * @return parameter list text
     */
    public String formatParameterList(List<String> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return "";
        }

        String singleLine = String.join(PARAMETER_SEPARATOR, parameters);
        if (!options.wrappingEnabled() || singleLine.length() <= options.maxLineLength()) {
            return singleLine;
        }

        log.debug("Wrapping parameter list of {} characters (max {})", singleLine.length(), options.maxLineLength());
        StringBuilder wrapped = new StringBuilder();
        try (IndentScope scope = indent()) {
            for (int i = 0; i < parameters.size(); i++) {
                wrapped.append(NEWLINE).append(indentText(parameters.get(i)));
                if (i < parameters.size() - 1) {
                    wrapped.append(',');
                }
            }
        }
        return wrapped.toString();
    }

    /**
     * Word-wraps text at the given column budget.
     *
     * <p>Each input line is wrapped on its own; lines within the budget are untouched. Words
     * longer than the budget are kept whole on a line of their own.
     *
     * @param text text to wrap
     * @param limit maximum line length, zero or negative to disable wrapping
     * @return wrapped text joined with {@code \n}
     */
    public String wrapText(String text, int limit) {
        if (limit <= 0 || text == null || text.isBlank()) {
            return text;
        }
        List<String> result = new ArrayList<>();
        for (String line : LINE_BREAK.split(text, -1)) {
            result.addAll(wrapLine(line, limit));
        }
        return String.join(NEWLINE, result);
    }

    /**
     * Wraps text using the configured {@code maxLineLength}.
     *
     * @param text text to wrap
     * @return wrapped text
     */
    public String wrapText(String text) {
        return wrapText(text, options.maxLineLength());
    }

    /**
     * Renders an XML documentation comment at the current depth.
     *
     * <p>Summary and remarks are split on line breaks and word-wrapped so that each comment
     * line, including indentation and the {@code ///} token, fits {@code maxLineLength}.
     * {@code &}, {@code <} and {@code >} in any documentation text are written as entities.
     *
     * @param documentation documentation to render
     * @return comment lines joined with {@code \n}
     */
    public String formatDocumentation(DocComment documentation) {
        Objects.requireNonNull(documentation, "documentation must not be null");

        List<String> lines = new ArrayList<>();
        lines.add(DOC_PREFIX + "<summary>");
        appendDocText(lines, documentation.summary());
        lines.add(DOC_PREFIX + "</summary>");

        for (Map.Entry<String, String> param : documentation.parameters().entrySet()) {
            lines.add(DOC_PREFIX + "<param name=\"" + escapeXml(param.getKey()) + "\">"
                + escapeXml(param.getValue()) + "</param>");
        }

        if (documentation.returns() != null && !documentation.returns().isBlank()) {
            lines.add(DOC_PREFIX + "<returns>" + escapeXml(documentation.returns()) + "</returns>");
        }

        if (documentation.remarks() != null && !documentation.remarks().isBlank()) {
            lines.add(DOC_PREFIX + "<remarks>");
            appendDocText(lines, documentation.remarks());
            lines.add(DOC_PREFIX + "</remarks>");
        }

        List<String> indented = new ArrayList<>(lines.size());
        for (String line : lines) {
            indented.add(indentText(line));
        }
        return String.join(NEWLINE, indented);
    }

    /**
     * Renders import directives, one per line.
     *
     * <p>Entries may be bare namespace names or complete directives, including
     * {@code global using} directives. With {@code sortUsings} enabled duplicates are removed,
     * global directives come first and each group is sorted ordinally by the text between
     * {@code using} and the semicolon, so {@code System} precedes {@code System.Linq};
     * otherwise the input order, duplicates included, is kept.
     *
     * @param usings import directives
     * @return directive lines joined with {@code \n}, empty if there are none
     */
    public String formatUsings(List<String> usings) {
        if (usings == null || usings.isEmpty()) {
            return "";
        }

        List<String> directives = usings.stream()
            .map(CodeFormatter::toUsingDirective)
            .toList();

        if (options.sortUsings()) {
            directives = directives.stream()
                .distinct()
                .sorted(Comparator.comparing((String directive) -> !isGlobalUsing(directive))
                    .thenComparing(CodeFormatter::usingTarget))
                .toList();
        }

        List<String> indented = new ArrayList<>(directives.size());
        for (String directive : directives) {
            indented.add(indentText(directive));
        }
        return String.join(NEWLINE, indented);
    }

    private void appendDocText(List<String> lines, String text) {
        int budget = options.maxLineLength() - currentIndent().length() - DOC_PREFIX.length();
        String escaped = escapeXml(text);
        String wrapped = options.wrappingEnabled() && budget > 0 ? wrapText(escaped, budget) : escaped;

        for (String line : LINE_BREAK.split(wrapped, -1)) {
            lines.add(line.isBlank() ? DOC_BLANK : DOC_PREFIX + line.strip());
        }
    }

    /**
     * Escapes the characters that XML documentation text cannot contain literally.
     */
    static String escapeXml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;");
    }

    private static String toUsingDirective(String using) {
        String directive = using.strip();
        if (!directive.startsWith(USING_KEYWORD) && !directive.startsWith(GLOBAL_USING_KEYWORD)) {
            directive = USING_KEYWORD + directive;
        }
        if (!directive.endsWith(";")) {
            directive = directive + ";";
        }
        return directive;
    }

    private static boolean isGlobalUsing(String directive) {
        return directive.startsWith(GLOBAL_USING_KEYWORD);
    }

    private static String usingTarget(String directive) {
        String target = isGlobalUsing(directive) ? directive.substring("global ".length()) : directive;
        return target.substring(USING_KEYWORD.length(), target.length() - 1).strip();
    }

    private static List<String> wrapLine(String line, int limit) {
        if (line.isBlank() || line.length() <= limit) {
            return List.of(line);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : line.trim().split(" +")) {
            if (current.length() == 0) {
                current.append(word);
            } else if (current.length() + 1 + word.length() <= limit) {
                current.append(' ').append(word);
            } else {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }
}
