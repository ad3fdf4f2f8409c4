package com.sharpgen.core.generator;

/**
 * Line terminator used in generated source.
 */
public enum LineEndingStyle {
    /** Carriage return + line feed ({@code \r\n}) */
    WINDOWS("\r\n"),

    /** Line feed ({@code \n}) */
    UNIX("\n"),

    /** Whatever {@link System#lineSeparator()} returns on the generating machine */
    PLATFORM_DEFAULT(null);

    private final String separator;

    LineEndingStyle(String separator) {
        this.separator = separator;
    }

    /**
     * Returns the terminator characters for this style.
     *
     * @return line terminator
     */
    public String separator() {
        return separator != null ? separator : System.lineSeparator();
    }
}
