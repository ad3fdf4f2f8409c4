package com.sharpgen.core.renderer.impl;

import com.sharpgen.core.renderer.GeneratedFile;
import com.sharpgen.core.renderer.GeneratedOutput;
import com.sharpgen.core.renderer.OutputRenderer;
import com.sharpgen.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renderer that prints generated source files to a stream, standard output by default.
 *
 * <p>With headers enabled every file is introduced by its path and size, optionally in ANSI
 * colors. With headers disabled only the file contents are printed, separated by a blank
 * line, so the output can be piped straight into another tool.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - Show file headers ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    public static final String COLORS_SETTING = "console.colors";
    public static final String HEADERS_SETTING = "console.showHeaders";

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String HEADER_RULE = "// ";

    private final PrintStream out;

    /**
     * Creates a renderer printing to {@link System#out}. Used by {@link java.util.ServiceLoader}.
     */
    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.getBooleanSetting(COLORS_SETTING, false);
        boolean showHeaders = context.getBooleanSetting(HEADERS_SETTING, true);

        logger.debug("Rendering {} files to console (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (i > 0) {
                out.println();
            }
            if (showHeaders) {
                printFileHeader(file, i + 1, output.files().size(), useColors);
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }

    /**
     * Prints a file header as {@code //} comment lines.
     */
    private void printFileHeader(GeneratedFile file, int index, int total, boolean useColors) {
        String pathColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String metaColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        out.println(pathColor + HEADER_RULE + "File " + index + "/" + total + ": " + file.relativePath() + reset);
        out.println(metaColor + HEADER_RULE + "Size: " + file.sizeInBytes() + " bytes" + reset);
    }
}
