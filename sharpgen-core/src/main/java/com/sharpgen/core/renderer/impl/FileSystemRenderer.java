package com.sharpgen.core.renderer.impl;

import com.sharpgen.core.renderer.GeneratedFile;
import com.sharpgen.core.renderer.GeneratedOutput;
import com.sharpgen.core.renderer.OutputRenderer;
import com.sharpgen.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes generated source files to the filesystem.
 *
 * <p>Creates directory structure automatically and preserves relative paths. Files are
 * written as UTF-8. Paths that would resolve outside the output directory are rejected.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code filesystem.overwrite} - Replace existing files ("true"/"false", default: "true");
 *       when false, existing files are left untouched and skipped</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./generated", Map.of());
 *
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     new GeneratedFile("Models/Widget.cs", "public class Widget\n{\n}\n", "csharp")
 * ));
 *
 * new FileSystemRenderer().render(output, context);
 * // Creates: ./generated/Models/Widget.cs
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    public static final String OVERWRITE_SETTING = "filesystem.overwrite";

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Path.of(context.outputDirectory()).toAbsolutePath().normalize();
        boolean overwrite = context.getBooleanSetting(OVERWRITE_SETTING, true);
        logger.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
            logger.debug("Output directory created/verified: {}", outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        int written = 0;
        for (GeneratedFile file : output.files()) {
            if (writeFile(outputDir, file, overwrite)) {
                written++;
            }
        }
        logger.info("Successfully rendered {} of {} files to filesystem", written, output.files().size());
    }

    /**
     * Writes a single file to the filesystem.
     *
     * @param outputDir base output directory, absolute and normalized
     * @param file file to write
     * @param overwrite whether an existing file may be replaced
     * @return true if the file was written, false if it was skipped
     */
    private boolean writeFile(Path outputDir, GeneratedFile file, boolean overwrite) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("Output path escapes output directory: " + file.relativePath());
        }

        if (!overwrite && Files.exists(targetPath)) {
            logger.warn("Skipping existing file: {}", file.relativePath());
            return false;
        }

        logger.debug("Writing file: {}", targetPath);
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.info("Wrote file: {} ({} bytes)", file.relativePath(), file.sizeInBytes());
            return true;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
