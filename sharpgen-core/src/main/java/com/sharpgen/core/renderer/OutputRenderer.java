package com.sharpgen.core.renderer;

/**
 * Interface for output renderers that deliver generated source files to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and selected by id,
 * either from {@code output.renderer} in {@code sharpgen.yaml} or on the command line.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public void render(GeneratedOutput output, RenderContext context) {
 *         Path outputDir = Path.of(context.outputDirectory());
 *         for (GeneratedFile file : output.files()) {
 *             Files.writeString(outputDir.resolve(file.relativePath()), file.content());
 *         }
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sharpgen.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Delivers every file of the output.
     *
     * @param output generated source files
     * @param context rendering context with target directory and settings
     * @throws IllegalStateException if a file cannot be delivered
     */
    void render(GeneratedOutput output, RenderContext context);
}
