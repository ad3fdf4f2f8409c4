package com.sharpgen.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sharpgen.SharpGenCLI;
import com.sharpgen.core.config.ConfigLoader;
import com.sharpgen.core.config.ProjectConfig;
import com.sharpgen.core.generator.CodeGenerator;
import com.sharpgen.core.generator.GeneratorOptions;
import com.sharpgen.core.generator.LineEndingStyle;
import com.sharpgen.core.json.AstJsonReader;
import com.sharpgen.core.json.ModelDocument;
import com.sharpgen.core.json.SourceFileModel;
import com.sharpgen.core.renderer.GeneratedFile;
import com.sharpgen.core.renderer.GeneratedOutput;
import com.sharpgen.core.renderer.OutputRenderer;
import com.sharpgen.core.renderer.RenderContext;
import com.sharpgen.core.renderer.impl.ConsoleRenderer;
import com.sharpgen.core.renderer.impl.FileSystemRenderer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to generate C# sources from a model file.
 *
 * <p>Orchestrates the generation pipeline:
 * <ol>
 *   <li>Load {@code sharpgen.yaml} and apply command-line overrides</li>
 *   <li>Discover the configured generator via SPI</li>
 *   <li>Read the model file (JSON or YAML)</li>
 *   <li>Generate one source file per model entry</li>
 *   <li>Render the files to the filesystem or the console</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Generate into the configured output directory
 * sharpgen generate -i model.yaml
 *
 * # Override output directory and formatting
 * sharpgen generate -i model.json -o src/Generated --line-endings unix --sort-usings
 *
 * # Print to the console
 * sharpgen generate -i model.json --stdout
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate C# source files from a model file",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @ParentCommand
    private SharpGenCLI parent;

    @Option(names = {"-i", "--input"}, description = "Model file (.json, .yaml or .yml)", required = true)
    private Path inputModel;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: sharpgen.yaml)")
    private Path configPath;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"-g", "--generator"}, description = "Generator ID (overrides config)")
    private String generatorId;

    @Option(names = {"--stdout"}, description = "Print generated files instead of writing them")
    private boolean stdout;

    @Option(names = {"--line-endings"}, description = "Line endings: ${COMPLETION-CANDIDATES}")
    private LineEndingStyle lineEndings;

    @Option(names = {"--max-line-length"}, description = "Column budget for wrapping, 0 disables wrapping")
    private Integer maxLineLength;

    @Option(names = {"--sort-usings"}, description = "Sort and de-duplicate using directives")
    private Boolean sortUsings;

    @Option(names = {"--no-docs"}, description = "Omit documentation comments")
    private boolean noDocs;

    @Option(names = {"--no-attributes"}, description = "Omit attributes")
    private boolean noAttributes;

    @Option(names = {"--no-overwrite"}, description = "Keep existing files instead of replacing them")
    private boolean noOverwrite;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        try {
            ProjectConfig config = loadConfiguration();
            GeneratorOptions options = resolveOptions(config);
            CodeGenerator generator = findGenerator(generatorId != null ? generatorId : config.generator().effectiveId());

            ModelDocument model = new AstJsonReader().read(inputModel);
            status("✓ Loaded " + model.files().size() + " files from " + inputModel);

            GeneratedOutput output = generateFiles(generator, model, options);
            status("✓ Generated " + output.files().size() + " files");

            renderOutput(output, config);
            if (!stdout) {
                status("✓ Wrote output to: " + resolveOutputDirectory(config));
            }
            return 0;
        } catch (RuntimeException e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads project configuration; a missing default config file silently yields defaults.
     */
    private ProjectConfig loadConfiguration() {
        if (configPath == null) {
            Path defaultConfig = Path.of(ConfigLoader.DEFAULT_CONFIG_FILE);
            if (!Files.exists(defaultConfig)) {
                log.debug("No {} found, using default configuration", ConfigLoader.DEFAULT_CONFIG_FILE);
                return ProjectConfig.defaults();
            }
            return ConfigLoader.load(defaultConfig);
        }
        return ConfigLoader.load(configPath);
    }

    /**
     * Applies command-line overrides on top of the configured options.
     */
    GeneratorOptions resolveOptions(ProjectConfig config) {
        GeneratorOptions.Builder builder = config.generator().toOptions().toBuilder();
        if (lineEndings != null) {
            builder.lineEndings(lineEndings);
        }
        if (maxLineLength != null) {
            builder.maxLineLength(maxLineLength);
        }
        if (sortUsings != null) {
            builder.sortUsings(sortUsings);
        }
        if (noDocs) {
            builder.generateDocumentation(false);
        }
        if (noAttributes) {
            builder.generateAttributes(false);
        }
        GeneratorOptions options = builder.build();
        log.debug("Effective generator options: {}", options);
        return options;
    }

    private CodeGenerator findGenerator(String id) {
        List<CodeGenerator> generators = new ArrayList<>();
        ServiceLoader.load(CodeGenerator.class).forEach(generators::add);

        return generators.stream()
            .filter(generator -> generator.getId().equals(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown generator: " + id + ". Available: "
                + generators.stream().map(CodeGenerator::getId).collect(Collectors.joining(", "))));
    }

    private GeneratedOutput generateFiles(CodeGenerator generator, ModelDocument model, GeneratorOptions options) {
        String lineEnding = options.lineEndings().separator();
        List<GeneratedFile> files = new ArrayList<>();
        for (SourceFileModel file : model.files()) {
            log.debug("Generating {} ({} nodes)", file.path(), file.nodes().size());
            String code = generator.generateMultiple(file.nodes(), options);
            files.add(new GeneratedFile(file.path(), code.isEmpty() ? code : code + lineEnding, generator.getId()));
        }
        return new GeneratedOutput(files);
    }

    private void renderOutput(GeneratedOutput output, ProjectConfig config) {
        String rendererId = stdout ? "console" : config.output().renderer();
        OutputRenderer renderer = findRenderer(rendererId);

        boolean overwrite = !noOverwrite && config.output().overwrite();
        RenderContext context = new RenderContext(
            resolveOutputDirectory(config).toString(),
            Map.of(
                FileSystemRenderer.OVERWRITE_SETTING, Boolean.toString(overwrite),
                ConsoleRenderer.HEADERS_SETTING, Boolean.toString(output.files().size() > 1)
            )
        );
        renderer.render(output, context);
    }

    private OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalArgumentException("Unknown renderer: " + id);
    }

    private Path resolveOutputDirectory(ProjectConfig config) {
        return outputDir != null ? outputDir : Path.of(config.output().directory());
    }

    private void status(String message) {
        log.debug(message);
        if (!stdout && (parent == null || !parent.isQuiet())) {
            System.out.println(message);
        }
    }
}
