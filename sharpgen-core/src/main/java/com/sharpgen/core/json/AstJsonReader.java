package com.sharpgen.core.json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sharpgen.core.ast.AccessorDefinition;
import com.sharpgen.core.ast.AstNode;
import com.sharpgen.core.generator.UnsupportedNodeKindException;

/**
 * Reads model documents describing the source files to generate.
 *
 * <p>A document lists files, each with an output path and its top-level nodes. Every
 * top-level node names its type in a {@code kind} field (see {@link AstNodeKinds}); nested
 * nodes are typed by the record component that holds them. Enum values are matched
 * case-insensitively and unknown fields are ignored.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * files:
 *   - path: Widget.cs
 *     nodes:
 *       - kind: class
 *         name: Widget
 *         access: public
 *         properties:
 *           - name: Count
 *             type: int
 *             access: public
 *             getter: { kind: get }
 *             setter: { kind: set }
 * }</pre>
 *
 * <p>A top-level accessor node uses {@code kind: accessor} and gives its own accessor kind in
 * an {@code accessor} field.
 */
public class AstJsonReader {

    private static final Logger log = LoggerFactory.getLogger(AstJsonReader.class);

    static final String KIND_FIELD = "kind";
    static final String ACCESSOR_KIND_FIELD = "accessor";
    private static final String FILES_FIELD = "files";
    private static final String PATH_FIELD = "path";
    private static final String NODES_FIELD = "nodes";

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public AstJsonReader() {
        this.jsonMapper = createObjectMapper(new JsonFactory());
        this.yamlMapper = createObjectMapper(new YAMLFactory());
    }

    /**
     * Creates a mapper configured for AST records on top of the given format.
     *
     * @param factory JSON or YAML factory
     * @return configured mapper
     */
    public static ObjectMapper createObjectMapper(JsonFactory factory) {
        return JsonMapper.builder(factory)
            .addModule(new AstModule())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    /**
     * Reads a model file, choosing YAML for {@code .yaml}/{@code .yml} files and JSON otherwise.
     *
     * @param modelPath path to the model file
     * @return parsed document
     * @throws AstJsonException if the file cannot be read or is malformed
     * @throws UnsupportedNodeKindException if a node names an unknown kind
     */
    public ModelDocument read(Path modelPath) {
        Objects.requireNonNull(modelPath, "modelPath must not be null");
        if (!Files.isRegularFile(modelPath) || !Files.isReadable(modelPath)) {
            throw new AstJsonException("Model file not found or not readable: " + modelPath);
        }

        log.debug("Reading model from: {}", modelPath);
        String content;
        try {
            content = Files.readString(modelPath);
        } catch (IOException e) {
            throw new AstJsonException("Failed to read model file: " + modelPath, e);
        }

        ModelDocument document = isYaml(modelPath) ? readYaml(content) : readJson(content);
        log.info("Loaded {} files ({} nodes) from: {}", document.files().size(), document.nodeCount(), modelPath);
        return document;
    }

    /**
     * Reads a model document from JSON text.
     *
     * @param json document text
     * @return parsed document
     */
    public ModelDocument readJson(String json) {
        return readDocument(parse(jsonMapper, json));
    }

    /**
     * Reads a model document from YAML text.
     *
     * @param yaml document text
     * @return parsed document
     */
    public ModelDocument readYaml(String yaml) {
        return readDocument(parse(yamlMapper, yaml));
    }

    /**
     * Reads a single node carrying a {@code kind} discriminator from JSON text.
     *
     * @param json node text
     * @return parsed node
     */
    public AstNode readNode(String json) {
        return toNode(parse(jsonMapper, json), "$");
    }

    private JsonNode parse(ObjectMapper mapper, String content) {
        Objects.requireNonNull(content, "content must not be null");
        try {
            JsonNode root = mapper.readTree(content);
            if (root == null || root.isMissingNode()) {
                throw new AstJsonException("Model document is empty");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Malformed model document: " + e.getOriginalMessage(), e);
        }
    }

    private ModelDocument readDocument(JsonNode root) {
        JsonNode files = root.get(FILES_FIELD);
        if (files == null || !files.isArray()) {
            throw new AstJsonException("Model document requires a '" + FILES_FIELD + "' array");
        }

        List<SourceFileModel> models = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            JsonNode file = files.get(i);
            String location = FILES_FIELD + "[" + i + "]";

            JsonNode path = file.get(PATH_FIELD);
            if (path == null || !path.isTextual() || path.asText().isBlank()) {
                throw new AstJsonException(location + " requires a non-empty '" + PATH_FIELD + "'");
            }

            List<AstNode> nodes = new ArrayList<>();
            JsonNode nodeArray = file.get(NODES_FIELD);
            if (nodeArray != null && nodeArray.isArray()) {
                for (int j = 0; j < nodeArray.size(); j++) {
                    nodes.add(toNode(nodeArray.get(j), location + "." + NODES_FIELD + "[" + j + "]"));
                }
            }
            models.add(new SourceFileModel(path.asText(), nodes));
        }
        return new ModelDocument(models);
    }

    private AstNode toNode(JsonNode json, String location) {
        if (!json.isObject()) {
            throw new AstJsonException(location + " must be an object");
        }
        JsonNode kind = json.get(KIND_FIELD);
        if (kind == null || !kind.isTextual()) {
            throw new AstJsonException(location + " requires a '" + KIND_FIELD + "' field");
        }

        Class<? extends AstNode> type = AstNodeKinds.typeOf(kind.asText());

        ObjectNode fields = ((ObjectNode) json).deepCopy();
        fields.remove(KIND_FIELD);
        if (type == AccessorDefinition.class && fields.has(ACCESSOR_KIND_FIELD)) {
            fields.set(KIND_FIELD, fields.remove(ACCESSOR_KIND_FIELD));
        }

        try {
            return jsonMapper.treeToValue(fields, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AstJsonException("Invalid " + kind.asText() + " node at " + location + ": " + e.getMessage(), e);
        }
    }

    private static boolean isYaml(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }
}
