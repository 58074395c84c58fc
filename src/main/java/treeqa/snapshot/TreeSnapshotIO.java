package treeqa.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.model.Bounds;
import treeqa.model.ControlProperties;
import treeqa.model.TreeNode;
import treeqa.player.TreeQAException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Reads and writes control-tree snapshots as JSON.
 *
 * <p>On read the JSON is validated against {@code tree-snapshot-schema.json}
 * before it is deserialized, and parent links are restored. On write the
 * output is pretty-printed.
 */
public final class TreeSnapshotIO {

    private static final Logger log = LoggerFactory.getLogger(TreeSnapshotIO.class);
    private static final String SCHEMA_RESOURCE = "/tree-snapshot-schema.json";

    /** Properties copied when a live tree is captured; adapters expose no property enumeration. */
    public static final List<String> CAPTURED_PROPERTIES =
            List.of(ControlProperties.TEXT, ControlProperties.CONTENT, ControlProperties.CHECKED,
                    ControlProperties.VISIBLE, ControlProperties.ENABLED, ControlProperties.SELECTED_ITEM);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static volatile JsonSchema jsonSchema;

    private TreeSnapshotIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads and validates a snapshot file.
     *
     * @throws IOException                 if the file cannot be read or parsed
     * @throws SnapshotValidationException if the JSON does not match the schema
     */
    public static SnapshotNode read(Path path) throws IOException {
        log.debug("Reading tree snapshot from: {}", path);
        SnapshotNode root = parseValidated(Files.readString(path, StandardCharsets.UTF_8), path.toString());
        log.info("Loaded tree snapshot '{}' from {}", root, path);
        return root;
    }

    /** Reads and validates a snapshot from a classpath resource such as {@code /trees/login.json}. */
    public static SnapshotNode readResource(String resource) throws IOException {
        try (InputStream is = TreeSnapshotIO.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Snapshot resource not found: " + resource);
            }
            return parseValidated(new String(is.readAllBytes(), StandardCharsets.UTF_8), resource);
        }
    }

    /** Parses a snapshot from a JSON string without schema validation. */
    public static SnapshotNode fromJson(String json) throws IOException {
        return MAPPER.readValue(json, SnapshotNode.class).linkParents();
    }

    /** Writes a snapshot (parent directories are created). */
    public static void write(SnapshotNode root, Path path) throws IOException {
        if (path.getParent() != null) Files.createDirectories(path.getParent());
        MAPPER.writeValue(path.toFile(), root);
        log.info("Wrote tree snapshot '{}' to {}", root, path);
    }

    /**
     * Deep-copies any {@link TreeNode} graph into a detached snapshot. Must be
     * called on the owner thread of a live tree.
     */
    public static SnapshotNode capture(TreeNode node) {
        SnapshotNode copy = new SnapshotNode(node.typeTag())
                .id(node.stableId())
                .name(node.displayName());
        Bounds b = node.bounds();
        if (b != null) copy.bounds(b.x(), b.y(), b.width(), b.height());
        for (String key : CAPTURED_PROPERTIES) {
            copy.property(key, node.property(key));
        }
        for (TreeNode child : node.orderedChildren()) {
            copy.child(capture(child));
        }
        return copy;
    }

    // ── Schema validation ─────────────────────────────────────────────────

    private static SnapshotNode parseValidated(String json, String source) throws IOException {
        validateSchema(json, source);
        return fromJson(json);
    }

    private static void validateSchema(String json, String source) throws IOException {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("tree-snapshot-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(MAPPER.readTree(json));
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new SnapshotValidationException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (jsonSchema == null) {
            synchronized (TreeSnapshotIO.class) {
                if (jsonSchema == null) {
                    try (InputStream is = TreeSnapshotIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        jsonSchema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return jsonSchema;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SnapshotValidationException extends TreeQAException {
        public SnapshotValidationException(String msg) { super(msg); }
    }
}
