package treeqa.snapshot;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import treeqa.model.Bounds;
import treeqa.model.TreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link TreeNode} backed by a JSON tree snapshot.
 *
 * <p>Used for offline trees (CLI, fixtures) and as a stand-in for a live UI
 * tree in tests. Parent links are not serialized; they are restored by
 * {@link #linkParents()} after deserialization and maintained by
 * {@link #child(SnapshotNode)} when a tree is built in code.
 */
@JsonAutoDetect(
        fieldVisibility    = JsonAutoDetect.Visibility.ANY,
        getterVisibility   = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility   = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"type", "id", "name", "bounds", "properties", "children"})
public class SnapshotNode implements TreeNode {

    @JsonProperty("type")
    private String type;

    @JsonProperty("id")
    private String id = "";

    @JsonProperty("name")
    private String name = "";

    @JsonProperty("bounds")
    private Bounds bounds;

    @JsonProperty("properties")
    private Map<String, String> properties = new LinkedHashMap<>();

    @JsonProperty("children")
    private List<SnapshotNode> children = new ArrayList<>();

    @JsonIgnore
    private SnapshotNode parent;

    /** For Jackson. */
    SnapshotNode() {}

    public SnapshotNode(String type) {
        this.type = type;
    }

    // ── Fluent construction ───────────────────────────────────────────────

    public SnapshotNode id(String id) {
        this.id = id == null ? "" : id;
        return this;
    }

    public SnapshotNode name(String name) {
        this.name = name == null ? "" : name;
        return this;
    }

    public SnapshotNode bounds(double x, double y, double width, double height) {
        this.bounds = new Bounds(x, y, width, height);
        return this;
    }

    /** Sets (or with a {@code null} value removes) a named property. */
    public SnapshotNode property(String key, String value) {
        if (value == null) properties.remove(key);
        else properties.put(key, value);
        return this;
    }

    /** Appends {@code child} as the last child and links it to this node. */
    public SnapshotNode child(SnapshotNode child) {
        child.parent = this;
        children.add(child);
        return this;
    }

    public SnapshotNode children(SnapshotNode... nodes) {
        for (SnapshotNode n : nodes) child(n);
        return this;
    }

    /** Detaches {@code child}; returns {@code false} if it was not a child of this node. */
    public boolean removeChild(SnapshotNode child) {
        boolean removed = children.removeIf(c -> c == child);
        if (removed) child.parent = null;
        return removed;
    }

    /** Restores parent links below this node; this node becomes the root boundary. */
    public SnapshotNode linkParents() {
        for (SnapshotNode child : children) {
            child.parent = this;
            child.linkParents();
        }
        return this;
    }

    // ── TreeNode ──────────────────────────────────────────────────────────

    @Override
    public String stableId() {
        return id == null ? "" : id;
    }

    @Override
    public String displayName() {
        return name == null ? "" : name;
    }

    @Override
    public String typeTag() {
        return type;
    }

    @Override
    public Optional<TreeNode> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public List<TreeNode> orderedChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public Bounds bounds() {
        return bounds;
    }

    @Override
    public String property(String name) {
        return properties.get(name);
    }

    /** Snapshot-typed view of the children. */
    public List<SnapshotNode> snapshotChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type);
        if (!stableId().isEmpty()) sb.append(" #").append(id);
        if (!displayName().isEmpty()) sb.append(" '").append(name).append('\'');
        return sb.toString();
    }
}
