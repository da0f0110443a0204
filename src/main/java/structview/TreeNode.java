package structview;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * One node of the visualization tree. Children are built on first access and kept.
 */
public final class TreeNode {

    private final String name;
    private final DocumentValue value;
    private final Classification classification;
    private final SourceSpan sourceSpan;

    private final int depth;
    private final int maxDepth;
    private final Set<Object> visited;
    private final String inferredItemName;
    private final TreeBuilder builder;

    private boolean expanded;
    private List<TreeNode> children; // null until first expanded

    TreeNode(String name,
             DocumentValue value,
             Classification classification,
             SourceSpan sourceSpan,
             int depth,
             int maxDepth,
             Set<Object> visited,
             String inferredItemName,
             TreeBuilder builder) {
        this.name = name;
        this.value = value;
        this.classification = classification;
        this.sourceSpan = sourceSpan;
        this.depth = depth;
        this.maxDepth = maxDepth;
        this.visited = visited;
        this.inferredItemName = inferredItemName;
        this.builder = builder;
        this.expanded = depth == 0;
    }

    /** Key, index ("[0]") or attribute label ("@id"); null for the root. */
    public String name() { return name; }
    public DocumentValue value() { return value; }
    public NodeKind kind() { return classification.kind(); }
    public String displayValue() { return classification.displayValue(); }
    public String typeLabel() { return classification.typeLabel(); }
    public boolean hasChildren() { return classification.hasChildren(); }
    public SourceSpan sourceSpan() { return sourceSpan; }
    public boolean hasSourceSpan() { return sourceSpan != null; }
    public int depth() { return depth; }

    int maxDepth() { return maxDepth; }
    Set<Object> visited() { return visited; }
    String inferredItemName() { return inferredItemName; }

    public boolean isExpanded() { return expanded; }
    public void setExpanded(boolean expanded) { this.expanded = expanded; }

    public List<TreeNode> children() {
        if (!hasChildren()) {
            return List.of();
        }
        if (children == null) {
            children = Collections.unmodifiableList(builder.expand(this));
        }
        return children;
    }

    /** Whether {@link #children()} has been computed yet. */
    boolean isMaterialized() {
        return children != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (name != null) sb.append(name);
        if (!displayValue().isEmpty()) {
            if (sb.length() > 0) sb.append(": ");
            sb.append(displayValue());
        }
        if (!typeLabel().isEmpty()) {
            if (sb.length() > 0) sb.append(" ");
            sb.append("(").append(typeLabel()).append(")");
        }
        return sb.toString();
    }
}
