package structview;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link TreeNode}s from {@link DocumentValue}s, one node per call.
 * Children are expanded only when a node's {@code children()} is first read.
 */
public final class TreeBuilder {

    private final SourceSpans spans;

    public TreeBuilder(SourceSpans spans) {
        this.spans = spans == null ? SourceSpans.none() : spans;
    }

    public TreeNode buildRoot(DocumentValue value, int maxDepth) {
        return build(value, null, maxDepth, 0, newIdentitySet(), null);
    }

    public TreeNode build(DocumentValue value,
                          String name,
                          int maxDepth,
                          int depth,
                          Set<Object> visited,
                          String inferredItemName) {
        Classification c = NodeClassifier.classify(value, visited, depth, maxDepth, inferredItemName);
        return new TreeNode(name, value, c, spans.spanOf(value), depth, maxDepth, visited, inferredItemName, this);
    }

    List<TreeNode> expand(TreeNode parent) {
        DocumentValue value = parent.value();

        // siblings get their own copy so they never see each other as cycles
        Set<Object> visited = newIdentitySet();
        visited.addAll(parent.visited());
        if (DocumentValue.isAliasable(value)) {
            visited.add(DocumentValue.identityOf(value));
        }

        List<TreeNode> children = new ArrayList<>();
        try {
            if (value instanceof DocumentValue.Mapping mapping) {
                expandMapping(parent, mapping, visited, children);
            } else if (value instanceof DocumentValue.Sequence sequence) {
                expandSequence(parent, sequence.items(), visited, children);
            } else if (value instanceof DocumentValue.DocumentStream stream) {
                expandStream(parent, stream, visited, children);
            } else if (value instanceof DocumentValue.AttributedElement element) {
                expandElement(parent, element, visited, children);
            } else if (value instanceof DocumentValue.Opaque opaque) {
                expandObject(parent, opaque.value(), visited, children);
            }
        } catch (RuntimeException ex) {
            DebugLog.log("expand failed at %s: %s", parent.name(), ex);
            children.add(child(parent, new DocumentValue.Text(ValueInspector.describe(ex)), "<error>", visited, null));
        }
        return children;
    }

    private void expandMapping(TreeNode parent, DocumentValue.Mapping mapping,
                               Set<Object> visited, List<TreeNode> out) {
        List<DocumentValue.Entry> entries = new ArrayList<>(mapping.entries());
        entries.sort(Comparator.comparing(DocumentValue.Entry::key, Comparator.nullsFirst(Comparator.naturalOrder())));
        for (DocumentValue.Entry entry : entries) {
            String itemName = entry.value() instanceof DocumentValue.Sequence
                    ? ItemNames.singularize(entry.key())
                    : null;
            out.add(child(parent, entry.value(), entry.key(), visited, itemName));
        }
    }

    private void expandSequence(TreeNode parent, List<DocumentValue> items,
                                Set<Object> visited, List<TreeNode> out) {
        int index = 0;
        for (DocumentValue item : items) {
            out.add(child(parent, item, "[" + index + "]", visited, parent.inferredItemName()));
            index = index + 1;
        }
    }

    private void expandStream(TreeNode parent, DocumentValue.DocumentStream stream,
                              Set<Object> visited, List<TreeNode> out) {
        int index = 0;
        for (DocumentValue document : stream.documents()) {
            out.add(child(parent, document, "Document[" + index + "]", visited, null));
            index = index + 1;
        }
    }

    private void expandElement(TreeNode parent, DocumentValue.AttributedElement element,
                               Set<Object> visited, List<TreeNode> out) {
        for (DocumentValue.Attribute attr : element.attributes()) {
            out.add(child(parent, attr.value(), "@" + attr.name(), visited, null));
        }

        List<DocumentValue.AttributedElement> elements = NodeClassifier.elementChildren(element);
        String uniform = elements.size() > 1 ? NodeClassifier.uniformChildName(element) : null;
        String itemName = uniform != null ? ItemNames.singularize(uniform) : null;

        int elementIndex = 0;
        int position = 0;
        for (DocumentValue child : element.children()) {
            if (child instanceof DocumentValue.AttributedElement e) {
                if (uniform != null) {
                    out.add(child(parent, e, "[" + elementIndex + "]", visited, itemName));
                } else {
                    out.add(child(parent, e, e.name(), visited, null));
                }
                elementIndex = elementIndex + 1;
            } else {
                out.add(child(parent, child, "[" + position + "]", visited, null));
            }
            position = position + 1;
        }
    }

    private void expandObject(TreeNode parent, Object obj, Set<Object> visited, List<TreeNode> out) {
        if (obj instanceof Map<?, ?> map) {
            for (Map.Entry<String, Object> entry : ValueInspector.sortedEntries(map)) {
                out.add(child(parent, ValueInspector.wrap(entry.getValue()), entry.getKey(), visited, null));
            }
            return;
        }
        if (ValueInspector.isSequenceLike(obj)) {
            int index = 0;
            for (Object item : ValueInspector.elements(obj)) {
                out.add(child(parent, ValueInspector.wrap(item), "[" + index + "]", visited, parent.inferredItemName()));
                index = index + 1;
            }
            return;
        }
        for (ValueInspector.Member member : ValueInspector.readableMembers(obj)) {
            DocumentValue memberValue;
            try {
                memberValue = ValueInspector.wrap(member.reader().call());
            } catch (Exception ex) {
                memberValue = new DocumentValue.Text(ValueInspector.describe(ex));
            }
            out.add(child(parent, memberValue, member.name(), visited, null));
        }
    }

    private TreeNode child(TreeNode parent, DocumentValue value, String name,
                           Set<Object> visited, String itemName) {
        return build(value, name, parent.maxDepth(), parent.depth() + 1, visited, itemName);
    }

    static Set<Object> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
