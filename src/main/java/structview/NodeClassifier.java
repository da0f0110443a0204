package structview;

import java.math.BigDecimal;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Decides how a {@link DocumentValue} is displayed and whether it has children.
 * <p>
 * Rules are applied in order: null, circular reference (by identity), depth limit,
 * text-only element collapsing, uniform-element arrays, scalars, then composites.
 * Classification never throws; a fault while inspecting a value yields an error leaf.
 */
public final class NodeClassifier {

    static final int MAX_TEXT_LENGTH = 1000;
    static final String CIRCULAR_TEXT = "(circular reference)";
    static final String MAX_DEPTH_TEXT = "(max depth reached)";
    static final String STREAM_TYPE = "YamlStream";

    private NodeClassifier() {}

    public static Classification classify(DocumentValue value,
                                          Set<Object> visited,
                                          int depth,
                                          int maxDepth,
                                          String inferredItemName) {
        try {
            return doClassify(value, visited, depth, maxDepth, inferredItemName);
        } catch (RuntimeException ex) {
            DebugLog.log("classify failed", ex);
            return Classification.leaf(NodeKind.OBJECT, ValueInspector.describe(ex), "Object");
        }
    }

    private static Classification doClassify(DocumentValue value,
                                             Set<Object> visited,
                                             int depth,
                                             int maxDepth,
                                             String inferredItemName) {
        if (value == null || value instanceof DocumentValue.Null) {
            return Classification.leaf(NodeKind.NULL, "null", "");
        }
        if (value instanceof DocumentValue.Opaque opaque && opaque.value() == null) {
            return Classification.leaf(NodeKind.NULL, "null", "");
        }

        String typeLabel = typeLabel(value, inferredItemName);

        if (visited != null && DocumentValue.isAliasable(value) && visited.contains(DocumentValue.identityOf(value))) {
            return Classification.leaf(NodeKind.CIRCULAR_REFERENCE, CIRCULAR_TEXT, typeLabel);
        }
        if (depth >= maxDepth) {
            return Classification.leaf(NodeKind.MAX_DEPTH_REACHED, MAX_DEPTH_TEXT, typeLabel);
        }

        if (value instanceof DocumentValue.AttributedElement element) {
            return classifyElement(element, inferredItemName);
        }
        if (value instanceof DocumentValue.Mapping mapping) {
            return new Classification(NodeKind.OBJECT, "", typeLabel, !mapping.entries().isEmpty());
        }
        if (value instanceof DocumentValue.DocumentStream stream) {
            int count = stream.documents().size();
            return new Classification(NodeKind.COLLECTION, "(" + count + " documents)", STREAM_TYPE, count > 0);
        }
        if (value instanceof DocumentValue.Sequence sequence) {
            int count = sequence.items().size();
            return new Classification(NodeKind.COLLECTION, itemCount(count), "Array", count > 0);
        }
        if (value instanceof DocumentValue.Opaque opaque) {
            return classifyObject(opaque.value());
        }
        return classifyScalar(value);
    }

    private static Classification classifyElement(DocumentValue.AttributedElement element, String inferredItemName) {
        List<DocumentValue.AttributedElement> childElements = elementChildren(element);

        if (childElements.isEmpty() && element.attributes().isEmpty()) {
            if (element.text().isEmpty()) {
                return Classification.leaf(NodeKind.NULL, "null", "");
            }
            return Classification.leaf(NodeKind.STRING, quote(element.text()), "string");
        }

        if (childElements.size() > 1 && uniformChildName(element) != null) {
            return new Classification(NodeKind.COLLECTION, itemCount(childElements.size()), "Array", true);
        }

        String label = inferredItemName != null ? inferredItemName : element.name();
        return new Classification(NodeKind.OBJECT, "", label, true);
    }

    private static Classification classifyScalar(DocumentValue value) {
        if (value instanceof DocumentValue.Bool b) {
            return Classification.leaf(NodeKind.PRIMITIVE, b.value() ? "true" : "false", "boolean");
        }
        if (value instanceof DocumentValue.Number n) {
            return Classification.leaf(NodeKind.PRIMITIVE, formatNumber(n.value()), "number");
        }
        if (value instanceof DocumentValue.Text t) {
            return Classification.leaf(NodeKind.STRING, quote(t.value()), "string");
        }
        if (value instanceof DocumentValue.Bytes bytes) {
            int len = bytes.value() == null ? 0 : bytes.value().length;
            return Classification.leaf(NodeKind.PRIMITIVE, "byte[" + len + "]", "byte[]");
        }
        if (value instanceof DocumentValue.DateTimeLike dt) {
            return Classification.leaf(NodeKind.DATE_TIME, String.valueOf(dt.value()),
                    dt.value() == null ? "DateTime" : dt.value().getClass().getSimpleName());
        }
        if (value instanceof DocumentValue.Duration d) {
            return Classification.leaf(NodeKind.TIME_SPAN, String.valueOf(d.value()), "Duration");
        }
        if (value instanceof DocumentValue.Identifier id) {
            return Classification.leaf(NodeKind.GUID, String.valueOf(id.value()), "UUID");
        }
        return Classification.leaf(NodeKind.OBJECT, String.valueOf(value), value.getClass().getSimpleName());
    }

    /** Plain Java objects: scalars first, then maps, sequences, and finally readable members. */
    private static Classification classifyObject(Object obj) {
        String typeName = ValueInspector.friendlyTypeName(obj.getClass());

        if (obj instanceof Boolean b) {
            return classifyScalar(new DocumentValue.Bool(b));
        }
        if (obj instanceof java.lang.Number n) {
            return Classification.leaf(NodeKind.PRIMITIVE, formatNumber(n), typeName);
        }
        if (obj instanceof Character c) {
            return Classification.leaf(NodeKind.PRIMITIVE, String.valueOf(c), typeName);
        }
        if (obj instanceof CharSequence s) {
            return classifyScalar(new DocumentValue.Text(s.toString()));
        }
        if (obj instanceof Enum<?> e) {
            return Classification.leaf(NodeKind.ENUM, e.name(), e.getDeclaringClass().getSimpleName());
        }
        if (obj instanceof TemporalAccessor t) {
            return Classification.leaf(NodeKind.DATE_TIME, t.toString(), typeName);
        }
        if (obj instanceof Date date) {
            return Classification.leaf(NodeKind.DATE_TIME, date.toInstant().toString(), typeName);
        }
        if (obj instanceof java.time.Duration d) {
            return classifyScalar(new DocumentValue.Duration(d));
        }
        if (obj instanceof UUID id) {
            return classifyScalar(new DocumentValue.Identifier(id));
        }
        if (obj instanceof byte[] bytes) {
            return classifyScalar(new DocumentValue.Bytes(bytes));
        }
        if (obj instanceof Map<?, ?> map) {
            return new Classification(NodeKind.DICTIONARY, itemCount(map.size()), typeName, !map.isEmpty());
        }
        if (ValueInspector.isSequenceLike(obj)) {
            int count = ValueInspector.elements(obj).size();
            return new Classification(NodeKind.COLLECTION, itemCount(count), typeName, count > 0);
        }
        boolean hasMembers = !ValueInspector.readableMembers(obj).isEmpty();
        return new Classification(NodeKind.OBJECT, "", typeName, hasMembers);
    }

    private static String typeLabel(DocumentValue value, String inferredItemName) {
        if (value instanceof DocumentValue.Sequence) return "Array";
        if (value instanceof DocumentValue.DocumentStream) return STREAM_TYPE;
        if (value instanceof DocumentValue.Mapping) return inferredItemName != null ? inferredItemName : "Object";
        if (value instanceof DocumentValue.AttributedElement element) {
            return inferredItemName != null ? inferredItemName : element.name();
        }
        if (value instanceof DocumentValue.Opaque opaque) {
            return ValueInspector.friendlyTypeName(opaque.value().getClass());
        }
        return classifyScalar(value).typeLabel();
    }

    // ---- helpers shared with TreeBuilder ----

    static List<DocumentValue.AttributedElement> elementChildren(DocumentValue.AttributedElement element) {
        List<DocumentValue.AttributedElement> out = new ArrayList<>();
        for (DocumentValue child : element.children()) {
            if (child instanceof DocumentValue.AttributedElement e) {
                out.add(e);
            }
        }
        return out;
    }

    /** The shared tag name of all element children, or null when they differ or there are none. */
    static String uniformChildName(DocumentValue.AttributedElement element) {
        String name = null;
        for (DocumentValue.AttributedElement child : elementChildren(element)) {
            if (name == null) {
                name = child.name();
            } else if (!name.equals(child.name())) {
                return null;
            }
        }
        return name;
    }

    static String itemCount(int count) {
        return "(" + count + " items)";
    }

    static String formatNumber(java.lang.Number n) {
        if (n == null) return "null";
        if (n instanceof Double d) return Double.toString(d);
        if (n instanceof Float f) return Float.toString(f);
        if (n instanceof BigDecimal bd) return bd.toString();
        return n.toString();
    }

    static String quote(String s) {
        return "\"" + escape(s) + "\"";
    }

    static String escape(String s) {
        if (s == null) return "";
        String str = s;
        if (str.length() > MAX_TEXT_LENGTH) {
            str = str.substring(0, MAX_TEXT_LENGTH) + "...";
        }
        return str.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
