package structview;

import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.UUID;

/**
 * Format-neutral content of one parsed node.
 * Readers map their own syntax onto these records; the tree code only ever matches against them.
 * Composite records keep the lists they were given as-is, so aliasing between nodes is preserved
 * and cycles are detected by identity.
 */
public interface DocumentValue {

    record Null() implements DocumentValue {}

    record Bool(boolean value) implements DocumentValue {}

    record Number(java.lang.Number value) implements DocumentValue {}

    record Text(String value) implements DocumentValue {}

    record Bytes(byte[] value) implements DocumentValue {}

    record DateTimeLike(TemporalAccessor value) implements DocumentValue {}

    record Duration(java.time.Duration value) implements DocumentValue {}

    record Identifier(UUID value) implements DocumentValue {}

    record Sequence(List<DocumentValue> items) implements DocumentValue {}

    /** Several documents read from one multi-document source, such as a YAML stream. */
    record DocumentStream(List<DocumentValue> documents) implements DocumentValue {}

    record Entry(String key, DocumentValue value) {}

    record Mapping(List<Entry> entries) implements DocumentValue {}

    record Attribute(String name, Text value) {}

    /** XML-style element. {@code text} is the trimmed direct text content, never null. */
    record AttributedElement(String name,
                             List<Attribute> attributes,
                             List<DocumentValue> children,
                             String text) implements DocumentValue {
        public AttributedElement {
            if (text == null) text = "";
        }
    }

    /** Any Java object handed to the viewer directly; inspected by reflection. */
    record Opaque(Object value) implements DocumentValue {}

    /** Whether two occurrences of this value may be the same node reached twice. */
    static boolean isAliasable(DocumentValue value) {
        if (value instanceof Sequence || value instanceof Mapping || value instanceof AttributedElement
                || value instanceof DocumentStream) {
            return true;
        }
        if (value instanceof Opaque opaque) {
            return opaque.value() != null && !ValueInspector.isScalar(opaque.value());
        }
        return false;
    }

    /** Identity used for cycle detection; opaque values are tracked by the wrapped object. */
    static Object identityOf(DocumentValue value) {
        if (value instanceof Opaque opaque) {
            return opaque.value();
        }
        return value;
    }
}
