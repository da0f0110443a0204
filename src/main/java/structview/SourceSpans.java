package structview;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Span table filled by a reader while it builds {@link DocumentValue}s.
 * Lookups are by identity, so equal-looking values at different positions keep their own spans.
 */
public final class SourceSpans {

    private static final SourceSpans NONE = new SourceSpans();

    private final Map<DocumentValue, SourceSpan> spans = new IdentityHashMap<>();

    public static SourceSpans none() {
        return NONE;
    }

    public void put(DocumentValue value, SourceSpan span) {
        if (this == NONE) {
            throw new IllegalStateException("The empty span table is read-only");
        }
        if (value != null && span != null) {
            spans.put(value, span);
        }
    }

    /** The recorded span, or null if the value has none. */
    public SourceSpan spanOf(DocumentValue value) {
        if (value == null) return null;
        return spans.get(value);
    }

    public int size() {
        return spans.size();
    }
}
