package structview;

/**
 * What a reader hands to the viewer: the root value, the text it came from, and the span table.
 */
public record ParsedDocument(DocumentValue root, String sourceText, SourceSpans spans, DocumentFormat format) {

    public ParsedDocument {
        if (sourceText == null) sourceText = "";
        if (spans == null) spans = SourceSpans.none();
        if (format == null) format = DocumentFormat.AUTO;
    }

    public static ParsedDocument empty() {
        return new ParsedDocument(null, "", SourceSpans.none(), DocumentFormat.AUTO);
    }

    /** Wraps an in-memory object that has no source text. */
    public static ParsedDocument ofObject(Object value) {
        return new ParsedDocument(ValueInspector.wrap(value), "", SourceSpans.none(), DocumentFormat.AUTO);
    }
}
