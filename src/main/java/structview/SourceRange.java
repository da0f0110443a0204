package structview;

/**
 * A span resolved against source text: 1-based line/column plus 0-based character offsets.
 */
public record SourceRange(int startLine,
                          int startColumn,
                          int endLine,
                          int endColumn,
                          int startOffset,
                          int endOffset) {

    public int length() {
        return endOffset - startOffset;
    }

    /** The covered text, or an empty string if the offsets do not fit {@code sourceText}. */
    public String text(String sourceText) {
        if (sourceText == null) return "";
        if (startOffset < 0 || endOffset > sourceText.length() || startOffset > endOffset) {
            return "";
        }
        return sourceText.substring(startOffset, endOffset);
    }
}
