package structview;

/**
 * A 1-based line/column span in source text. The end column points just past the last character.
 */
public record SourceSpan(int startLine, int startColumn, int endLine, int endColumn) {

    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }

    /** A span from the start of this one to the end of {@code other}. */
    public SourceSpan extendTo(SourceSpan other) {
        if (other == null) return this;
        return new SourceSpan(startLine, startColumn, other.endLine(), other.endColumn());
    }
}
