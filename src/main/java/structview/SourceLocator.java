package structview;

/**
 * Converts 1-based line/column spans to character offsets within a source text.
 */
public final class SourceLocator {

    public record Offsets(int start, int end) {}

    private SourceLocator() {}

    /**
     * Single scan over {@code text}. Lines that never occur fall back to the whole document;
     * both offsets are clamped to {@code [0, text.length()]}.
     */
    public static Offsets toOffsets(String text, int startLine, int startColumn, int endLine, int endColumn) {
        String src = text == null ? "" : text;
        int len = src.length();

        int currentLine = 1;
        int lineStart = 0;
        int startOffset = -1;
        int endOffset = -1;

        int i = 0;
        while (i <= len) {
            if (currentLine == startLine && startOffset < 0) {
                startOffset = lineStart + Math.max(0, startColumn - 1);
            }
            if (currentLine == endLine && endOffset < 0) {
                endOffset = lineStart + Math.max(0, endColumn - 1);
            }
            if (startOffset >= 0 && endOffset >= 0) break;

            if (i < len && src.charAt(i) == '\n') {
                currentLine = currentLine + 1;
                lineStart = i + 1;
            }
            i = i + 1;
        }

        if (startOffset < 0) startOffset = 0;
        if (endOffset < 0) endOffset = len;

        return new Offsets(clamp(startOffset, len), clamp(endOffset, len));
    }

    /** Resolves {@code span} against {@code text}; null when there is no span. */
    public static SourceRange locate(String text, SourceSpan span) {
        if (span == null) return null;
        Offsets o = toOffsets(text, span.startLine(), span.startColumn(), span.endLine(), span.endColumn());
        return new SourceRange(span.startLine(), span.startColumn(), span.endLine(), span.endColumn(),
                o.start(), o.end());
    }

    private static int clamp(int v, int len) {
        if (v < 0) return 0;
        if (v > len) return len;
        return v;
    }
}
