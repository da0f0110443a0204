package structview;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds where each CSV record starts and ends, honouring quoted fields that contain line breaks.
 * Blank lines between records are skipped, as the CSV parser skips them.
 */
final class CsvRecords {

    private CsvRecords() {}

    static List<SourceSpan> recordSpans(String text) {
        List<SourceSpan> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;

        int line = 1;
        int column = 1;
        int recordStartLine = -1;
        int lastLine = 1;
        int lastEndColumn = 1;
        boolean quoted = false;

        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\r' && !quoted) {
                i = i + 1;
                continue;
            }
            if (c == '\n') {
                if (!quoted && recordStartLine > 0) {
                    out.add(new SourceSpan(recordStartLine, 1, lastLine, lastEndColumn));
                    recordStartLine = -1;
                }
                line = line + 1;
                column = 1;
                i = i + 1;
                continue;
            }
            if (recordStartLine < 0) {
                recordStartLine = line;
            }
            if (c == '"') {
                quoted = !quoted;
            }
            column = column + 1;
            lastLine = line;
            lastEndColumn = column;
            i = i + 1;
        }
        if (recordStartLine > 0) {
            out.add(new SourceSpan(recordStartLine, 1, lastLine, lastEndColumn));
        }
        return out;
    }
}
