package structview;

import org.apache.poi.ss.usermodel.*;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads Excel workbooks through Apache POI.
 * <p>
 * The source text is a tab-separated rendering:
 * <pre>
 *   # Sheet: &lt;name&gt;
 *   header1 \t header2 \t ...
 *   value1 \t value2 \t ...
 * </pre>
 * with a blank line between sheets. The value maps each sheet name to a sequence of row records
 * keyed by that sheet's first non-empty row. Rows and cells carry spans into the rendering.
 */
final class WorkbookDocumentReader {

    static final String SHEET_PREFIX = "# Sheet: ";
    static final String EMPTY_TEXT = "(empty workbook)";

    private final DataFormatter fmt = new DataFormatter();
    private final StringBuilder sb = new StringBuilder();
    private final SourceSpans spans = new SourceSpans();
    private int line = 1;

    private WorkbookDocumentReader() {}

    static ParsedDocument read(InputStream in) throws DocumentReadException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            return read(workbook);
        } catch (IOException | RuntimeException ex) {
            throw new DocumentReadException(DocumentFormat.EXCEL, ex.getMessage(), ex);
        }
    }

    static ParsedDocument read(Workbook workbook) {
        WorkbookDocumentReader r = new WorkbookDocumentReader();
        DocumentValue.Mapping root = r.readWorkbook(workbook);
        String text = r.sb.length() == 0 ? EMPTY_TEXT : r.sb.toString();
        DebugLog.log("Read workbook: %d sheets, %d spans", root.entries().size(), r.spans.size());
        return new ParsedDocument(root, text, r.spans, DocumentFormat.EXCEL);
    }

    private DocumentValue.Mapping readWorkbook(Workbook workbook) {
        List<DocumentValue.Entry> sheets = new ArrayList<>();
        int sheetIndex = 0;
        for (Sheet sheet : workbook) {
            if (sheetIndex > 0) newLine();
            sheets.add(new DocumentValue.Entry(sheet.getSheetName(), readSheet(sheet)));
            sheetIndex = sheetIndex + 1;
        }
        return new DocumentValue.Mapping(sheets);
    }

    private DocumentValue.Sequence readSheet(Sheet sheet) {
        int sheetLine = line;
        sb.append(SHEET_PREFIX).append(sheet.getSheetName());
        int headerEnd = sb.length();
        newLine();

        List<String> header = null;
        List<DocumentValue> records = new ArrayList<>();
        int lastLine = sheetLine;
        int lastEndColumn = headerEnd - lineStart(sheetLine) + 1;

        int lastRow = sheet.getLastRowNum();
        int rowIdx = 0;
        while (rowIdx <= lastRow) {
            Row row = sheet.getRow(rowIdx);
            short lastCell = row != null ? row.getLastCellNum() : -1;
            if (lastCell < 0) {
                newLine();
                rowIdx = rowIdx + 1;
                continue;
            }

            List<String> cells = new ArrayList<>();
            int cellIdx = 0;
            while (cellIdx < lastCell) {
                String val = fmt.formatCellValue(row.getCell(cellIdx));
                cells.add(val == null ? "" : val);
                cellIdx = cellIdx + 1;
            }

            if (header == null) {
                header = cells;
                appendCells(cells, null);
            } else {
                List<DocumentValue.Entry> fields = new ArrayList<>();
                DocumentValue.Mapping record = new DocumentValue.Mapping(fields);
                int width = appendCells(cells, new FieldSink(header, fields));
                spans.put(record, new SourceSpan(line, 1, line, width + 1));
                records.add(record);
            }
            lastLine = line;
            lastEndColumn = sb.length() - lineStart(line) + 1;
            newLine();
            rowIdx = rowIdx + 1;
        }

        DocumentValue.Sequence rows = new DocumentValue.Sequence(records);
        spans.put(rows, new SourceSpan(sheetLine, 1, lastLine, lastEndColumn));
        return rows;
    }

    /** Appends one tab-separated line (without the newline); returns its width. */
    private int appendCells(List<String> cells, FieldSink sink) {
        int start = sb.length();
        int i = 0;
        int n = cells.size();
        while (i < n) {
            String val = cells.get(i);
            int column = sb.length() - start + 1;
            sb.append(val);
            if (sink != null) {
                DocumentValue.Text cell = new DocumentValue.Text(val);
                spans.put(cell, new SourceSpan(line, column, line, column + val.length()));
                sink.add(i, cell);
            }
            if (i < n - 1) sb.append("\t");
            i = i + 1;
        }
        return sb.length() - start;
    }

    private void newLine() {
        sb.append("\n");
        line = line + 1;
    }

    private int lineStart(int targetLine) {
        int current = line;
        int i = sb.length();
        while (i > 0 && current >= targetLine) {
            if (sb.charAt(i - 1) == '\n') {
                if (current == targetLine) return i;
                current = current - 1;
            }
            i = i - 1;
        }
        return 0;
    }

    /** Names each cell after its header column; blank or missing headers become "Column N". */
    private record FieldSink(List<String> header, List<DocumentValue.Entry> fields) {
        void add(int index, DocumentValue.Text cell) {
            String key = index < header.size() ? header.get(index).trim() : "";
            if (key.isEmpty()) key = "Column " + (index + 1);
            fields.add(new DocumentValue.Entry(key, cell));
        }
    }
}
