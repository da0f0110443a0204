package structview;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CsvRecordsTest {

    @Test
    public void oneSpanPerRecordSkippingBlankLines() {
        List<SourceSpan> spans = CsvRecords.recordSpans("a,b\r\n\r\n1,2\r\n");
        assertEquals(List.of(new SourceSpan(1, 1, 1, 4), new SourceSpan(3, 1, 3, 4)), spans);
    }

    @Test
    public void quotedNewlinesExtendTheRecord() {
        List<SourceSpan> spans = CsvRecords.recordSpans("h\n\"x\ny\",z\nlast");
        assertEquals(3, spans.size());
        assertEquals(new SourceSpan(2, 1, 3, 5), spans.get(1));
        assertEquals(new SourceSpan(4, 1, 4, 5), spans.get(2));
    }

    @Test
    public void escapedQuotesDoNotEndTheField() {
        List<SourceSpan> spans = CsvRecords.recordSpans("\"say \"\"hi\"\"\nthere\"\nnext");
        assertEquals(2, spans.size());
        assertEquals(2, spans.get(0).endLine());
        assertEquals(3, spans.get(1).startLine());
    }

    @Test
    public void emptyInput() {
        assertTrue(CsvRecords.recordSpans("").isEmpty());
        assertTrue(CsvRecords.recordSpans(null).isEmpty());
    }
}
