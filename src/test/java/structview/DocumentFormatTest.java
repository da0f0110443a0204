package structview;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class DocumentFormatTest {

    @Test
    public void extensionWins() {
        assertEquals(DocumentFormat.XML, DocumentFormat.detect("{}", "a.xml"));
        assertEquals(DocumentFormat.YAML, DocumentFormat.detect("", "b.YML"));
        assertEquals(DocumentFormat.YAML, DocumentFormat.detect("", "b.yaml"));
        assertEquals(DocumentFormat.JSON, DocumentFormat.detect("<x/>", "c.json"));
        assertEquals(DocumentFormat.CSV, DocumentFormat.detect("", "d.csv"));
        assertEquals(DocumentFormat.EXCEL, DocumentFormat.detect("", "e.xlsx"));
        assertEquals(DocumentFormat.EXCEL, DocumentFormat.fromFileName("old.xls"));
    }

    @Test
    public void contentHeuristics() {
        assertEquals(DocumentFormat.XML, DocumentFormat.detect("  \n<root/>", null));
        assertEquals(DocumentFormat.JSON, DocumentFormat.detect("{\"a\": 1}", "notes.txt"));
        assertEquals(DocumentFormat.JSON, DocumentFormat.detect("[1, 2]", null));
        assertEquals(DocumentFormat.YAML, DocumentFormat.detect("name: x\nport: 1", null));
        assertEquals(DocumentFormat.CSV, DocumentFormat.detect("a,b\n1,2", null));
        assertEquals(DocumentFormat.AUTO, DocumentFormat.detect("plain words", null));
        assertEquals(DocumentFormat.AUTO, DocumentFormat.detect(null, null));
    }

    @Test
    public void yamlWithCommasLooksLikeCsv() {
        assertEquals(DocumentFormat.CSV, DocumentFormat.detect("tags: a, b", null));
    }
}
