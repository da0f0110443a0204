package structview;

import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DocumentLoaderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void loadsByExtension() throws Exception {
        File f = tmp.newFile("config.yaml");
        Files.writeString(f.toPath(), "a: 1\n");
        ParsedDocument doc = DocumentLoader.load(f.toPath(), DocumentFormat.AUTO);
        assertEquals(DocumentFormat.YAML, doc.format());
        assertEquals("a: 1\n", doc.sourceText());
    }

    @Test
    public void detectsContentWhenExtensionIsUnknown() throws Exception {
        File f = tmp.newFile("data.txt");
        Files.writeString(f.toPath(), "<r><v>ü</v></r>", StandardCharsets.UTF_8);
        ParsedDocument doc = DocumentLoader.load(f.toPath(), null);
        assertEquals(DocumentFormat.XML, doc.format());
        assertTrue(doc.sourceText().contains("ü"));
    }

    @Test
    public void forcedFormatOverridesExtension() throws Exception {
        File f = tmp.newFile("list.xml");
        Files.writeString(f.toPath(), "[1, 2]");
        ParsedDocument doc = DocumentLoader.load(f.toPath(), DocumentFormat.JSON);
        assertEquals(DocumentFormat.JSON, doc.format());
    }

    @Test
    public void readsExcelAsBinary() throws Exception {
        File f = tmp.newFile("book.xlsx");
        try (Workbook wb = new XSSFWorkbook(); OutputStream out = new FileOutputStream(f)) {
            wb.createSheet("One").createRow(0).createCell(0).setCellValue("h");
            wb.write(out);
        }
        ParsedDocument doc = DocumentLoader.load(f.toPath(), DocumentFormat.AUTO);
        assertEquals(DocumentFormat.EXCEL, doc.format());
        assertTrue(doc.sourceText().startsWith("# Sheet: One\n"));
    }

    @Test
    public void readsStreams() throws Exception {
        ParsedDocument doc = DocumentLoader.load(new ByteArrayInputStream("x,y\n1,2\n".getBytes(StandardCharsets.UTF_8)), null);
        assertEquals(DocumentFormat.CSV, doc.format());
        assertEquals(1, ((DocumentValue.Sequence) doc.root()).items().size());
    }

    @Test
    public void undetectableTextIsAnError() throws Exception {
        try {
            DocumentLoader.load(new ByteArrayInputStream("just words".getBytes(StandardCharsets.UTF_8)), DocumentFormat.AUTO);
            fail("expected failure");
        } catch (DocumentReadException ex) {
            assertEquals(DocumentFormat.AUTO, ex.format());
        }
    }

    @Test
    public void parseErrorsCarryTheFormat() throws Exception {
        File f = tmp.newFile("broken.json");
        Files.writeString(f.toPath(), "{\"a\": [1, }");
        try {
            DocumentLoader.load(f.toPath(), DocumentFormat.AUTO);
            fail("expected failure");
        } catch (DocumentReadException ex) {
            assertEquals(DocumentFormat.JSON, ex.format());
        }
    }
}
