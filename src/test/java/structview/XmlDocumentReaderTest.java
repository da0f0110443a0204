package structview;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class XmlDocumentReaderTest {

    private static final String XML = "<library>\n"
            + "  <book id=\"1\"><title>Dune</title></book>\n"
            + "  <book id=\"2\"><title><![CDATA[ A < B ]]></title></book>\n"
            + "</library>\n";

    private static DocumentValue.AttributedElement library(ParsedDocument doc) {
        DocumentValue.AttributedElement document = (DocumentValue.AttributedElement) doc.root();
        assertEquals(XmlDocumentReader.DOCUMENT_NAME, document.name());
        return (DocumentValue.AttributedElement) document.children().get(0);
    }

    @Test
    public void elementsAttributesAndText() throws Exception {
        ParsedDocument doc = XmlDocumentReader.read(XML);
        assertEquals(DocumentFormat.XML, doc.format());

        DocumentValue.AttributedElement library = library(doc);
        assertEquals("library", library.name());
        assertEquals(2, library.children().size());

        DocumentValue.AttributedElement book = (DocumentValue.AttributedElement) library.children().get(1);
        assertEquals("book", book.name());
        assertEquals("id", book.attributes().get(0).name());
        assertEquals("2", book.attributes().get(0).value().value());

        DocumentValue.AttributedElement title = (DocumentValue.AttributedElement) book.children().get(0);
        assertEquals("A < B", title.text());
    }

    @Test
    public void elementSpansCoverStartToEndTag() throws Exception {
        ParsedDocument doc = XmlDocumentReader.read(XML);
        DocumentValue.AttributedElement library = library(doc);

        DocumentValue.AttributedElement first = (DocumentValue.AttributedElement) library.children().get(0);
        SourceRange firstRange = SourceLocator.locate(XML, doc.spans().spanOf(first));
        assertTrue(firstRange.text(XML), firstRange.text(XML).contains("book id=\"1\">"));
        assertTrue(firstRange.text(XML), firstRange.text(XML).contains("</book"));

        SourceSpan span = doc.spans().spanOf(library);
        assertEquals(1, span.startLine());
        assertEquals(4, span.endLine());

        DocumentValue.AttributedElement second = (DocumentValue.AttributedElement) library.children().get(1);
        assertEquals(3, doc.spans().spanOf(second).startLine());
        assertEquals(3, doc.spans().spanOf(second).endLine());
        assertEquals(3, doc.spans().spanOf(second.attributes().get(0).value()).startLine());

        SourceSpan whole = doc.spans().spanOf(doc.root());
        assertEquals(1, whole.startLine());
        assertEquals(5, whole.endLine());
    }

    @Test
    public void declarationAndCommentsDoNotShiftStartTags() throws Exception {
        String xml = "<?xml version=\"1.0\"?>\n"
                + "<!-- header -->\n"
                + "\n"
                + "<root x=\"1\">\n"
                + "  <a>1</a>\n"
                + "</root>\n";
        ParsedDocument doc = XmlDocumentReader.read(xml);
        DocumentValue.AttributedElement root = library(doc);

        SourceSpan rootSpan = doc.spans().spanOf(root);
        assertEquals(4, rootSpan.startLine());
        assertEquals(1, rootSpan.startColumn());
        assertEquals(6, rootSpan.endLine());
        assertTrue(SourceLocator.locate(xml, rootSpan).text(xml).startsWith("<root x=\"1\">"));

        SourceSpan attrSpan = doc.spans().spanOf(root.attributes().get(0).value());
        assertEquals(4, attrSpan.startLine());
        assertEquals(1, attrSpan.startColumn());
        assertEquals(4, attrSpan.endLine());

        SourceSpan childSpan = doc.spans().spanOf(root.children().get(0));
        assertEquals(5, childSpan.startLine());
        assertEquals(3, childSpan.startColumn());
        assertEquals("<a>1</a>", SourceLocator.locate(xml, childSpan).text(xml));

        DocumentSession session = new DocumentSession();
        session.load(doc);
        // the declaration belongs to the document only
        assertNull(SyncCoordinator.findNodeAtLine(session.root(), 1).name());
        assertEquals("@x", SyncCoordinator.findNodeAtLine(session.root(), 4).name());
        assertEquals("a", SyncCoordinator.findNodeAtLine(session.root(), 5).name());
    }

    @Test
    public void treeShowsBooksAsIndexedArray() throws Exception {
        ParsedDocument doc = XmlDocumentReader.read(XML);
        DocumentSession session = new DocumentSession();
        session.load(doc);

        TreeNode libraryNode = session.root().children().get(0);
        assertEquals("library", libraryNode.name());
        assertEquals(NodeKind.COLLECTION, libraryNode.kind());
        assertEquals("(2 items)", libraryNode.displayValue());

        List<TreeNode> books = libraryNode.children();
        assertEquals("[0]", books.get(0).name());
        assertEquals("Book", books.get(0).typeLabel());

        List<TreeNode> fields = books.get(0).children();
        assertEquals("@id", fields.get(0).name());
        assertEquals("title", fields.get(1).name());
        assertEquals("\"Dune\"", fields.get(1).displayValue());

        // the attribute shares the start tag's span, so it is the deepest match on that line
        assertEquals("@id", SyncCoordinator.findNodeAtLine(session.root(), 3).name());
    }

    @Test
    public void namespacePrefixesAreKept() throws Exception {
        ParsedDocument doc = XmlDocumentReader.read("<a:root xmlns:a=\"urn:x\"><a:item>v</a:item></a:root>");
        DocumentValue.AttributedElement root = library(doc);
        assertEquals("a:root", root.name());
        assertEquals("a:item", ((DocumentValue.AttributedElement) root.children().get(0)).name());
    }

    @Test
    public void malformedXmlReportsFormat() {
        try {
            XmlDocumentReader.read("<a><b></a>");
            fail("expected failure");
        } catch (DocumentReadException ex) {
            assertEquals(DocumentFormat.XML, ex.format());
            assertTrue(ex.getMessage().startsWith("Error reading XML data: "));
        }
    }
}
