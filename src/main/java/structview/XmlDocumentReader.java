package structview;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads XML with StAX into {@link DocumentValue.AttributedElement}s.
 * <p>
 * The root element is wrapped in a {@code #document} element so it shows up under its own tag name.
 * An element's span runs from its start tag to the end of its end tag; attributes share the
 * span of the start tag. Direct text is the trimmed concatenation of text and CDATA children.
 */
final class XmlDocumentReader {

    static final String DOCUMENT_NAME = "#document";

    private final XMLStreamReader reader;
    private final String text;
    private final int[] lineStarts;
    private final SourceSpans spans = new SourceSpans();

    private XmlDocumentReader(XMLStreamReader reader, String text) {
        this.reader = reader;
        this.text = text;
        this.lineStarts = lineStarts(text);
    }

    static ParsedDocument read(String text) throws DocumentReadException {
        XMLInputFactory factory = XMLInputFactory.newInstance();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);

        XMLStreamReader xml = null;
        try {
            xml = factory.createXMLStreamReader(new StringReader(text));
            XmlDocumentReader r = new XmlDocumentReader(xml, text);
            DocumentValue.AttributedElement root = r.readDocument();
            r.spans.put(root, r.wholeDocument());
            DebugLog.log("Read XML: %d spans", r.spans.size());
            return new ParsedDocument(root, text, r.spans, DocumentFormat.XML);
        } catch (XMLStreamException | RuntimeException ex) {
            throw new DocumentReadException(DocumentFormat.XML, ex.getMessage(), ex);
        } finally {
            close(xml);
        }
    }

    private DocumentValue.AttributedElement readDocument() throws XMLStreamException {
        List<DocumentValue> top = new ArrayList<>();
        while (advance()) {
            if (reader.getEventType() == XMLStreamConstants.START_ELEMENT) {
                top.add(readElement());
            }
        }
        return new DocumentValue.AttributedElement(DOCUMENT_NAME, List.of(), top, "");
    }

    /** Called positioned on START_ELEMENT; returns positioned on the matching END_ELEMENT. */
    private DocumentValue.AttributedElement readElement() throws XMLStreamException {
        String name = qualifiedName(reader.getPrefix(), reader.getLocalName());

        // the reader sits just past the start tag, which holds no '<' of its own
        Location tagEnd = reader.getLocation();
        int open = text.lastIndexOf('<', offsetOf(tagEnd.getLineNumber(), tagEnd.getColumnNumber()) - 1);
        int startLine = lineOf(Math.max(0, open));
        int startColumn = Math.max(0, open) - lineStarts[startLine - 1] + 1;
        SourceSpan startTag = new SourceSpan(startLine, startColumn, tagEnd.getLineNumber(), tagEnd.getColumnNumber());

        List<DocumentValue.Attribute> attributes = new ArrayList<>();
        int i = 0;
        int n = reader.getAttributeCount();
        while (i < n) {
            DocumentValue.Text value = new DocumentValue.Text(reader.getAttributeValue(i));
            spans.put(value, startTag);
            attributes.add(new DocumentValue.Attribute(
                    qualifiedName(reader.getAttributePrefix(i), reader.getAttributeLocalName(i)), value));
            i = i + 1;
        }

        List<DocumentValue> children = new ArrayList<>();
        StringBuilder content = new StringBuilder();
        while (advance()) {
            int event = reader.getEventType();
            if (event == XMLStreamConstants.START_ELEMENT) {
                children.add(readElement());
            } else if (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.CDATA) {
                content.append(reader.getText().trim());
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                break;
            }
        }

        Location end = reader.getLocation();
        DocumentValue.AttributedElement element =
                new DocumentValue.AttributedElement(name, attributes, children, content.toString().trim());
        spans.put(element, new SourceSpan(startLine, startColumn, end.getLineNumber(), end.getColumnNumber()));
        return element;
    }

    private boolean advance() throws XMLStreamException {
        if (!reader.hasNext()) return false;
        reader.next();
        return true;
    }

    /** Character offset of a 1-based line and column, clamped to the text. */
    private int offsetOf(int line, int column) {
        if (line < 1) return text.length();
        if (line > lineStarts.length) return text.length();
        return Math.min(text.length(), lineStarts[line - 1] + Math.max(1, column) - 1);
    }

    private int lineOf(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) / 2;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    private SourceSpan wholeDocument() {
        int lastLine = lineStarts.length;
        return new SourceSpan(1, 1, lastLine, text.length() - lineStarts[lastLine - 1] + 1);
    }

    private static int[] lineStarts(String text) {
        int count = 1;
        int i = 0;
        int n = text.length();
        while (i < n) {
            if (text.charAt(i) == '\n') count = count + 1;
            i = i + 1;
        }
        int[] starts = new int[count];
        int line = 1;
        i = 0;
        while (i < n) {
            if (text.charAt(i) == '\n') {
                starts[line] = i + 1;
                line = line + 1;
            }
            i = i + 1;
        }
        return starts;
    }

    private static String qualifiedName(String prefix, String local) {
        if (prefix == null || prefix.isEmpty()) return local;
        return prefix + ":" + local;
    }

    private static void close(XMLStreamReader xml) throws DocumentReadException {
        if (xml == null) return;
        try {
            xml.close();
        } catch (XMLStreamException ex) {
            throw new DocumentReadException(DocumentFormat.XML, ex.getMessage(), ex);
        }
    }
}
