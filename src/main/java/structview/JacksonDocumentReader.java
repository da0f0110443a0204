package structview;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.csv.CsvFactory;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads JSON, YAML and CSV through Jackson's streaming parsers, recording a span for every value.
 * <p>
 * Mapping entries span from their key to the end of their value. JSON containers end just past
 * their closing bracket; YAML containers end where their last child ends. CSV records get
 * one span per record (see {@link CsvRecords}); their fields have none.
 */
final class JacksonDocumentReader {

    private static final JsonFactory JSON = new JsonFactory();
    private static final YAMLFactory YAML = new YAMLFactory();
    private static final CsvFactory CSV = CsvFactory.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private final JsonParser parser;
    private final DocumentFormat format;
    private final SourceSpans spans = new SourceSpans();

    private JacksonDocumentReader(JsonParser parser, DocumentFormat format) {
        this.parser = parser;
        this.format = format;
    }

    static ParsedDocument readJson(String text) throws DocumentReadException {
        return read(text, DocumentFormat.JSON);
    }

    static ParsedDocument readYaml(String text) throws DocumentReadException {
        return read(text, DocumentFormat.YAML);
    }

    static ParsedDocument readCsv(String text) throws DocumentReadException {
        return read(text, DocumentFormat.CSV);
    }

    private static ParsedDocument read(String text, DocumentFormat format) throws DocumentReadException {
        try (JsonParser p = createParser(text, format)) {
            JacksonDocumentReader reader = new JacksonDocumentReader(p, format);
            DocumentValue root = reader.readDocuments();
            if (format == DocumentFormat.CSV) {
                reader.attachRecordSpans(root, text);
            }
            DebugLog.log("Read %s: %d spans", format, reader.spans.size());
            return new ParsedDocument(root, text, reader.spans, format);
        } catch (IOException | RuntimeException ex) {
            throw new DocumentReadException(format, ex.getMessage(), ex);
        }
    }

    private static JsonParser createParser(String text, DocumentFormat format) throws IOException {
        if (format == DocumentFormat.YAML) {
            return YAML.createParser(text);
        }
        if (format == DocumentFormat.CSV) {
            JsonParser p = CSV.createParser(text);
            p.setSchema(CsvSchema.emptySchema().withHeader());
            return p;
        }
        return JSON.createParser(text);
    }

    /** One root value, or a sequence of them when the input holds several documents. */
    private DocumentValue readDocuments() throws IOException {
        List<DocumentValue> docs = new ArrayList<>();
        JsonToken t = parser.nextToken();
        while (t != null) {
            docs.add(readValue(t));
            t = parser.nextToken();
        }
        if (docs.isEmpty()) {
            return new DocumentValue.Null();
        }
        if (docs.size() == 1) {
            return docs.get(0);
        }
        DocumentValue.DocumentStream stream = new DocumentValue.DocumentStream(docs);
        spans.put(stream, spanBetween(spans.spanOf(docs.get(0)), spans.spanOf(docs.get(docs.size() - 1))));
        return stream;
    }

    private DocumentValue readValue(JsonToken token) throws IOException {
        JsonLocation start = parser.currentTokenLocation();
        DocumentValue value;
        switch (token) {
            case START_OBJECT:
                return readMapping(start);
            case START_ARRAY:
                return readSequence(start);
            case VALUE_STRING:
                value = new DocumentValue.Text(parser.getText());
                break;
            case VALUE_NUMBER_INT:
                value = new DocumentValue.Number(parser.getNumberValue());
                break;
            case VALUE_NUMBER_FLOAT:
                value = new DocumentValue.Number(floatValue());
                break;
            case VALUE_TRUE:
                value = new DocumentValue.Bool(true);
                break;
            case VALUE_FALSE:
                value = new DocumentValue.Bool(false);
                break;
            case VALUE_EMBEDDED_OBJECT:
                value = embedded(parser.getEmbeddedObject());
                break;
            case VALUE_NULL:
                value = new DocumentValue.Null();
                break;
            default:
                throw new IOException("Unexpected token " + token + " at line " + start.getLineNr());
        }
        recordSpan(value, start, parser.currentLocation());
        return value;
    }

    // floats keep the digits written in the source; the exact value is a BigDecimal
    private java.lang.Number floatValue() throws IOException {
        try {
            return parser.getNumberValueExact();
        } catch (NumberFormatException | JsonProcessingException ex) {
            DebugLog.log("no exact value for " + parser.getText(), ex);
            return parser.getNumberValue();
        }
    }

    private DocumentValue readMapping(JsonLocation start) throws IOException {
        List<DocumentValue.Entry> entries = new ArrayList<>();
        DocumentValue.Mapping mapping = new DocumentValue.Mapping(entries);
        SourceSpan lastChild = null;

        JsonToken t = parser.nextToken();
        while (t == JsonToken.FIELD_NAME) {
            String key = parser.currentName();
            JsonLocation keyStart = parser.currentTokenLocation();
            DocumentValue value = readValue(parser.nextToken());
            SourceSpan valueSpan = spans.spanOf(value);
            if (valueSpan != null) {
                SourceSpan entrySpan = new SourceSpan(keyStart.getLineNr(), keyStart.getColumnNr(),
                        valueSpan.endLine(), valueSpan.endColumn());
                spans.put(value, entrySpan);
                lastChild = entrySpan;
            }
            entries.add(new DocumentValue.Entry(key, value));
            t = parser.nextToken();
        }
        if (t != JsonToken.END_OBJECT) {
            throw new IOException("Expected end of object but found " + t);
        }
        recordContainerSpan(mapping, start, lastChild);
        return mapping;
    }

    private DocumentValue readSequence(JsonLocation start) throws IOException {
        List<DocumentValue> items = new ArrayList<>();
        DocumentValue.Sequence sequence = new DocumentValue.Sequence(items);
        SourceSpan lastChild = null;

        JsonToken t = parser.nextToken();
        while (t != JsonToken.END_ARRAY) {
            if (t == null) {
                throw new IOException("Unexpected end of input inside array");
            }
            DocumentValue item = readValue(t);
            SourceSpan itemSpan = spans.spanOf(item);
            if (itemSpan != null) lastChild = itemSpan;
            items.add(item);
            t = parser.nextToken();
        }
        recordContainerSpan(sequence, start, lastChild);
        return sequence;
    }

    private void recordContainerSpan(DocumentValue container, JsonLocation start, SourceSpan lastChild) {
        if (format == DocumentFormat.CSV) return;
        if (format == DocumentFormat.JSON) {
            JsonLocation close = parser.currentTokenLocation();
            spans.put(container, new SourceSpan(start.getLineNr(), start.getColumnNr(),
                    close.getLineNr(), close.getColumnNr() + 1));
            return;
        }
        // YAML block collections report their end at the next token, so use the last child instead
        if (lastChild != null) {
            spans.put(container, new SourceSpan(start.getLineNr(), start.getColumnNr(),
                    lastChild.endLine(), lastChild.endColumn()));
        } else {
            recordSpan(container, start, parser.currentLocation());
        }
    }

    private void recordSpan(DocumentValue value, JsonLocation start, JsonLocation end) {
        if (format == DocumentFormat.CSV) return;
        if (start == null || end == null || start.getLineNr() < 1 || end.getLineNr() < 1) return;
        spans.put(value, new SourceSpan(start.getLineNr(), start.getColumnNr(), end.getLineNr(), end.getColumnNr()));
    }

    private void attachRecordSpans(DocumentValue root, String text) {
        if (!(root instanceof DocumentValue.Sequence records)) return;
        List<SourceSpan> recordSpans = CsvRecords.recordSpans(text);
        if (recordSpans.isEmpty()) return;

        // index 0 is the header row
        int i = 0;
        int n = records.items().size();
        while (i < n && i + 1 < recordSpans.size()) {
            spans.put(records.items().get(i), recordSpans.get(i + 1));
            i = i + 1;
        }
        spans.put(root, spanBetween(recordSpans.get(0), recordSpans.get(recordSpans.size() - 1)));
    }

    private static DocumentValue embedded(Object obj) {
        if (obj instanceof byte[] bytes) {
            return new DocumentValue.Bytes(bytes);
        }
        return ValueInspector.wrap(obj);
    }

    private static SourceSpan spanBetween(SourceSpan first, SourceSpan last) {
        if (first == null || last == null) return null;
        return first.extendTo(last);
    }
}
