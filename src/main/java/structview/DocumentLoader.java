package structview;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Single entry point for turning a file or a stream into a {@link ParsedDocument}.
 * Text formats are decoded as UTF-8; Excel is read as binary.
 */
public final class DocumentLoader {

    private DocumentLoader() {}

    /** Reads {@code path}, detecting the format unless one is forced. */
    public static ParsedDocument load(Path path, DocumentFormat forced) throws IOException {
        String name = path.getFileName() == null ? null : path.getFileName().toString();
        DocumentFormat format = forced == null || forced == DocumentFormat.AUTO
                ? DocumentFormat.fromFileName(name)
                : forced;
        DebugLog.log("Loading %s as %s", path, format);

        if (format == DocumentFormat.EXCEL) {
            try (InputStream in = Files.newInputStream(path)) {
                return WorkbookDocumentReader.read(in);
            }
        }
        String text = Files.readString(path, StandardCharsets.UTF_8);
        return parse(text, format == DocumentFormat.AUTO ? DocumentFormat.detect(text, name) : format);
    }

    /** Reads a whole stream, e.g. stdin. Excel must be forced since there is no file name to go by. */
    public static ParsedDocument load(InputStream in, DocumentFormat forced) throws IOException {
        byte[] bytes = in.readAllBytes();
        if (forced == DocumentFormat.EXCEL) {
            return WorkbookDocumentReader.read(new ByteArrayInputStream(bytes));
        }
        String text = new String(bytes, StandardCharsets.UTF_8);
        DocumentFormat format = forced == null || forced == DocumentFormat.AUTO
                ? DocumentFormat.detect(text, null)
                : forced;
        return parse(text, format);
    }

    /** Parses text in a known text format. */
    public static ParsedDocument parse(String text, DocumentFormat format) throws DocumentReadException {
        if (format == null || format == DocumentFormat.AUTO) {
            throw new DocumentReadException(DocumentFormat.AUTO, "could not detect the format", null);
        }
        switch (format) {
            case XML:
                return XmlDocumentReader.read(text);
            case YAML:
                return JacksonDocumentReader.readYaml(text);
            case JSON:
                return JacksonDocumentReader.readJson(text);
            case CSV:
                return JacksonDocumentReader.readCsv(text);
            default:
                throw new DocumentReadException(format, "not a text format", null);
        }
    }
}
