package structview;

import java.io.IOException;

/**
 * Raised when input cannot be read or parsed as the requested format.
 */
public class DocumentReadException extends IOException {

    private final DocumentFormat format;

    public DocumentReadException(DocumentFormat format, String message, Throwable cause) {
        super("Error reading " + format.label() + " data: " + message, cause);
        this.format = format;
    }

    public DocumentFormat format() {
        return format;
    }
}
