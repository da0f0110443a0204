package structview;

import java.util.Locale;

/**
 * Supported input formats. {@link #AUTO} means "detect" (or "unknown" as a detection result).
 */
public enum DocumentFormat {
    AUTO("Auto"),
    XML("XML"),
    YAML("YAML"),
    JSON("JSON"),
    CSV("CSV"),
    EXCEL("Excel");

    private final String label;

    DocumentFormat(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DocumentFormat fromFileName(String fileName) {
        if (fileName == null) return AUTO;
        String name = fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".xml")) return XML;
        if (name.endsWith(".yml") || name.endsWith(".yaml")) return YAML;
        if (name.endsWith(".json")) return JSON;
        if (name.endsWith(".csv")) return CSV;
        if (name.endsWith(".xlsx") || name.endsWith(".xls")) return EXCEL;
        return AUTO;
    }

    /**
     * File extension first, then content: markup, JSON brackets, "key: value" without commas (YAML),
     * commas (CSV). The last two are guesses; a YAML file with commas in its values reads as CSV.
     */
    public static DocumentFormat detect(String text, String fileName) {
        DocumentFormat byName = fromFileName(fileName);
        if (byName != AUTO) return byName;
        if (text == null) return AUTO;

        String trimmed = text.stripLeading();
        if (trimmed.startsWith("<")) return XML;
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) return JSON;
        if (trimmed.contains(":") && !trimmed.contains(",")) return YAML;
        if (trimmed.contains(",")) return CSV;
        return AUTO;
    }
}
