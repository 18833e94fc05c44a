package db.rowquery.format;

import java.util.List;
import java.util.Locale;

/**
 * Output formats by name: json, csv, table (case-insensitive).
 */
public final class FormatFactory {
    private static final List<String> FORMATS = List.of("json", "csv", "table");

    private FormatFactory() {}

    public static Formatter create(String formatName) {
        String name = formatName == null ? "" : formatName.trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "json" -> new JsonFormatter();
            case "csv" -> new CsvFormatter();
            case "table" -> new TableFormatter();
            default -> throw new IllegalArgumentException(
                "Unknown format: " + formatName + ". Available formats: " + String.join(", ", FORMATS));
        };
    }

    public static boolean isAvailable(String formatName) {
        return formatName != null && FORMATS.contains(formatName.trim().toLowerCase(Locale.ROOT));
    }

    public static List<String> availableFormats() {
        return FORMATS;
    }
}
