package db.rowquery.cli;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line settings of the interactive shell.
 *   --data=<dir>     directory of *.json tables (default: data)
 *   --format=<fmt>   json, csv or table (default: table)
 *   --limit=<n>      row limit applied to every query, 0 for none (default: 0)
 */
public class CliConfig {
    public final Path dataDir;
    public final String format;
    public final int limit;

    public CliConfig(Path dataDir, String format, int limit) {
        this.dataDir = dataDir;
        this.format = format;
        this.limit = limit;
    }

    public static CliConfig defaultConfig() {
        return new CliConfig(Paths.get("data"), "table", 0);
    }

    /** Unknown flags are ignored; a malformed number keeps the default. */
    public static CliConfig fromArgs(String[] args) {
        CliConfig defaults = defaultConfig();
        Path dataDir = defaults.dataDir;
        String format = defaults.format;
        int limit = defaults.limit;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--data=")) {
                String dir = s.substring("--data=".length());
                if (!dir.isEmpty()) dataDir = Paths.get(dir);
            } else if (s.startsWith("--format=")) {
                String f = s.substring("--format=".length());
                if (!f.isEmpty()) format = f;
            } else if (s.startsWith("--limit=")) {
                limit = parseIntOr(s.substring("--limit=".length()), limit);
            }
        }
        return new CliConfig(dataDir, format, limit);
    }

    private static int parseIntOr(String text, int fallback) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
