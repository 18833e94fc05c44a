package db.rowquery.query;

/**
 * Tunables of the query pipeline.
 */
public class EngineConfig {
    /** Rows checked when verifying that a selected field exists. */
    public final int validationSampleRows;
    /** Rows sampled to build the "Available fields" suggestion list. */
    public final int fieldSuggestionRows;
    /** Nesting depth explored for suggested field paths. */
    public final int fieldSuggestionDepth;
    public final int maxFieldSuggestions;
    public final String defaultFormat;

    public EngineConfig(int validationSampleRows,
                        int fieldSuggestionRows,
                        int fieldSuggestionDepth,
                        int maxFieldSuggestions,
                        String defaultFormat) {
        this.validationSampleRows = validationSampleRows;
        this.fieldSuggestionRows = fieldSuggestionRows;
        this.fieldSuggestionDepth = fieldSuggestionDepth;
        this.maxFieldSuggestions = maxFieldSuggestions;
        this.defaultFormat = defaultFormat;
    }

    public static EngineConfig defaultConfig() {
        return new EngineConfig(
                5,      // validation sample rows
                3,      // suggestion sample rows
                3,      // suggestion depth
                20,     // max suggestions
                "json"
        );
    }
}
