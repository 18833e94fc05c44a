package db.rowquery.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Slices a query into its clause texts:
 *   SELECT <select> FROM <table> [WHERE <where>] [GROUP BY <groupBy>] [ORDER BY <orderBy>] [LIMIT <limit>]
 * Keywords are found case-insensitively as whole words outside quotes and parentheses; each
 * optional clause runs up to the next keyword found. A trailing ';' is ignored.
 */
public class ClauseExtractor {
    private static final Pattern TABLE_NAME = Pattern.compile("^\\w+$");
    private static final String[] OPTIONAL_KEYWORDS = { "WHERE", "GROUP BY", "ORDER BY", "LIMIT" };

    /**
     * Raw clause texts, trimmed. Optional clauses are null when the keyword is absent
     * (an empty string when the keyword is present with nothing after it).
     */
    public record Clauses(String select, String table, String where, String groupBy, String orderBy, String limit) {}

    private record Found(String keyword, SqlText.Match match) {}

    public Clauses extract(String query) {
        if (query == null) throw new IllegalArgumentException("query must not be null");
        String text = stripTerminator(query);
        SqlText.Match select = SqlText.findKeyword(text, "SELECT", 0);
        if (select == null || select.start() != 0) throw missingShape();
        SqlText.Match from = SqlText.findKeyword(text, "FROM", select.end());
        if (from == null) throw missingShape();

        List<Found> found = new ArrayList<>();
        for (String kw : OPTIONAL_KEYWORDS) {
            SqlText.Match m = SqlText.findKeyword(text, kw, from.end());
            if (m != null) found.add(new Found(kw, m));
        }
        found.sort(Comparator.comparingInt(f -> f.match().start()));

        int tableEnd = found.isEmpty() ? text.length() : found.get(0).match().start();
        String table = text.substring(from.end(), tableEnd).trim();
        if (table.isEmpty()) throw missingShape();
        if (!TABLE_NAME.matcher(table).matches()) throw new QuerySyntaxException("Invalid table name: " + table);

        String where = null, groupBy = null, orderBy = null, limit = null;
        for (int i = 0; i < found.size(); i++) {
            Found f = found.get(i);
            int end = i + 1 < found.size() ? found.get(i + 1).match().start() : text.length();
            String body = text.substring(f.match().end(), end).trim();
            switch (f.keyword()) {
                case "WHERE" -> where = body;
                case "GROUP BY" -> groupBy = body;
                case "ORDER BY" -> orderBy = body;
                case "LIMIT" -> limit = body;
                default -> throw new IllegalStateException("Unexpected keyword: " + f.keyword());
            }
        }
        String selectText = text.substring(select.end(), from.start()).trim();
        return new Clauses(selectText, table, where, groupBy, orderBy, limit);
    }

    private static String stripTerminator(String query) {
        String text = query.trim();
        while (text.endsWith(";")) text = text.substring(0, text.length() - 1).trim();
        return text;
    }

    private static QuerySyntaxException missingShape() {
        return new QuerySyntaxException("missing SELECT ... FROM <table>: expected SELECT fields FROM table");
    }
}
