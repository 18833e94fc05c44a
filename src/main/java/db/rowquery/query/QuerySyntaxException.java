package db.rowquery.query;

/**
 * Malformed query text: bad clause shape, unbalanced quotes or parentheses, invalid
 * identifiers, unknown aggregate functions.
 */
public class QuerySyntaxException extends IllegalArgumentException {
    public QuerySyntaxException(String message) {
        super(message);
    }

    public QuerySyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
