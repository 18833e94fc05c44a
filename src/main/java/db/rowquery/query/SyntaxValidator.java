package db.rowquery.query;

import java.util.Optional;

/**
 * Up-front syntax check over the whole query. Runs every clause parser independently and
 * reports the first problem, qualified with the clause it was found in.
 */
public class SyntaxValidator {
    private final QueryParser parser;

    public SyntaxValidator() {
        this(new QueryParser());
    }

    public SyntaxValidator(QueryParser parser) {
        this.parser = parser;
    }

    /** Empty when the query is well-formed, otherwise the first error message. */
    public Optional<String> validate(String query) {
        if (query == null || query.isBlank()) return Optional.of("Empty query");
        ClauseExtractor.Clauses clauses;
        try {
            clauses = parser.clauses(query);
        } catch (QuerySyntaxException e) {
            return Optional.of("Query must have SELECT ... FROM ... structure: " + e.getMessage());
        }
        if (!SqlText.balancedParentheses(query)) return Optional.of("Unbalanced parentheses in query");
        if (!SqlText.balancedQuotes(query)) return Optional.of("Unbalanced quotes in query");

        try {
            parser.parseSelect(clauses.select());
        } catch (QuerySyntaxException e) {
            return Optional.of("SELECT clause error: " + e.getMessage());
        }
        try {
            parser.parseWhere(clauses.where());
        } catch (QuerySyntaxException e) {
            return Optional.of("WHERE clause error: " + e.getMessage());
        }
        try {
            parser.parseGroupBy(clauses.groupBy());
        } catch (QuerySyntaxException e) {
            return Optional.of("GROUP BY clause error: " + e.getMessage());
        }
        try {
            parser.parseOrderBy(clauses.orderBy());
        } catch (QuerySyntaxException e) {
            return Optional.of("ORDER BY clause error: " + e.getMessage());
        }
        try {
            parser.parseLimit(clauses.limit());
        } catch (QuerySyntaxException e) {
            return Optional.of("LIMIT clause error: " + e.getMessage());
        }
        return Optional.empty();
    }
}
