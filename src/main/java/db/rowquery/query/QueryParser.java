package db.rowquery.query;

import java.util.List;
import java.util.regex.Pattern;

import db.rowquery.exec.OrderSpec;

/**
 * Query parser for the supported form:
 *   SELECT [DISTINCT] items FROM table [WHERE cond (AND|OR cond)*]
 *     [GROUP BY fields] [ORDER BY key [ASC|DESC], ...] [LIMIT n]
 * Each clause has its own parser; this class wires them to the clause texts.
 */
public class QueryParser {
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");

    private final ClauseExtractor extractor = new ClauseExtractor();
    private final SelectParser selectParser = new SelectParser();
    private final WhereParser whereParser = new WhereParser();
    private final GroupByParser groupByParser = new GroupByParser();
    private final OrderByParser orderByParser = new OrderByParser();

    public ClauseExtractor.Clauses clauses(String query) {
        return extractor.extract(query);
    }

    public SelectClause parseSelect(String selectText) {
        return selectParser.parse(selectText);
    }

    /** Absent WHERE (null) matches every row. */
    public WhereExpression parseWhere(String whereText) {
        if (whereText == null) return WhereExpression.empty();
        return whereParser.parse(whereText);
    }

    public List<String> parseGroupBy(String groupByText) {
        if (groupByText == null) return List.of();
        return groupByParser.parse(groupByText);
    }

    public List<OrderSpec> parseOrderBy(String orderByText) {
        if (orderByText == null) return List.of();
        return orderByParser.parse(orderByText);
    }

    /** Non-negative integer, or null when the query has no LIMIT clause. */
    public Integer parseLimit(String limitText) {
        if (limitText == null) return null;
        String text = limitText.trim();
        if (!DIGITS.matcher(text).matches()) throw new QuerySyntaxException("Invalid LIMIT value: " + (text.isEmpty() ? "(empty)" : text));
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new QuerySyntaxException("Invalid LIMIT value: " + text, e);
        }
    }
}
