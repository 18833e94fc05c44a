package db.rowquery.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import db.rowquery.value.FieldPath;
import db.rowquery.value.Value;

/**
 * WHERE clause parser.
 *   cond (AND|OR cond)*
 * cond forms, tried in order:
 *   path IS NOT NULL | path IS NULL
 *   path [NOT] BETWEEN lo AND hi
 *   path [NOT] IN (v1, v2, ...)
 *   path op literal, op one of >=, <=, !=, <>, >, <, =, NOT LIKE, NOT ILIKE, LIKE, ILIKE
 * No parentheses for grouping and no precedence: the chain evaluates left to right.
 */
public class WhereParser {
    private static final String PATH = "([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)";
    private static final Pattern IS_NOT_NULL = Pattern.compile("^" + PATH + "\\s+IS\\s+NOT\\s+NULL$", Pattern.CASE_INSENSITIVE);
    private static final Pattern IS_NULL = Pattern.compile("^" + PATH + "\\s+IS\\s+NULL$", Pattern.CASE_INSENSITIVE);
    private static final Pattern IN_LIST = Pattern.compile("^" + PATH + "\\s+(NOT\\s+)?IN\\s*\\((.*)\\)$",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern NOT_SUFFIX = Pattern.compile("^(.*?)\\s+NOT$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    // Scan order matters: two-character symbols before their one-character prefixes, NOT forms before bare ones
    private static final String[] OPERATORS = { ">=", "<=", "!=", "<>", ">", "<", "=", "NOT LIKE", "NOT ILIKE", "LIKE", "ILIKE" };

    private record Piece(String text, String connector) {}

    public WhereExpression parse(String whereText) {
        if (whereText == null || whereText.isBlank()) throw new QuerySyntaxException("Empty WHERE clause");
        List<Piece> pieces = mergeBetween(split(whereText.trim()));
        List<WhereCondition> conditions = new ArrayList<>();
        List<String> connectors = new ArrayList<>();
        for (int i = 0; i < pieces.size(); i++) {
            Piece p = pieces.get(i);
            if (p.text().isEmpty()) {
                if (i > 0) throw new QuerySyntaxException("Missing condition after " + pieces.get(i - 1).connector());
                throw new QuerySyntaxException("Missing condition before " + p.connector());
            }
            conditions.add(parseCondition(p.text()));
            if (p.connector() != null) connectors.add(p.connector());
        }
        return new WhereExpression(conditions, connectors);
    }

    /** Parses one condition; errors are prefixed with the condition text. */
    public WhereCondition parseCondition(String conditionText) {
        String text = conditionText.trim();
        try {
            if (text.isEmpty()) throw new QuerySyntaxException("Empty condition");
            return parseConditionBody(text);
        } catch (QuerySyntaxException e) {
            throw new QuerySyntaxException("Error parsing condition '" + text + "': " + e.getMessage(), e);
        }
    }

    private WhereCondition parseConditionBody(String text) {
        Matcher m = IS_NOT_NULL.matcher(text);
        if (m.matches()) return new WhereCondition(m.group(1), WhereCondition.Op.IS_NOT, Value.NULL);
        m = IS_NULL.matcher(text);
        if (m.matches()) return new WhereCondition(m.group(1), WhereCondition.Op.IS, Value.NULL);

        SqlText.Match between = SqlText.findKeyword(text, "BETWEEN", 0);
        if (between != null) return parseBetween(text, between);

        m = IN_LIST.matcher(text);
        if (m.matches()) {
            List<Value> values = LiteralParser.parseList(m.group(3));
            return new WhereCondition(m.group(1), WhereCondition.Op.IN, Value.ofSequence(values), m.group(2) != null);
        }
        return parseComparison(text);
    }

    private WhereCondition parseBetween(String text, SqlText.Match between) {
        String left = text.substring(0, between.start()).trim();
        boolean negated = false;
        Matcher not = NOT_SUFFIX.matcher(left);
        if (not.matches()) {
            left = not.group(1).trim();
            negated = true;
        }
        String field = requireField(left);
        SqlText.Match and = SqlText.findKeyword(text, "AND", between.end());
        if (and == null) throw new QuerySyntaxException("BETWEEN requires 'AND' between its bounds");
        String low = text.substring(between.end(), and.start()).trim();
        String high = text.substring(and.end()).trim();
        if (low.isEmpty() || high.isEmpty()) throw new QuerySyntaxException("BETWEEN requires two bounds");
        Value bounds = Value.ofSequence(List.of(LiteralParser.parse(low), LiteralParser.parse(high)));
        return new WhereCondition(field, WhereCondition.Op.BETWEEN, bounds, negated);
    }

    private WhereCondition parseComparison(String text) {
        for (String op : OPERATORS) {
            List<Integer> hits = occurrences(text, op);
            if (hits.size() != 1) continue;
            int at = hits.get(0);
            String field = text.substring(0, at).trim();
            String literal = text.substring(at + op.length()).trim();
            if (field.isEmpty()) throw new QuerySyntaxException("Missing field name in condition: " + text);
            return build(requireField(field), op, LiteralParser.parse(literal));
        }
        throw new QuerySyntaxException("No valid operator found in condition: " + text);
    }

    private static WhereCondition build(String field, String op, Value literal) {
        return switch (op) {
            case "=" -> new WhereCondition(field, WhereCondition.Op.EQ, literal);
            case "!=", "<>" -> new WhereCondition(field, WhereCondition.Op.NE, literal);
            case "<" -> new WhereCondition(field, WhereCondition.Op.LT, literal);
            case "<=" -> new WhereCondition(field, WhereCondition.Op.LTE, literal);
            case ">" -> new WhereCondition(field, WhereCondition.Op.GT, literal);
            case ">=" -> new WhereCondition(field, WhereCondition.Op.GTE, literal);
            case "LIKE" -> new WhereCondition(field, WhereCondition.Op.LIKE, literal);
            case "ILIKE" -> new WhereCondition(field, WhereCondition.Op.ILIKE, literal);
            case "NOT LIKE" -> new WhereCondition(field, WhereCondition.Op.LIKE, literal, true);
            case "NOT ILIKE" -> new WhereCondition(field, WhereCondition.Op.ILIKE, literal, true);
            default -> throw new QuerySyntaxException("Unsupported operator: " + op);
        };
    }

    private static String requireField(String field) {
        if (!FieldPath.isValid(field)) throw new QuerySyntaxException("Invalid field name: " + field);
        return field;
    }

    /**
     * Positions of {@code op} outside quoted literals. Word operators are found through
     * {@link SqlText#findKeyword}, so they must be bounded by whitespace.
     */
    private static List<Integer> occurrences(String text, String op) {
        List<Integer> hits = new ArrayList<>();
        if (Character.isLetter(op.charAt(0))) {
            SqlText.Match m = SqlText.findKeyword(text, op, 0);
            while (m != null) {
                hits.add(m.start());
                m = SqlText.findKeyword(text, op, m.end());
            }
            return hits;
        }
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == quote) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == quote) i++;
                    else quote = 0;
                }
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (text.startsWith(op, i)) {
                hits.add(i);
                i += op.length() - 1;
            }
        }
        return hits;
    }

    // Splits on top-level AND/OR; the last piece carries a null connector
    private static List<Piece> split(String text) {
        List<Piece> out = new ArrayList<>();
        int pos = 0;
        while (true) {
            SqlText.Match and = SqlText.findKeyword(text, "AND", pos);
            SqlText.Match or = SqlText.findKeyword(text, "OR", pos);
            SqlText.Match next;
            if (and == null) next = or;
            else if (or == null) next = and;
            else next = and.start() < or.start() ? and : or;
            if (next == null) {
                out.add(new Piece(text.substring(pos).trim(), null));
                return out;
            }
            String connector = text.substring(next.start(), next.end()).toUpperCase(Locale.ROOT);
            out.add(new Piece(text.substring(pos, next.start()).trim(), connector));
            pos = next.end();
        }
    }

    // "x BETWEEN 1" AND "5" were split apart on the bounds' AND; glue them back together
    private static List<Piece> mergeBetween(List<Piece> pieces) {
        List<Piece> out = new ArrayList<>();
        int i = 0;
        while (i < pieces.size()) {
            Piece p = pieces.get(i);
            SqlText.Match between = SqlText.findKeyword(p.text(), "BETWEEN", 0);
            boolean open = between != null && SqlText.findKeyword(p.text(), "AND", between.end()) == null;
            if (open && "AND".equals(p.connector()) && i + 1 < pieces.size()) {
                Piece upper = pieces.get(i + 1);
                out.add(new Piece(p.text() + " AND " + upper.text(), upper.connector()));
                i += 2;
            } else {
                out.add(p);
                i++;
            }
        }
        return out;
    }
}
