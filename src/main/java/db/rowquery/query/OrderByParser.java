package db.rowquery.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import db.rowquery.exec.AggregateSpec;
import db.rowquery.exec.OrderSpec;

/**
 * ORDER BY list: {@code key [ASC|DESC] (, key [ASC|DESC])*}.
 * A key is a field path, an alias, or an aggregate call such as {@code count(*)}, which is
 * normalized to the column name the aggregate produces ({@code COUNT(*)}).
 */
public class OrderByParser {
    private static final Pattern CALL_PREFIX = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*\\s*\\([^()]*\\))(.*)$", Pattern.DOTALL);

    public List<OrderSpec> parse(String orderByText) {
        try {
            String text = orderByText == null ? "" : orderByText.trim();
            if (text.isEmpty()) throw new QuerySyntaxException("Empty ORDER BY clause");
            List<OrderSpec> keys = new ArrayList<>();
            for (String item : SqlText.splitTopLevel(text, ',', "ORDER BY clause")) {
                if (item.isEmpty()) continue;
                keys.add(parseKey(item));
            }
            if (keys.isEmpty()) throw new QuerySyntaxException("Empty ORDER BY clause");
            return List.copyOf(keys);
        } catch (QuerySyntaxException e) {
            throw new QuerySyntaxException("Error parsing ORDER BY clause: " + e.getMessage(), e);
        }
    }

    private OrderSpec parseKey(String item) {
        Matcher call = CALL_PREFIX.matcher(item);
        if (call.matches()) {
            AggregateSpec agg = SelectParser.aggregateOf(call.group(1));
            return new OrderSpec(agg.defaultAlias(), direction(call.group(2).trim(), item));
        }
        String[] parts = item.split("\\s+");
        if (parts.length > 2) throw new QuerySyntaxException("Invalid ORDER BY specification: " + item);
        String field = parts[0];
        if (!field.equals("*")) {
            try {
                field = SelectParser.fieldName(field);
            } catch (QuerySyntaxException e) {
                throw new QuerySyntaxException("Invalid field name in ORDER BY: " + field);
            }
        }
        return new OrderSpec(field, direction(parts.length == 2 ? parts[1] : "", item));
    }

    private static OrderSpec.Direction direction(String word, String item) {
        if (word.isEmpty()) return OrderSpec.Direction.ASC;
        if (word.split("\\s+").length > 1) throw new QuerySyntaxException("Invalid ORDER BY specification: " + item);
        String upper = word.toUpperCase(Locale.ROOT);
        if (upper.equals("ASC")) return OrderSpec.Direction.ASC;
        if (upper.equals("DESC")) return OrderSpec.Direction.DESC;
        throw new QuerySyntaxException("Invalid sort direction: " + word + ". Use ASC or DESC");
    }
}
