package db.rowquery.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import db.rowquery.exec.AggregateFunction;
import db.rowquery.exec.AggregateSpec;
import db.rowquery.value.FieldPath;

/**
 * SELECT list parser:
 *   [DISTINCT] item (, item)*
 *   item := (path | "quoted name" | * | FUNC(path|*)) [AS alias]
 */
public class SelectParser {
    private static final Pattern ALIAS = Pattern.compile("^(.+?)\\s+AS\\s+([A-Za-z_][A-Za-z0-9_]*)$",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern CALL = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*\\(\\s*(.*?)\\s*\\)$", Pattern.DOTALL);

    public SelectClause parse(String selectText) {
        try {
            return parseList(selectText == null ? "" : selectText.trim());
        } catch (QuerySyntaxException e) {
            throw new QuerySyntaxException("Error parsing SELECT clause: " + e.getMessage(), e);
        }
    }

    private SelectClause parseList(String text) {
        if (text.isEmpty()) throw new QuerySyntaxException("Empty SELECT clause");
        boolean distinct = false;
        SqlText.Match kw = SqlText.findKeyword(text, "DISTINCT", 0);
        if (kw != null && kw.start() == 0) {
            distinct = true;
            text = text.substring(kw.end()).trim();
            if (text.isEmpty()) throw new QuerySyntaxException("Empty field list after DISTINCT");
        }

        List<String> fields = new ArrayList<>();
        Map<String, AggregateSpec> aggregates = new LinkedHashMap<>();
        Map<String, String> aliases = new LinkedHashMap<>();
        for (String item : SqlText.splitTopLevel(text, ',', "SELECT clause")) {
            if (item.isEmpty()) continue;
            Matcher alias = ALIAS.matcher(item);
            if (alias.matches()) {
                String expression = alias.group(1).trim();
                String name = alias.group(2);
                AggregateSpec agg = aggregateOf(expression);
                if (agg != null) {
                    aggregates.put(name, agg);
                    aliases.put(name, agg.defaultAlias());
                } else {
                    aliases.put(name, fieldName(expression));
                }
                fields.add(name);
                continue;
            }
            AggregateSpec agg = aggregateOf(item);
            if (agg != null) {
                aggregates.put(agg.defaultAlias(), agg);
                fields.add(agg.defaultAlias());
            } else {
                fields.add(fieldName(item));
            }
        }
        if (fields.isEmpty()) throw new QuerySyntaxException("No valid fields found in SELECT clause");
        return new SelectClause(Collections.unmodifiableList(fields), distinct,
            Collections.unmodifiableMap(aggregates), Collections.unmodifiableMap(aliases));
    }

    /**
     * Parses {@code FUNC(arg)} into an aggregate, normalizing the function name to upper case.
     * Returns null when the expression is not a call at all.
     */
    static AggregateSpec aggregateOf(String expression) {
        Matcher call = CALL.matcher(expression.trim());
        if (!call.matches()) return null;
        AggregateFunction function = AggregateFunction.of(call.group(1));
        String arg = call.group(2);
        if (arg.equals("*")) {
            if (!function.acceptsStar()) throw new QuerySyntaxException("Function " + function + " cannot be used with *");
        } else if (!FieldPath.isValid(arg)) {
            throw new QuerySyntaxException("Invalid field name in " + function + ": " + (arg.isEmpty() ? "(empty)" : arg));
        }
        return new AggregateSpec(function, arg);
    }

    /** A path, '*', or a quoted name without embedded quotes (returned unquoted). */
    static String fieldName(String item) {
        if (item.equals("*") || FieldPath.isValid(item)) return item;
        if (SqlText.isQuoted(item)) {
            String inner = item.substring(1, item.length() - 1);
            if (!inner.isEmpty() && inner.indexOf(item.charAt(0)) < 0) return inner;
        }
        throw new QuerySyntaxException("Invalid field name: " + item);
    }
}
