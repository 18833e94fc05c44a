package db.rowquery.query;

import java.util.List;
import java.util.Map;

import db.rowquery.exec.AggregateSpec;

/**
 * Parsed projection list.
 * fields are the output column names in order: plain paths, aliases, or aggregate aliases
 * such as {@code COUNT(*)}. aliases maps every AS name to its source expression.
 */
public record SelectClause(List<String> fields, boolean distinct, Map<String, AggregateSpec> aggregates,
                           Map<String, String> aliases) {

    public boolean isSelectAll() {
        return fields.size() == 1 && fields.get(0).equals("*");
    }

    public boolean hasAggregates() {
        return !aggregates.isEmpty();
    }

    /** Source path of a non-aggregate alias, or the field itself. */
    public String sourceOf(String field) {
        if (aggregates.containsKey(field)) return field;
        return aliases.getOrDefault(field, field);
    }
}
