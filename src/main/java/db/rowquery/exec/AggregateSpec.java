package db.rowquery.exec;

import java.util.List;

import db.rowquery.value.Value;

/**
 * One aggregate column: a function applied to a field path ("*" for COUNT(*)).
 */
public record AggregateSpec(AggregateFunction function, String field) {

    public Value apply(List<Row> rows) {
        return function.apply(field, rows);
    }

    /** Column name used when no alias is given, e.g. {@code COUNT(*)}. */
    public String defaultAlias() {
        return function.name() + "(" + field + ")";
    }
}
