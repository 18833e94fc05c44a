package db.rowquery.exec;

import java.util.Comparator;
import java.util.List;

import db.rowquery.value.Value;

/**
 * One ORDER BY key: a field path and a direction.
 */
public record OrderSpec(String field, Direction direction) {
    public enum Direction { ASC, DESC }

    /**
     * Row comparator for this key. Nulls (and missing fields) sort last in both directions;
     * the direction only reverses the ordering of non-null values.
     */
    public Comparator<Row> comparator() {
        Comparator<Value> values = OrderSpec::compareForSort;
        if (direction == Direction.DESC) values = values.reversed();
        return Comparator.comparing((Row r) -> nullToAbsent(r.resolveOrNull(field)), Comparator.nullsLast(values));
    }

    /** Chains the keys of a multi-field ORDER BY; the first key is the most significant. */
    public static Comparator<Row> comparator(List<OrderSpec> keys) {
        Comparator<Row> result = null;
        for (OrderSpec key : keys) {
            result = result == null ? key.comparator() : result.thenComparing(key.comparator());
        }
        return result == null ? (a, b) -> 0 : result;
    }

    private static Value nullToAbsent(Value v) {
        return v.isNull() ? null : v;
    }

    private static int compareForSort(Value a, Value b) {
        return ValueOrdering.compareLenient(flatten(a), flatten(b));
    }

    // sequences and maps sort by their text form
    private static Value flatten(Value v) {
        return v.isSequence() || v.isMap() ? Value.ofString(v.asText()) : v;
    }
}
