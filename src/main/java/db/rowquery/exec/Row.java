package db.rowquery.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import db.rowquery.value.FieldPath;
import db.rowquery.value.Value;

/**
 * Row is the execution pipeline unit: an ordered, read-only map of field name to Value.
 * Key order is the order the provider (or an operator) produced the fields in and drives
 * the column order of formatted output.
 */
public class Row {
    private final Map<String, Value> values;

    private Row(Map<String, Value> values) {
        this.values = values;
    }

    public static Row of(Map<String, Value> values) {
        Map<String, Value> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : values.entrySet()) {
            copy.put(e.getKey(), e.getValue() == null ? Value.NULL : e.getValue());
        }
        return new Row(Collections.unmodifiableMap(copy));
    }

    /** Convenience for plain Java data, see {@link Value#of(Object)}. */
    public static Row fromJava(Map<String, ?> data) {
        Map<String, Value> converted = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : data.entrySet()) converted.put(e.getKey(), Value.of(e.getValue()));
        return new Row(Collections.unmodifiableMap(converted));
    }

    public Map<String, Value> values() { return values; }
    public Set<String> fieldNames() { return values.keySet(); }

    /** Direct top-level lookup; null when the field is absent. */
    public Value get(String field) { return values.get(field); }

    public Optional<Value> resolve(String path) { return FieldPath.resolve(values, path); }

    public Value resolveOrNull(String path) { return FieldPath.resolveOrNull(values, path); }

    public Map<String, Object> toJava() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : values.entrySet()) out.put(e.getKey(), e.getValue().toJava());
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
