package db.rowquery.value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dynamic field value: null, boolean, integer, float, string, sequence or string-keyed map.
 * Every field of a row and every literal of a query is a Value. Instances are immutable;
 * sequences and maps are copied on construction and exposed read-only.
 *
 * Equality follows payload equality per kind, except that INT and FLOAT compare numerically
 * (1 equals 1.0).
 */
public final class Value {
    public enum Kind { NULL, BOOL, INT, FLOAT, STRING, SEQUENCE, MAP }

    public static final Value NULL = new Value(Kind.NULL, null);
    public static final Value TRUE = new Value(Kind.BOOL, Boolean.TRUE);
    public static final Value FALSE = new Value(Kind.BOOL, Boolean.FALSE);

    private final Kind kind;
    private final Object payload;
    private final List<Value> items;          // SEQUENCE only
    private final Map<String, Value> entries; // MAP only

    private Value(Kind kind, Object payload) {
        this(kind, payload, null, null);
    }

    private Value(Kind kind, Object payload, List<Value> items, Map<String, Value> entries) {
        this.kind = kind;
        this.payload = payload;
        this.items = items;
        this.entries = entries;
    }

    public static Value ofBool(boolean b) { return b ? TRUE : FALSE; }
    public static Value ofInt(long v) { return new Value(Kind.INT, v); }
    public static Value ofFloat(double v) { return new Value(Kind.FLOAT, v); }

    public static Value ofString(String s) {
        if (s == null) return NULL;
        return new Value(Kind.STRING, s);
    }

    public static Value ofSequence(List<Value> items) {
        List<Value> copy = new ArrayList<>(items.size());
        for (Value v : items) copy.add(v == null ? NULL : v);
        List<Value> view = Collections.unmodifiableList(copy);
        return new Value(Kind.SEQUENCE, view, view, null);
    }

    public static Value ofMap(Map<String, Value> entries) {
        Map<String, Value> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : entries.entrySet()) {
            copy.put(e.getKey(), e.getValue() == null ? NULL : e.getValue());
        }
        Map<String, Value> view = Collections.unmodifiableMap(copy);
        return new Value(Kind.MAP, view, null, view);
    }

    /**
     * Wraps a plain Java object: null, Boolean, integral and floating numbers, CharSequence,
     * List, Map (keys stringified) or an existing Value.
     */
    public static Value of(Object o) {
        if (o == null) return NULL;
        if (o instanceof Value v) return v;
        if (o instanceof Boolean b) return ofBool(b);
        if (o instanceof Integer || o instanceof Long || o instanceof Short || o instanceof Byte) {
            return ofInt(((Number) o).longValue());
        }
        if (o instanceof Number n) return ofFloat(n.doubleValue());
        if (o instanceof CharSequence cs) return ofString(cs.toString());
        if (o instanceof List<?> list) {
            List<Value> items = new ArrayList<>(list.size());
            for (Object item : list) items.add(of(item));
            return ofSequence(items);
        }
        if (o instanceof Map<?, ?> map) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) entries.put(String.valueOf(e.getKey()), of(e.getValue()));
            return ofMap(entries);
        }
        throw new IllegalArgumentException("Unsupported value type: " + o.getClass().getName());
    }

    public Kind kind() { return kind; }
    public boolean isNull() { return kind == Kind.NULL; }
    public boolean isNumeric() { return kind == Kind.INT || kind == Kind.FLOAT; }
    public boolean isString() { return kind == Kind.STRING; }
    public boolean isBool() { return kind == Kind.BOOL; }
    public boolean isSequence() { return kind == Kind.SEQUENCE; }
    public boolean isMap() { return kind == Kind.MAP; }

    public boolean asBool() {
        requireKind(Kind.BOOL);
        return (Boolean) payload;
    }

    public long asLong() {
        if (kind == Kind.FLOAT) return (long) (double) (Double) payload;
        requireKind(Kind.INT);
        return (Long) payload;
    }

    public double asDouble() {
        if (kind == Kind.INT) return (Long) payload;
        requireKind(Kind.FLOAT);
        return (Double) payload;
    }

    public String asString() {
        requireKind(Kind.STRING);
        return (String) payload;
    }

    public List<Value> asSequence() {
        requireKind(Kind.SEQUENCE);
        return items;
    }

    public Map<String, Value> asMap() {
        requireKind(Kind.MAP);
        return entries;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) throw new IllegalStateException("Expected " + expected + " value but was " + kind);
    }

    /** Unwraps into plain Java objects (Long, Double, String, Boolean, List, LinkedHashMap, null). */
    public Object toJava() {
        return switch (kind) {
            case NULL -> null;
            case BOOL, INT, FLOAT, STRING -> payload;
            case SEQUENCE -> {
                List<Object> out = new ArrayList<>();
                for (Value v : asSequence()) out.add(v.toJava());
                yield out;
            }
            case MAP -> {
                Map<String, Object> out = new LinkedHashMap<>();
                for (Map.Entry<String, Value> e : asMap().entrySet()) out.put(e.getKey(), e.getValue().toJava());
                yield out;
            }
        };
    }

    /**
     * Plain text form used by string comparisons and LIKE matching.
     * Floats always carry a fractional part; sequences and maps render as compact JSON.
     */
    public String asText() {
        return switch (kind) {
            case NULL -> "null";
            case BOOL, INT, STRING -> String.valueOf(payload);
            case FLOAT -> floatText((Double) payload);
            case SEQUENCE, MAP -> Json.compact(this);
        };
    }

    static String floatText(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        String plain = BigDecimal.valueOf(d).toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value other)) return false;
        if (isNumeric() && other.isNumeric()) {
            if (kind == Kind.INT && other.kind == Kind.INT) return payload.equals(other.payload);
            return asDouble() == other.asDouble();
        }
        return kind == other.kind && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        if (kind == Kind.INT) return Long.hashCode((Long) payload);
        if (kind == Kind.FLOAT) {
            double d = (Double) payload;
            if (d == Math.rint(d) && Math.abs(d) < 9.2e18) return Long.hashCode((long) d);
            return Double.hashCode(d);
        }
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        return kind == Kind.STRING ? "'" + payload + "'" : asText();
    }
}
