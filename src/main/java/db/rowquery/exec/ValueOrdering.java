package db.rowquery.exec;

import java.util.List;
import java.util.OptionalInt;

import db.rowquery.value.Value;

/**
 * Ordering rules shared by comparison operators, BETWEEN and ORDER BY.
 * Numbers (and booleans as 0/1) order numerically, strings lexicographically and sequences
 * element by element. Any other pairing has no natural order.
 */
public final class ValueOrdering {
    private ValueOrdering() {}

    /** Natural comparison, or empty when the two kinds cannot be ordered against each other. */
    public static OptionalInt compareNatural(Value a, Value b) {
        if (isNumberLike(a) && isNumberLike(b)) {
            if (a.kind() == Value.Kind.INT && b.kind() == Value.Kind.INT) {
                return OptionalInt.of(Long.compare(a.asLong(), b.asLong()));
            }
            return OptionalInt.of(Double.compare(numeric(a), numeric(b)));
        }
        if (a.isString() && b.isString()) {
            return OptionalInt.of(Integer.signum(a.asString().compareTo(b.asString())));
        }
        if (a.isSequence() && b.isSequence()) {
            List<Value> left = a.asSequence();
            List<Value> right = b.asSequence();
            int n = Math.min(left.size(), right.size());
            for (int i = 0; i < n; i++) {
                if (left.get(i).equals(right.get(i))) continue;
                return compareNatural(left.get(i), right.get(i));
            }
            return OptionalInt.of(Integer.compare(left.size(), right.size()));
        }
        return OptionalInt.empty();
    }

    /** Natural comparison falling back to the text forms of both values. */
    public static int compareLenient(Value a, Value b) {
        OptionalInt natural = compareNatural(a, b);
        if (natural.isPresent()) return natural.getAsInt();
        return Integer.signum(a.asText().compareTo(b.asText()));
    }

    /**
     * Equality as used by WHERE: {@link Value#equals} plus booleans matching the numbers 0 and 1.
     */
    public static boolean sameValue(Value a, Value b) {
        if (a.equals(b)) return true;
        if (a.isBool() == b.isBool()) return false;
        return isNumberLike(a) && isNumberLike(b) && numeric(a) == numeric(b);
    }

    static boolean isNumberLike(Value v) {
        return v.isNumeric() || v.isBool();
    }

    static double numeric(Value v) {
        if (v.isBool()) return v.asBool() ? 1.0 : 0.0;
        return v.asDouble();
    }
}
