package db.rowquery.exec;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import db.rowquery.value.Value;

/**
 * Best-effort literal coercion applied before a WHERE comparison, driven by the row value's kind.
 */
public final class Coercions {
    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "on");

    private Coercions() {}

    /**
     * Coerces the literal towards the row value:
     * numeric row + string literal parses the literal as a number (kept as is when it does not parse),
     * boolean row + string literal maps the literal through the truthy set {true, 1, yes, on}.
     * A string row against a numeric literal is left alone; the comparison runs on text forms.
     */
    public static Value coerceLiteral(Value rowValue, Value literal) {
        if (rowValue.isNumeric() && literal.isString()) {
            return parseNumber(literal.asString()).orElse(literal);
        }
        if (rowValue.isBool() && literal.isString()) {
            return Value.ofBool(TRUTHY.contains(literal.asString().toLowerCase(Locale.ROOT)));
        }
        return literal;
    }

    /** True when the comparison should run on text forms rather than natural order. */
    public static boolean comparesAsText(Value rowValue, Value literal) {
        return rowValue.isString() && literal.isNumeric();
    }

    /**
     * Parses numeric text: FLOAT when it contains '.' or an exponent marker, INT otherwise.
     */
    public static Optional<Value> parseNumber(String text) {
        String s = text.trim();
        if (s.isEmpty()) return Optional.empty();
        try {
            if (s.contains(".") || s.toLowerCase(Locale.ROOT).contains("e")) {
                return Optional.of(Value.ofFloat(parseFloat(s)));
            }
            return Optional.of(Value.ofInt(Long.parseLong(s)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Converts a value into a number for aggregation; empty when it has no numeric reading. */
    public static Optional<Double> toNumber(Value v) {
        return switch (v.kind()) {
            case INT, FLOAT -> Optional.of(v.asDouble());
            case BOOL -> Optional.of(v.asBool() ? 1.0 : 0.0);
            case STRING -> parseNumber(v.asString()).map(Value::asDouble);
            default -> Optional.empty();
        };
    }

    private static double parseFloat(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        // Double.parseDouble accepts "1d"/"1f" suffixes and hex floats, plain decimals only here
        if (lower.endsWith("d") || lower.endsWith("f") || lower.startsWith("0x") || lower.startsWith("-0x")) {
            throw new NumberFormatException("Not a decimal number: " + s);
        }
        return Double.parseDouble(s);
    }
}
