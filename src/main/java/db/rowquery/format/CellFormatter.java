package db.rowquery.format;

import java.math.BigDecimal;
import java.math.RoundingMode;

import db.rowquery.value.Value;

/**
 * Cell text shared by the CSV and table formats.
 * Null is empty, floats are rounded to six decimals, sequences and maps render as JSON.
 */
public final class CellFormatter {
    private static final int FLOAT_SCALE = 6;

    private CellFormatter() {}

    public static String format(Value v) {
        if (v == null || v.isNull()) return "";
        if (v.kind() == Value.Kind.FLOAT) return Value.ofFloat(round(v.asDouble())).asText();
        return v.asText();
    }

    // half-even on the exact binary value of d
    static double round(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return d;
        return new BigDecimal(d).setScale(FLOAT_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}
