package db.rowquery.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import db.rowquery.query.QuerySyntaxException;
import db.rowquery.value.Value;

/**
 * Aggregate functions over a field path of a row group.
 * COUNT counts rows; the others work on the numeric sample of the field, skipping nulls and
 * values without a numeric reading, and yield NULL for an empty sample.
 */
public enum AggregateFunction {
    COUNT, SUM, AVG, MIN, MAX, STDDEV, VARIANCE;

    public static AggregateFunction of(String name) {
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (AggregateFunction f : values()) {
            if (f.name().equals(upper)) return f;
        }
        throw new QuerySyntaxException("Unsupported aggregate function: " + name);
    }

    /** Only COUNT accepts '*'. */
    public boolean acceptsStar() { return this == COUNT; }

    public Value apply(String field, List<Row> rows) {
        if (this == COUNT) {
            if (field.equals("*")) return Value.ofInt(rows.size());
            long n = 0;
            for (Row r : rows) if (!r.resolveOrNull(field).isNull()) n++;
            return Value.ofInt(n);
        }
        List<Double> sample = numericSample(field, rows);
        if (sample.isEmpty()) return Value.NULL;
        return switch (this) {
            case SUM -> Value.ofFloat(sum(sample));
            case AVG -> Value.ofFloat(sum(sample) / sample.size());
            case MIN -> {
                double m = sample.get(0);
                for (double d : sample) if (d < m) m = d;
                yield Value.ofFloat(m);
            }
            case MAX -> {
                double m = sample.get(0);
                for (double d : sample) if (d > m) m = d;
                yield Value.ofFloat(m);
            }
            case VARIANCE -> Value.ofFloat(variance(sample));
            case STDDEV -> Value.ofFloat(Math.sqrt(variance(sample)));
            case COUNT -> throw new IllegalStateException("COUNT handled above");
        };
    }

    private static List<Double> numericSample(String field, List<Row> rows) {
        List<Double> out = new ArrayList<>();
        for (Row r : rows) {
            Value v = r.resolveOrNull(field);
            if (v.isNull()) continue;
            Optional<Double> d = Coercions.toNumber(v);
            d.ifPresent(out::add);
        }
        return out;
    }

    private static double sum(List<Double> sample) {
        double acc = 0.0;
        for (double d : sample) acc += d;
        return acc;
    }

    // Sample variance (n-1 denominator); 0.0 below two values
    private static double variance(List<Double> sample) {
        int n = sample.size();
        if (n < 2) return 0.0;
        double mean = sum(sample) / n;
        double acc = 0.0;
        for (double d : sample) {
            double diff = d - mean;
            acc += diff * diff;
        }
        return acc / (n - 1);
    }
}
