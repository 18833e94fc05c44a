package db.rowquery.query;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import db.rowquery.exec.Coercions;
import db.rowquery.exec.LikePattern;
import db.rowquery.exec.Predicate;
import db.rowquery.exec.Row;
import db.rowquery.exec.ValueOrdering;
import db.rowquery.value.Value;

/**
 * Single WHERE condition: field path, operator and literal.
 * IN carries its candidates and BETWEEN its two bounds as a sequence literal.
 * negated is set by the NOT IN / NOT BETWEEN / NOT LIKE / NOT ILIKE forms and inverts the result.
 */
public class WhereCondition implements Predicate {
    public enum Op {
        EQ("="), NE("!="), LT("<"), LTE("<="), GT(">"), GTE(">="),
        LIKE("LIKE"), ILIKE("ILIKE"), IN("IN"), BETWEEN("BETWEEN"), IS("IS"), IS_NOT("IS NOT");

        private final String symbol;

        Op(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }

        // IS, IN and BETWEEN compare the row value against the literal as parsed
        boolean coercesLiteral() {
            return this != IS && this != IS_NOT && this != IN && this != BETWEEN;
        }
    }

    private final String fieldPath;
    private final Op op;
    private final Value literal;
    private final boolean negated;
    private final LikePattern likePattern; // LIKE / ILIKE only

    public WhereCondition(String fieldPath, Op op, Value literal) {
        this(fieldPath, op, literal, false);
    }

    public WhereCondition(String fieldPath, Op op, Value literal, boolean negated) {
        if (op == Op.IN && !literal.isSequence()) throw new IllegalArgumentException("IN requires a list literal");
        if (op == Op.BETWEEN && (!literal.isSequence() || literal.asSequence().size() != 2)) {
            throw new IllegalArgumentException("BETWEEN requires exactly two bounds");
        }
        this.fieldPath = fieldPath;
        this.op = op;
        this.literal = literal;
        this.negated = negated;
        this.likePattern = (op == Op.LIKE || op == Op.ILIKE) ? LikePattern.compile(literal.asText()) : null;
    }

    public String fieldPath() { return fieldPath; }
    public Op op() { return op; }
    public Value literal() { return literal; }
    public boolean negated() { return negated; }

    /**
     * A field missing from the row counts as NULL for IS / IS NOT and makes every other
     * operator false, before negation is applied.
     */
    public boolean evaluate(Row row) {
        Optional<Value> resolved = row.resolve(fieldPath);
        Value item;
        if (resolved.isPresent()) {
            item = resolved.get();
        } else if (op == Op.IS || op == Op.IS_NOT) {
            item = Value.NULL;
        } else {
            return negated;
        }
        boolean result = compare(item);
        return negated ? !result : result;
    }

    @Override
    public boolean test(Row row) { return evaluate(row); }

    private boolean compare(Value item) {
        Value lit = op.coercesLiteral() ? Coercions.coerceLiteral(item, literal) : literal;
        boolean asText = op.coercesLiteral() && Coercions.comparesAsText(item, lit);
        return switch (op) {
            case EQ -> equal(item, lit, asText);
            case NE -> !equal(item, lit, asText);
            case LT -> order(item, lit, asText) < 0;
            case LTE -> order(item, lit, asText) <= 0;
            case GT -> order(item, lit, asText) > 0;
            case GTE -> order(item, lit, asText) >= 0;
            case LIKE, ILIKE -> likePattern.matches(item.asText());
            case IN -> lit.asSequence().stream().anyMatch(candidate -> ValueOrdering.sameValue(item, candidate));
            case IS -> lit.isNull() ? item.isNull() : item.equals(lit);
            case IS_NOT -> lit.isNull() ? !item.isNull() : !item.equals(lit);
            case BETWEEN -> between(item, lit.asSequence());
        };
    }

    private static boolean equal(Value item, Value lit, boolean asText) {
        return asText ? item.asText().equals(lit.asText()) : ValueOrdering.sameValue(item, lit);
    }

    private static int order(Value item, Value lit, boolean asText) {
        if (asText) return Integer.signum(item.asText().compareTo(lit.asText()));
        return ValueOrdering.compareLenient(item, lit);
    }

    // Inclusive bounds; when either bound cannot be ordered against the value all three compare as text
    private static boolean between(Value item, List<Value> bounds) {
        Value low = bounds.get(0);
        Value high = bounds.get(1);
        OptionalInt lowCmp = ValueOrdering.compareNatural(low, item);
        OptionalInt highCmp = ValueOrdering.compareNatural(item, high);
        if (lowCmp.isPresent() && highCmp.isPresent()) {
            return lowCmp.getAsInt() <= 0 && highCmp.getAsInt() <= 0;
        }
        String text = item.asText();
        return low.asText().compareTo(text) <= 0 && text.compareTo(high.asText()) <= 0;
    }

    @Override
    public String toString() {
        return (negated ? "NOT " : "") + fieldPath + " " + op.symbol() + " " + literal;
    }
}
