package db.rowquery.exec;

import java.util.List;

/**
 * CompoundPredicate composes predicates with logical AND / OR.
 * AND and OR are binary so that a WHERE chain folds strictly left to right:
 * {@code a OR b AND c} becomes {@code (a OR b) AND c}, with no precedence between the two.
 */
public final class CompoundPredicate implements Predicate {
    private enum Type { AND, OR }

    private final Type type;
    private final Predicate left;
    private final Predicate right;

    private CompoundPredicate(Type type, Predicate left, Predicate right) {
        this.type = type;
        this.left = left;
        this.right = right;
    }

    public static CompoundPredicate and(Predicate left, Predicate right) {
        return new CompoundPredicate(Type.AND, left, right);
    }

    public static CompoundPredicate or(Predicate left, Predicate right) {
        return new CompoundPredicate(Type.OR, left, right);
    }

    /**
     * Folds {@code operands} left to right with {@code connectors} ("AND"/"OR"),
     * connectors.size() == operands.size() - 1.
     */
    public static Predicate foldLeft(List<? extends Predicate> operands, List<String> connectors) {
        if (operands.isEmpty()) return row -> true;
        if (connectors.size() != operands.size() - 1) {
            throw new IllegalArgumentException("connectors mismatch: " + connectors.size() + " for " + operands.size() + " operands");
        }
        Predicate acc = operands.get(0);
        for (int i = 0; i < connectors.size(); i++) {
            Predicate next = operands.get(i + 1);
            acc = switch (connectors.get(i)) {
                case "AND" -> and(acc, next);
                case "OR" -> or(acc, next);
                default -> throw new IllegalArgumentException("Unknown connector: " + connectors.get(i));
            };
        }
        return acc;
    }

    @Override
    public boolean test(Row row) {
        return switch (type) {
            case AND -> left.test(row) && right.test(row);
            case OR -> left.test(row) || right.test(row);
        };
    }

    // For debugging
    @Override
    public String toString() {
        return switch (type) {
            case AND -> "(" + left + " AND " + right + ")";
            case OR -> "(" + left + " OR " + right + ")";
        };
    }
}
