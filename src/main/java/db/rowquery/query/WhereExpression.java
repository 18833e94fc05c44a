package db.rowquery.query;

import java.util.List;

import db.rowquery.exec.CompoundPredicate;
import db.rowquery.exec.Predicate;
import db.rowquery.exec.Row;

/**
 * WHERE clause as a linear sequence of conditions combined by AND/OR.
 * There is no precedence between AND and OR: the chain folds left to right, so
 * {@code a OR b AND c} evaluates as {@code (a OR b) AND c}.
 * connectors.size() == conditions.size() - 1; an empty expression accepts every row.
 */
public class WhereExpression implements Predicate {
    private static final WhereExpression EMPTY = new WhereExpression(List.of(), List.of());

    private final List<WhereCondition> conditions;
    private final List<String> connectors; // AND/OR between conditions
    private final Predicate compiled;

    public WhereExpression(List<WhereCondition> conditions, List<String> connectors) {
        if (!conditions.isEmpty() && connectors.size() != conditions.size() - 1) {
            throw new IllegalArgumentException("connectors mismatch");
        }
        if (conditions.isEmpty() && !connectors.isEmpty()) throw new IllegalArgumentException("connectors without conditions");
        this.conditions = List.copyOf(conditions);
        this.connectors = List.copyOf(connectors);
        this.compiled = CompoundPredicate.foldLeft(this.conditions, this.connectors);
    }

    public static WhereExpression empty() { return EMPTY; }

    public List<WhereCondition> conditions() { return conditions; }
    public List<String> connectors() { return connectors; }
    public boolean isEmpty() { return conditions.isEmpty(); }

    public boolean evaluate(Row row) { return compiled.test(row); }

    @Override
    public boolean test(Row row) { return evaluate(row); }

    @Override
    public String toString() { return isEmpty() ? "TRUE" : compiled.toString(); }
}
