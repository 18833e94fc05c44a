package db.rowquery.exec;

/**
 * Row filter evaluated by {@link FilterOperator}.
 */
public interface Predicate {
    boolean test(Row row);
}
