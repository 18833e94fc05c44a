package db.rowquery.exec;

/**
 * Operator that keeps the child rows accepted by a WHERE predicate.
 * Pulls rows until one matches or the child is exhausted; counts rejected rows for diagnostics.
 */
public class FilterOperator implements Operator {
    private final Operator child;
    private final Predicate predicate;
    private int rejected;

    public FilterOperator(Operator child, Predicate predicate) {
        this.child = child;
        this.predicate = predicate;
    }

    @Override
    public void open() {
        rejected = 0;
        child.open();
    }

    @Override
    public Row next() {
        Row r;
        while ((r = child.next()) != null) {
            if (predicate.test(r)) return r;
            rejected++;
        }
        return null;
    }

    @Override
    public void close() { child.close(); }

    public int rejected() { return rejected; }
}
