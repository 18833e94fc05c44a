package db.rowquery.exec;

/**
 * Passes through at most {@code limit} rows; a negative limit passes everything.
 */
public class LimitOperator implements Operator {
    private final Operator child;
    private final int limit;
    private int emitted;

    public LimitOperator(Operator child, int limit) {
        this.child = child;
        this.limit = limit;
    }

    @Override
    public void open() {
        emitted = 0;
        child.open();
    }

    @Override
    public Row next() {
        if (limit >= 0 && emitted >= limit) return null;
        Row r = child.next();
        if (r != null) emitted++;
        return r;
    }

    @Override
    public void close() { child.close(); }
}
