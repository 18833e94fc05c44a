package db.rowquery.exec;

import java.util.List;

/**
 * Leaf operator scanning an in-memory row snapshot in order.
 */
public class ListScanOperator implements Operator {
    private final List<Row> rows;
    private int position;
    private boolean opened;

    public ListScanOperator(List<Row> rows) {
        this.rows = rows;
    }

    @Override
    public void open() {
        position = 0;
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened || position >= rows.size()) return null;
        return rows.get(position++);
    }

    @Override
    public void close() { opened = false; }
}
