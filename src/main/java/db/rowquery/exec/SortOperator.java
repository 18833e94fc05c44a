package db.rowquery.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Blocking stable sort over all child rows.
 */
public class SortOperator implements Operator {
    private final Operator child;
    private final Comparator<Row> comparator;
    private List<Row> sorted;
    private int position;

    public SortOperator(Operator child, Comparator<Row> comparator) {
        this.child = child;
        this.comparator = comparator;
    }

    public static SortOperator orderBy(Operator child, List<OrderSpec> keys) {
        return new SortOperator(child, OrderSpec.comparator(keys));
    }

    @Override
    public void open() {
        child.open();
        sorted = new ArrayList<>();
        Row r;
        while ((r = child.next()) != null) sorted.add(r);
        sorted.sort(comparator); // List.sort is stable
        position = 0;
    }

    @Override
    public Row next() {
        if (sorted == null || position >= sorted.size()) return null;
        return sorted.get(position++);
    }

    @Override
    public void close() {
        child.close();
        sorted = null;
    }
}
