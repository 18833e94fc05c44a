package db.rowquery.exec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.rowquery.value.Value;

/**
 * Projection operator: reshapes each child row to the requested output columns.
 * Each column resolves a (possibly dotted) source path; unresolved paths yield NULL.
 */
public class ProjectionOperator implements Operator {
    /** Output column name and the path it is read from. */
    public record Column(String name, String sourcePath) {}

    private final Operator child;
    private final List<Column> columns;

    public ProjectionOperator(Operator child, List<Column> columns) {
        if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("columns must be non-empty");
        this.child = child;
        this.columns = List.copyOf(columns);
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        Map<String, Value> projected = new LinkedHashMap<>();
        for (Column c : columns) {
            projected.put(c.name(), r.resolveOrNull(c.sourcePath()));
        }
        return Row.of(projected);
    }

    @Override
    public void close() { child.close(); }
}
