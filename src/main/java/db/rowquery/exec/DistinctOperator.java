package db.rowquery.exec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import db.rowquery.value.Value;

/**
 * Drops rows whose key was already seen, keeping the first occurrence.
 * The key is the whole row when no fields are given (SELECT *), otherwise the tuple of
 * the selected field values.
 */
public class DistinctOperator implements Operator {
    private final Operator child;
    private final List<String> fields; // empty => whole row
    private final Set<Object> seen = new HashSet<>();

    public DistinctOperator(Operator child, List<String> fields) {
        this.child = child;
        this.fields = List.copyOf(fields);
    }

    @Override
    public void open() {
        seen.clear();
        child.open();
    }

    @Override
    public Row next() {
        Row r;
        while ((r = child.next()) != null) {
            if (seen.add(keyOf(r))) return r;
        }
        return null;
    }

    private Object keyOf(Row r) {
        if (fields.isEmpty()) return r;
        List<Value> key = new ArrayList<>(fields.size());
        for (String f : fields) key.add(r.resolveOrNull(f));
        return key;
    }

    @Override
    public void close() {
        child.close();
        seen.clear();
    }
}
