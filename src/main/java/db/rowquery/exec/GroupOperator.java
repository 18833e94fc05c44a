package db.rowquery.exec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.rowquery.value.Value;

/**
 * Blocking operator partitioning child rows by the tuple of group-field values.
 * Emits one row per group in first-seen order: the group fields followed by one column
 * per aggregate alias. With no group fields all rows form a single group, so bare
 * aggregates over a non-empty input produce exactly one row and an empty input none.
 */
public class GroupOperator implements Operator {
    private final Operator child;
    private final List<String> groupFields;
    private final Map<String, AggregateSpec> aggregates;
    private List<Row> output;
    private int position;

    public GroupOperator(Operator child, List<String> groupFields, Map<String, AggregateSpec> aggregates) {
        this.child = child;
        this.groupFields = List.copyOf(groupFields);
        this.aggregates = new LinkedHashMap<>(aggregates);
    }

    @Override
    public void open() {
        child.open();
        Map<List<Value>, List<Row>> groups = new LinkedHashMap<>();
        Row r;
        while ((r = child.next()) != null) {
            List<Value> key = new ArrayList<>(groupFields.size());
            for (String f : groupFields) key.add(r.resolveOrNull(f));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }
        output = new ArrayList<>(groups.size());
        for (Map.Entry<List<Value>, List<Row>> g : groups.entrySet()) {
            Map<String, Value> values = new LinkedHashMap<>();
            for (int i = 0; i < groupFields.size(); i++) values.put(groupFields.get(i), g.getKey().get(i));
            for (Map.Entry<String, AggregateSpec> a : aggregates.entrySet()) {
                values.put(a.getKey(), a.getValue().apply(g.getValue()));
            }
            output.add(Row.of(values));
        }
        position = 0;
    }

    @Override
    public Row next() {
        if (output == null || position >= output.size()) return null;
        return output.get(position++);
    }

    @Override
    public void close() {
        child.close();
        output = null;
    }
}
