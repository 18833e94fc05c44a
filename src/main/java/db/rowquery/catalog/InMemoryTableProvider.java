package db.rowquery.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import db.rowquery.exec.Row;
import db.rowquery.value.Value;

/**
 * Tables held in memory, in registration order.
 * Always exposes the meta-table {@value #META_TABLE} listing every table with its description.
 */
public class InMemoryTableProvider implements TableProvider {
    public static final String META_TABLE = "tables";
    static final String META_DESCRIPTION = "Meta-table listing all available tables";

    private record Table(String description, List<Row> rows) {}

    private final Map<String, Table> tables = new LinkedHashMap<>();

    public InMemoryTableProvider registerTable(String name, String description, List<Row> rows) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("table name must not be blank");
        if (name.equals(META_TABLE)) throw new IllegalArgumentException("Reserved table name: " + META_TABLE);
        tables.put(name, new Table(description == null ? "" : description, List.copyOf(rows)));
        return this;
    }

    public InMemoryTableProvider registerTable(String name, List<Row> rows) {
        return registerTable(name, "", rows);
    }

    @Override
    public boolean hasTable(String name) {
        return META_TABLE.equals(name) || tables.containsKey(name);
    }

    @Override
    public Set<String> tableNames() {
        Set<String> names = new LinkedHashSet<>(tables.keySet());
        names.add(META_TABLE);
        return Collections.unmodifiableSet(names);
    }

    @Override
    public List<Row> rows(String name) {
        if (META_TABLE.equals(name)) return metaRows();
        Table t = tables.get(name);
        if (t == null) throw new IllegalArgumentException("Unknown table: " + name);
        return new ArrayList<>(t.rows());
    }

    @Override
    public String description(String name) {
        if (META_TABLE.equals(name)) return META_DESCRIPTION;
        Table t = tables.get(name);
        return t == null ? "" : t.description();
    }

    private List<Row> metaRows() {
        List<Row> out = new ArrayList<>(tables.size() + 1);
        for (String name : tableNames()) {
            Map<String, Value> values = new LinkedHashMap<>();
            values.put("table", Value.ofString(name));
            values.put("description", Value.ofString(description(name)));
            out.add(Row.of(values));
        }
        return out;
    }
}
