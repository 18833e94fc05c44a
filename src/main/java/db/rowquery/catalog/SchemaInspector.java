package db.rowquery.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.rowquery.exec.Row;
import db.rowquery.format.FormatFactory;
import db.rowquery.value.Json;
import db.rowquery.value.Value;

/**
 * Infers table schemas from the rows a provider returns. Tables are schemaless, so the
 * description is whatever the current rows show: field types, nullability, sample values.
 */
public class SchemaInspector {
    private static final Logger log = LoggerFactory.getLogger(SchemaInspector.class);
    static final int MAX_SAMPLES = 3;
    static final String MIXED = "mixed";

    private final TableProvider provider;

    public SchemaInspector(TableProvider provider) {
        this.provider = provider;
    }

    public TableSchema describe(String table) {
        if (!provider.hasTable(table)) {
            throw new IllegalArgumentException("Unknown table: " + table + ". Available tables: "
                + String.join(", ", new TreeSet<>(provider.tableNames())));
        }
        List<Row> rows = provider.rows(table);
        return new TableSchema(table, provider.description(table), rows.size(), analyze(rows));
    }

    public TableCounts tableCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        int total = 0;
        for (String table : provider.tableNames()) {
            try {
                int n = provider.rows(table).size();
                counts.put(table, n);
                total += n;
            } catch (RuntimeException e) {
                errors.add("Error getting count for table '" + table + "': " + e.getMessage());
                counts.put(table, 0);
            }
        }
        return new TableCounts(Collections.unmodifiableMap(counts), total, List.copyOf(errors));
    }

    /**
     * One row per (table, field) rendered in the given format. Tables that fail to load are skipped.
     */
    public Object describeAll(String format) {
        List<Row> flattened = new ArrayList<>();
        for (String table : provider.tableNames()) {
            TableSchema schema;
            try {
                schema = describe(table);
            } catch (RuntimeException e) {
                log.warn("Skipping table '{}' in schema listing: {}", table, e.getMessage());
                continue;
            }
            for (Map.Entry<String, FieldInfo> f : schema.fields().entrySet()) {
                Map<String, Value> values = new LinkedHashMap<>();
                values.put("table_name", Value.ofString(schema.table()));
                values.put("table_description", Value.ofString(schema.description()));
                values.put("table_count", Value.ofInt(schema.rowCount()));
                values.put("field_name", Value.ofString(f.getKey()));
                values.put("field_type", Value.ofString(f.getValue().type()));
                values.put("field_nullable", Value.ofBool(f.getValue().nullable()));
                List<Value> samples = f.getValue().sampleValues();
                values.put("sample_values", Value.ofString(samples.isEmpty() ? "" : Json.compact(Value.ofSequence(samples))));
                flattened.add(Row.of(values));
            }
        }
        return FormatFactory.create(format).format(flattened);
    }

    private static Map<String, FieldInfo> analyze(List<Row> rows) {
        Map<String, String> types = new LinkedHashMap<>();
        Map<String, Boolean> nullable = new LinkedHashMap<>();
        Map<String, List<Value>> samples = new LinkedHashMap<>();
        for (Row r : rows) {
            for (Map.Entry<String, Value> e : r.values().entrySet()) {
                String field = e.getKey();
                Value v = e.getValue();
                types.putIfAbsent(field, null);
                nullable.putIfAbsent(field, false);
                List<Value> s = samples.computeIfAbsent(field, k -> new ArrayList<>());
                if (v.isNull()) {
                    nullable.put(field, true);
                    continue;
                }
                String type = typeName(v);
                String seen = types.get(field);
                if (seen == null) types.put(field, type);
                else if (!seen.equals(type)) types.put(field, MIXED);
                if (s.size() < MAX_SAMPLES && !s.contains(v)) s.add(v);
            }
        }
        Map<String, FieldInfo> out = new LinkedHashMap<>();
        for (String field : types.keySet()) {
            String type = types.get(field);
            out.put(field, new FieldInfo(type == null ? "null" : type, nullable.get(field), List.copyOf(samples.get(field))));
        }
        return Collections.unmodifiableMap(out);
    }

    static String typeName(Value v) {
        return switch (v.kind()) {
            case NULL -> "null";
            case BOOL -> "boolean";
            case INT -> "integer";
            case FLOAT -> "float";
            case STRING -> "string";
            case SEQUENCE -> v.asSequence().isEmpty() ? "array" : "array[" + typeName(v.asSequence().get(0)) + "]";
            case MAP -> "object";
        };
    }
}
