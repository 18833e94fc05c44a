package db.rowquery.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import db.rowquery.exec.Row;
import db.rowquery.value.Value;

public class SchemaInspectorTest {
    private final SchemaInspector inspector = new SchemaInspector(SampleTables.provider());

    @Test
    void describesFieldsFromRows() {
        TableSchema schema = inspector.describe("scene");
        assertEquals("scene", schema.table());
        assertEquals("Scene objects with transforms", schema.description());
        assertEquals(5, schema.rowCount());

        FieldInfo vertices = schema.fields().get("vertices");
        assertEquals("integer", vertices.type());
        assertTrue(vertices.nullable());
        assertEquals(List.of(Value.ofInt(8), Value.ofInt(482), Value.ofInt(4)), vertices.sampleValues());

        FieldInfo type = schema.fields().get("type");
        assertFalse(type.nullable());
        assertEquals(3, type.sampleValues().size());

        assertEquals("object", schema.fields().get("location").type());
        assertEquals("string", schema.fields().get("parent").type());
    }

    @Test
    void mixedAndAllNullFields() {
        InMemoryTableProvider provider = new InMemoryTableProvider()
            .registerTable("t", List.of(
                SampleTables.row("v", 1, "n", null),
                SampleTables.row("v", "one", "n", null)));
        TableSchema schema = new SchemaInspector(provider).describe("t");
        assertEquals("mixed", schema.fields().get("v").type());
        assertEquals("null", schema.fields().get("n").type());
        assertTrue(schema.fields().get("n").sampleValues().isEmpty());
    }

    @Test
    void unknownTable() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> inspector.describe("nope"));
        assertEquals("Unknown table: nope. Available tables: objects, scene, tables", e.getMessage());
    }

    @Test
    void countsRecordFailuresPerTable() {
        TableProvider flaky = new TableProvider() {
            @Override
            public boolean hasTable(String name) { return true; }

            @Override
            public Set<String> tableNames() { return new LinkedHashSet<>(List.of("good", "bad")); }

            @Override
            public List<Row> rows(String name) {
                if (name.equals("bad")) throw new IllegalStateException("cannot read");
                return SampleTables.objects();
            }
        };
        TableCounts counts = new SchemaInspector(flaky).tableCounts();
        assertEquals(Map.of("good", 3, "bad", 0), counts.counts());
        assertEquals(3, counts.total());
        assertEquals(List.of("Error getting count for table 'bad': cannot read"), counts.errors());

        // failing tables are left out of the listing
        Object csv = new SchemaInspector(flaky).describeAll("csv");
        assertFalse(((String) csv).contains("bad"));
    }

    @Test
    void describeAllFlattensFields() {
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rows = (List<Map<String, Object>>) inspector.describeAll("json");
        Map<String, Object> first = rows.get(0);
        assertEquals("objects", first.get("table_name"));
        assertEquals(3L, first.get("table_count"));
        assertEquals("name", first.get("field_name"));
        assertEquals("string", first.get("field_type"));
        assertEquals(false, first.get("field_nullable"));
        assertEquals("[\"A\",\"B\",\"C\"]", first.get("sample_values"));
        // objects: 2 fields, scene: 7 fields, tables: 2 fields
        assertEquals(11, rows.size());
    }
}
