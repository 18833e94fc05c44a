package db.rowquery.exec;

import static db.rowquery.catalog.SampleTables.row;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import db.rowquery.query.QueryExecutor;
import db.rowquery.value.Value;

public class ProjectionOperatorTest {
    private final QueryExecutor executor = new QueryExecutor();

    @Test
    void renamesAndFillsNulls() {
        List<ProjectionOperator.Column> cols = List.of(
            new ProjectionOperator.Column("kind", "t"),
            new ProjectionOperator.Column("missing.path", "missing.path"));
        List<Row> out = executor.collect(new ProjectionOperator(new ListScanOperator(List.of(row("t", "MESH", "n", "A"))), cols));
        assertEquals(List.of("kind", "missing.path"), List.copyOf(out.get(0).fieldNames()));
        assertEquals(Value.ofString("MESH"), out.get(0).get("kind"));
        assertTrue(out.get(0).get("missing.path").isNull());
    }

    @Test
    void readsNestedPaths() {
        Row r = row("name", "Cube", "transform", Map.of("location", List.of(1, 2, 3)));
        List<ProjectionOperator.Column> cols = List.of(new ProjectionOperator.Column("transform.location", "transform.location"));
        List<Row> out = executor.collect(new ProjectionOperator(new ListScanOperator(List.of(r)), cols));
        assertEquals(3, out.get(0).get("transform.location").asSequence().size());
    }
}
