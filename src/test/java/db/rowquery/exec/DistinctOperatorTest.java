package db.rowquery.exec;

import static db.rowquery.catalog.SampleTables.row;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import db.rowquery.query.QueryExecutor;

public class DistinctOperatorTest {
    private final QueryExecutor executor = new QueryExecutor();

    private static final List<Row> ROWS = List.of(
        row("t", "MESH", "n", "A"),
        row("t", "MESH", "n", "B"),
        row("t", "LIGHT", "n", "C"),
        row("t", "MESH", "n", "A"));

    @Test
    void byFieldTupleKeepsFirstOccurrence() {
        List<Row> out = executor.collect(new DistinctOperator(new ListScanOperator(ROWS), List.of("t")));
        assertEquals(List.of(ROWS.get(0), ROWS.get(2)), out);
    }

    @Test
    void byWholeRow() {
        List<Row> out = executor.collect(new DistinctOperator(new ListScanOperator(ROWS), List.of()));
        assertEquals(ROWS.subList(0, 3), out);
    }

    @Test
    void idempotent() {
        List<Row> once = executor.collect(new DistinctOperator(new ListScanOperator(ROWS), List.of("t", "n")));
        List<Row> twice = executor.collect(new DistinctOperator(new ListScanOperator(once), List.of("t", "n")));
        assertEquals(once, twice);
    }
}
