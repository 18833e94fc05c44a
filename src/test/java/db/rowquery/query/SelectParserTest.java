package db.rowquery.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import db.rowquery.exec.AggregateFunction;
import db.rowquery.exec.AggregateSpec;

public class SelectParserTest {
    private final SelectParser parser = new SelectParser();

    @Test
    void star() {
        SelectClause s = parser.parse("*");
        assertTrue(s.isSelectAll());
        assertFalse(s.distinct());
        assertFalse(s.hasAggregates());
    }

    @Test
    void fieldsPathsAndQuotedNames() {
        SelectClause s = parser.parse("name, location.x, \"display name\"");
        assertEquals(List.of("name", "location.x", "display name"), s.fields());
        assertFalse(s.isSelectAll());
    }

    @Test
    void distinctKeyword() {
        SelectClause s = parser.parse("distinct type");
        assertTrue(s.distinct());
        assertEquals(List.of("type"), s.fields());
    }

    @Test
    void aggregatesAreNormalized() {
        SelectClause s = parser.parse("type, count(*), Avg(vertices)");
        assertEquals(List.of("type", "COUNT(*)", "AVG(vertices)"), s.fields());
        assertEquals(new AggregateSpec(AggregateFunction.COUNT, "*"), s.aggregates().get("COUNT(*)"));
        assertEquals(new AggregateSpec(AggregateFunction.AVG, "vertices"), s.aggregates().get("AVG(vertices)"));
        assertTrue(s.hasAggregates());
    }

    @Test
    void aliases() {
        SelectClause s = parser.parse("name AS label, COUNT(*) as total");
        assertEquals(List.of("label", "total"), s.fields());
        assertEquals("name", s.sourceOf("label"));
        assertEquals("total", s.sourceOf("total"));
        assertTrue(s.aggregates().containsKey("total"));
        assertEquals("other", s.sourceOf("other"));
    }

    @Test
    void emptyItemsAreSkipped() {
        assertEquals(List.of("a", "b"), parser.parse("a, , b").fields());
    }

    @Test
    void errors() {
        QuerySyntaxException e = assertThrows(QuerySyntaxException.class, () -> parser.parse(""));
        assertEquals("Error parsing SELECT clause: Empty SELECT clause", e.getMessage());

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse("DISTINCT"));
        assertEquals("Error parsing SELECT clause: Empty field list after DISTINCT", e.getMessage());

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse("SUM(*)"));
        assertEquals("Error parsing SELECT clause: Function SUM cannot be used with *", e.getMessage());

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse("MEDIAN(x)"));
        assertTrue(e.getMessage().contains("Unsupported aggregate function: MEDIAN"));

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse("a-b"));
        assertEquals("Error parsing SELECT clause: Invalid field name: a-b", e.getMessage());

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse(" , "));
        assertEquals("Error parsing SELECT clause: No valid fields found in SELECT clause", e.getMessage());
    }
}
