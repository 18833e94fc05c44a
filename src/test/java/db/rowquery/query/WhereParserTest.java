package db.rowquery.query;

import static db.rowquery.catalog.SampleTables.row;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import db.rowquery.exec.Row;
import db.rowquery.value.Value;

public class WhereParserTest {
    private final WhereParser parser = new WhereParser();

    private boolean matches(String where, Row row) {
        return parser.parse(where).test(row);
    }

    @Test
    void parsesEachConditionForm() {
        WhereExpression expr = parser.parse(
            "a >= 1 AND b <> 'x' OR c IS NULL AND d IS NOT NULL AND e IN (1, 2) AND f NOT LIKE 'q%' AND g BETWEEN 1 AND 5");
        List<WhereCondition> cs = expr.conditions();
        assertEquals(7, cs.size());
        assertEquals(WhereCondition.Op.GTE, cs.get(0).op());
        assertEquals(WhereCondition.Op.NE, cs.get(1).op());
        assertEquals(Value.ofString("x"), cs.get(1).literal());
        assertEquals(WhereCondition.Op.IS, cs.get(2).op());
        assertEquals(WhereCondition.Op.IS_NOT, cs.get(3).op());
        assertEquals(WhereCondition.Op.IN, cs.get(4).op());
        assertEquals(List.of(Value.ofInt(1), Value.ofInt(2)), cs.get(4).literal().asSequence());
        assertEquals(WhereCondition.Op.LIKE, cs.get(5).op());
        assertTrue(cs.get(5).negated());
        assertEquals(WhereCondition.Op.BETWEEN, cs.get(6).op());
        assertEquals("g", cs.get(6).fieldPath());
        assertEquals(List.of("AND", "OR", "AND", "AND", "AND", "AND"), expr.connectors());
    }

    @Test
    void betweenBoundsAreNotSplitIntoConditions() {
        WhereExpression expr = parser.parse("x BETWEEN 1 AND 5 OR y NOT BETWEEN 'a' AND 'c'");
        assertEquals(2, expr.conditions().size());
        assertEquals(List.of("OR"), expr.connectors());
        assertTrue(expr.conditions().get(1).negated());
        assertTrue(matches("x BETWEEN 1 AND 5", row("x", 5)));
        assertTrue(matches("x BETWEEN 1 AND 5", row("x", 1.0)));
        assertFalse(matches("x BETWEEN 1 AND 5", row("x", 6)));
        assertTrue(matches("x NOT BETWEEN 1 AND 5", row("x", 6)));
    }

    @Test
    void connectorsFoldLeftToRight() {
        // (visible = false OR type = 'LIGHT') AND name = 'Light'
        String where = "visible = false OR type = 'LIGHT' AND name = 'Light'";
        assertTrue(matches(where, row("name", "Light", "type", "LIGHT", "visible", true)));
        assertFalse(matches(where, row("name", "Sphere", "type", "MESH", "visible", false)));
    }

    @Test
    void coercesLiteralsTowardsRowValues() {
        assertTrue(matches("n = '5'", row("n", 5)));
        assertTrue(matches("n > 4.5", row("n", 5)));
        assertTrue(matches("flag = 'yes'", row("flag", true)));
        // string row against a number compares text forms
        assertTrue(matches("code = 10", row("code", "10")));
        assertFalse(matches("code > 9", row("code", "10")));
    }

    @Test
    void booleansMatchZeroAndOne() {
        Row r = row("name", "A", "flag", true);
        assertTrue(matches("flag = 1", r));
        assertTrue(matches("flag != 0", r));
        assertTrue(matches("flag IN (1)", r));
        assertFalse(matches("flag NOT IN (1, 2)", r));
        assertFalse(matches("flag = 0", r));
        assertFalse(matches("flag = 2", r));
        // consistent with ordering, which already reads booleans as 0/1
        assertEquals(matches("flag >= 1 AND flag <= 1", r), matches("flag = 1", r));
        assertTrue(matches("flag = 0", row("flag", false)));
    }

    @Test
    void likeAndIlike() {
        Row r = row("name", "Cube.001");
        assertTrue(matches("name LIKE 'Cube%'", r));
        assertTrue(matches("name ILIKE 'cube%'", r));
        // case-insensitive search anywhere in the text
        assertTrue(matches("name LIKE 'be.0'", r));
        assertFalse(matches("name LIKE 'sphere'", r));
        assertTrue(matches("name LIKE 'Cub_.0%'", r));
        assertTrue(matches("name NOT ILIKE 'sphere%'", r));
    }

    @Test
    void inAndNotIn() {
        Row r = row("type", "MESH");
        assertTrue(matches("type IN ('MESH', 'LIGHT')", r));
        assertFalse(matches("type NOT IN ('MESH', 'LIGHT')", r));
        assertTrue(matches("type NOT IN ('CAMERA')", r));
    }

    @Test
    void missingFieldIsFalseBeforeNegation() {
        Row r = row("name", "A");
        assertFalse(matches("other = 1", r));
        assertFalse(matches("other LIKE 'x'", r));
        assertTrue(matches("other NOT IN (1)", r));
        assertTrue(matches("other IS NULL", r));
        assertFalse(matches("other IS NOT NULL", r));
    }

    @Test
    void nestedPaths() {
        Row r = row("location", Map.of("x", 4.0, "y", 1.0));
        assertTrue(matches("location.x > 3", r));
        assertFalse(matches("location.y > 3", r));
        assertFalse(matches("location.z > 3", r));
    }

    @Test
    void keywordsInsideQuotesAreLiteralText() {
        WhereExpression expr = parser.parse("name = 'salt AND pepper'");
        assertEquals(1, expr.conditions().size());
        assertTrue(expr.test(row("name", "salt AND pepper")));
        assertTrue(matches("name = 'a=b'", row("name", "a=b")));
        assertTrue(matches("name = 'it''s'", row("name", "it's")));
    }

    @Test
    void errors() {
        QuerySyntaxException e = assertThrows(QuerySyntaxException.class, () -> parser.parse("   "));
        assertEquals("Empty WHERE clause", e.getMessage());

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse("a = 1 AND"));
        assertEquals("Missing condition after AND", e.getMessage());

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse("OR a = 1"));
        assertEquals("Missing condition before OR", e.getMessage());

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse("name"));
        assertEquals("Error parsing condition 'name': No valid operator found in condition: name", e.getMessage());

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse("= 5"));
        assertTrue(e.getMessage().contains("Missing field name"));

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse("1abc = 5"));
        assertTrue(e.getMessage().endsWith("Invalid field name: 1abc"));

        e = assertThrows(QuerySyntaxException.class, () -> parser.parse("x BETWEEN 1"));
        assertTrue(e.getMessage().endsWith("BETWEEN requires 'AND' between its bounds"));
    }
}
