package db.rowquery.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class SyntaxValidatorTest {
    private final SyntaxValidator validator = new SyntaxValidator();

    @Test
    void wellFormedQueries() {
        assertEquals(Optional.empty(), validator.validate("SELECT * FROM objects"));
        assertEquals(Optional.empty(), validator.validate(
            "SELECT DISTINCT type, COUNT(*) AS n FROM scene WHERE x BETWEEN 1 AND 2 GROUP BY type ORDER BY n DESC LIMIT 5"));
    }

    @Test
    void reportsFirstProblemByStage() {
        assertEquals(Optional.of("Empty query"), validator.validate("  "));
        assertTrue(validator.validate("DELETE FROM objects").get().startsWith("Query must have SELECT ... FROM ... structure"));
        assertEquals(Optional.of("Unbalanced parentheses in query"), validator.validate("SELECT * FROM objects WHERE (x = 1"));
        assertEquals(Optional.of("Unbalanced quotes in query"), validator.validate("SELECT * FROM objects WHERE name = 'A"));
        assertEquals(Optional.of("SELECT clause error: Error parsing SELECT clause: Empty SELECT clause"),
            validator.validate("SELECT FROM objects"));
        assertTrue(validator.validate("SELECT * FROM objects WHERE name").get().startsWith("WHERE clause error: "));
        assertTrue(validator.validate("SELECT * FROM objects GROUP BY *").get().startsWith("GROUP BY clause error: "));
        assertTrue(validator.validate("SELECT * FROM objects ORDER BY name UP").get().startsWith("ORDER BY clause error: "));
        assertEquals(Optional.of("LIMIT clause error: Invalid LIMIT value: x"),
            validator.validate("SELECT * FROM objects LIMIT x"));
    }

    @Test
    void selectIsCheckedBeforeWhere() {
        String msg = validator.validate("SELECT SUM(*) FROM objects WHERE name").get();
        assertTrue(msg.startsWith("SELECT clause error: "));
    }
}
