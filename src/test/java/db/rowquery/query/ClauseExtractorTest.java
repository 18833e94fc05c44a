package db.rowquery.query;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class ClauseExtractorTest {
    private final ClauseExtractor extractor = new ClauseExtractor();

    @Test
    void allClauses() {
        ClauseExtractor.Clauses c = extractor.extract(
            "SELECT type, COUNT(*) FROM scene WHERE visible = true GROUP  BY type ORDER BY type LIMIT 3");
        assertEquals("type, COUNT(*)", c.select());
        assertEquals("scene", c.table());
        assertEquals("visible = true", c.where());
        assertEquals("type", c.groupBy());
        assertEquals("type", c.orderBy());
        assertEquals("3", c.limit());
    }

    @Test
    void absentClausesAreNull() {
        ClauseExtractor.Clauses c = extractor.extract("select * from objects");
        assertEquals("*", c.select());
        assertNull(c.where());
        assertNull(c.groupBy());
        assertNull(c.orderBy());
        assertNull(c.limit());
    }

    @Test
    void keywordWithNothingAfterIsEmpty() {
        assertEquals("", extractor.extract("SELECT * FROM objects WHERE").where());
    }

    @Test
    void keywordsInsideLiteralsAreIgnored() {
        ClauseExtractor.Clauses c = extractor.extract("SELECT * FROM objects WHERE name = 'x ORDER BY y' LIMIT 1");
        assertEquals("name = 'x ORDER BY y'", c.where());
        assertNull(c.orderBy());
        assertEquals("1", c.limit());
    }

    @Test
    void trailingSemicolonIsDropped() {
        assertEquals("Scene", extractor.extract("SELECT * FROM Scene;").table());
    }

    @Test
    void malformedShapes() {
        assertThrows(QuerySyntaxException.class, () -> extractor.extract("SELECT *"));
        assertThrows(QuerySyntaxException.class, () -> extractor.extract("FROM objects"));
        assertThrows(QuerySyntaxException.class, () -> extractor.extract("SELECT * FROM"));
        QuerySyntaxException e = assertThrows(QuerySyntaxException.class, () -> extractor.extract("SELECT * FROM a b"));
        assertEquals("Invalid table name: a b", e.getMessage());
    }
}
