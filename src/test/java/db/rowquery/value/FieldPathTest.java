package db.rowquery.value;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class FieldPathTest {

    private static Map<String, Value> sample() {
        Map<String, Value> root = new LinkedHashMap<>();
        root.put("name", Value.ofString("Cube"));
        root.put("location", Value.of(Map.of("x", 1.0, "inner", Map.of("deep", 3))));
        root.put("parent", Value.NULL);
        root.put("SUM(location.x)", Value.ofFloat(9.0));
        return root;
    }

    @Test
    void validatesPaths() {
        assertTrue(FieldPath.isValid("name"));
        assertTrue(FieldPath.isValid("location.x"));
        assertTrue(FieldPath.isValid("_a1.b_2"));
        assertFalse(FieldPath.isValid("1abc"));
        assertFalse(FieldPath.isValid("a..b"));
        assertFalse(FieldPath.isValid("a."));
        assertFalse(FieldPath.isValid("a-b"));
        assertFalse(FieldPath.isValid(""));
        assertFalse(FieldPath.isValid(null));
    }

    @Test
    void resolvesNestedSegments() {
        assertEquals(Optional.of(Value.ofFloat(1.0)), FieldPath.resolve(sample(), "location.x"));
        assertEquals(Optional.of(Value.ofInt(3)), FieldPath.resolve(sample(), "location.inner.deep"));
    }

    @Test
    void missingSegmentsAreEmpty() {
        assertTrue(FieldPath.resolve(sample(), "missing").isEmpty());
        assertTrue(FieldPath.resolve(sample(), "location.w").isEmpty());
        assertTrue(FieldPath.resolve(sample(), "name.first").isEmpty());
        assertTrue(FieldPath.resolveOrNull(sample(), "location.w").isNull());
    }

    @Test
    void explicitNullIsPresent() {
        assertEquals(Optional.of(Value.NULL), FieldPath.resolve(sample(), "parent"));
    }

    @Test
    void exactKeyWinsOverNesting() {
        assertEquals(Value.ofFloat(9.0), FieldPath.resolveOrNull(sample(), "SUM(location.x)"));
    }
}
