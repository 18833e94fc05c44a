package db.rowquery.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParseException;

import db.rowquery.exec.Row;
import db.rowquery.query.QueryProcessor;
import db.rowquery.query.QueryResponse;
import db.rowquery.value.Value;

public class JsonTableProviderTest {

    @TempDir
    Path dir;

    private void write(String fileName, String content) throws IOException {
        Files.writeString(dir.resolve(fileName), content, StandardCharsets.UTF_8);
    }

    @Test
    void listsJsonFilesByLowerCasedStem() throws IOException {
        write("Objects.json", "[]");
        write("lights.json", "[]");
        write("notes.txt", "ignored");
        write("_descriptions.json", "{\"objects\": \"Scene objects\"}");
        JsonTableProvider provider = new JsonTableProvider(dir);
        assertEquals(Set.of("objects", "lights"), provider.tableNames());
        assertTrue(provider.hasTable("objects"));
        assertFalse(provider.hasTable("Objects"));
        assertEquals("Scene objects", provider.description("objects"));
        assertEquals("", provider.description("lights"));
    }

    @Test
    void readsRowsWithNestedValues() throws IOException {
        write("scene.json", "[{\"name\": \"Cube\", \"vertices\": 8, \"scale\": 1.5, \"loc\": {\"x\": 1}, \"tags\": [\"a\"], \"parent\": null}]");
        List<Row> rows = new JsonTableProvider(dir).rows("scene");
        assertEquals(1, rows.size());
        Row r = rows.get(0);
        assertEquals(Value.ofString("Cube"), r.get("name"));
        assertEquals(Value.Kind.INT, r.get("vertices").kind());
        assertEquals(Value.Kind.FLOAT, r.get("scale").kind());
        assertEquals(Value.ofInt(1), r.resolveOrNull("loc.x"));
        assertTrue(r.get("tags").isSequence());
        assertTrue(r.get("parent").isNull());
    }

    @Test
    void picksUpNewFilesBetweenCalls() throws IOException {
        JsonTableProvider provider = new JsonTableProvider(dir);
        assertTrue(provider.tableNames().isEmpty());
        write("late.json", "[{\"a\": 1}]");
        assertEquals(1, provider.rows("late").size());
    }

    @Test
    void rejectsMalformedTables() throws IOException {
        write("scalar.json", "42");
        write("mixed.json", "[{\"a\": 1}, 2]");
        JsonTableProvider provider = new JsonTableProvider(dir);
        assertThrows(JsonParseException.class, () -> provider.rows("scalar"));
        assertThrows(JsonParseException.class, () -> provider.rows("mixed"));
        assertThrows(IllegalArgumentException.class, () -> provider.rows("absent"));
    }

    @Test
    void unreadableDescriptionsAreIgnored() throws IOException {
        write("t.json", "[]");
        write("_descriptions.json", "not json {");
        assertEquals("", new JsonTableProvider(dir).description("t"));
    }

    @Test
    void missingDirectoryHasNoTables() {
        assertTrue(new JsonTableProvider(dir.resolve("nope")).tableNames().isEmpty());
    }

    @Test
    void queriesRunAgainstFiles() throws IOException {
        write("Objects.json", "[{\"name\": \"A\", \"type\": \"MESH\"}, {\"name\": \"B\", \"type\": \"LIGHT\"}]");
        write("broken.json", "[1, 2]");
        QueryProcessor qp = new QueryProcessor(new JsonTableProvider(dir));
        QueryResponse resp = qp.execute("SELECT name FROM Objects WHERE type = 'LIGHT'");
        assertTrue(resp.isSuccess(), resp.error());
        assertEquals(1, resp.count());

        resp = qp.execute("SELECT * FROM broken");
        assertTrue(resp.error().startsWith("Error loading data from table 'broken': "), resp.error());
    }
}
