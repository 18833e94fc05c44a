package db.rowquery.catalog;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.rowquery.exec.Row;
import db.rowquery.value.Json;
import db.rowquery.value.Value;

/**
 * Tables backed by {@code *.json} files in a directory. Each file holds a JSON array of
 * objects and is exposed under its lower-cased file stem. An optional
 * {@value #DESCRIPTIONS_FILE} maps table names to descriptions.
 * The directory is re-read on every call, so edits show up on the next query.
 */
public class JsonTableProvider implements TableProvider {
    static final String DESCRIPTIONS_FILE = "_descriptions.json";
    private static final Logger log = LoggerFactory.getLogger(JsonTableProvider.class);
    private static final Type DESCRIPTIONS_TYPE = new TypeToken<Map<String, String>>(){}.getType();

    private final Path directory;

    public JsonTableProvider(Path directory) {
        this.directory = directory;
    }

    public Path directory() { return directory; }

    @Override
    public boolean hasTable(String name) {
        return tableFiles().containsKey(name);
    }

    @Override
    public Set<String> tableNames() {
        return Collections.unmodifiableSet(tableFiles().keySet());
    }

    @Override
    public List<Row> rows(String name) {
        Path file = tableFiles().get(name);
        if (file == null) throw new IllegalArgumentException("Unknown table: " + name);
        JsonElement root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = JsonParser.parseReader(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading table file: " + file, e);
        }
        if (!root.isJsonArray()) throw new JsonParseException("Table file " + file.getFileName() + " must contain a JSON array");
        List<Row> rows = new ArrayList<>();
        for (JsonElement e : root.getAsJsonArray()) {
            if (!e.isJsonObject()) {
                throw new JsonParseException("Table file " + file.getFileName() + " must contain only JSON objects");
            }
            Map<String, Value> values = new LinkedHashMap<>(Json.fromJson(e).asMap());
            rows.add(Row.of(values));
        }
        return rows;
    }

    @Override
    public String description(String name) {
        Path file = directory.resolve(DESCRIPTIONS_FILE);
        if (!Files.isRegularFile(file)) return "";
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, String> loaded = Json.gson().fromJson(reader, DESCRIPTIONS_TYPE);
            if (loaded == null) return "";
            return loaded.getOrDefault(name, "");
        } catch (IOException | JsonParseException e) {
            log.warn("Skipping unreadable descriptions file {}: {}", file, e.getMessage());
            return "";
        }
    }

    // lower-cased stem -> file, sorted by name
    private Map<String, Path> tableFiles() {
        Map<String, Path> out = new TreeMap<>();
        if (!Files.isDirectory(directory)) return out;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.json")) {
            for (Path p : stream) {
                String fileName = p.getFileName().toString();
                if (fileName.equals(DESCRIPTIONS_FILE) || !Files.isRegularFile(p)) continue;
                String stem = fileName.substring(0, fileName.length() - ".json".length());
                out.put(stem.toLowerCase(Locale.ROOT), p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed listing table directory: " + directory, e);
        }
        return out;
    }
}
