package db.rowquery.value;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Dot-separated field paths ("location.x") addressing nested map values.
 */
public final class FieldPath {
    private static final Pattern PATH = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*$");

    private FieldPath() {}

    public static boolean isValid(String path) {
        return path != null && PATH.matcher(path).matches();
    }

    /**
     * Walks the path segment by segment. Empty when any segment is missing or an
     * intermediate value is not a map; an explicit null leaf resolves to {@link Value#NULL}.
     */
    public static Optional<Value> resolve(Map<String, Value> root, String path) {
        // computed columns such as "SUM(location.x)" are stored under their full text
        Value exact = root.get(path);
        if (exact != null) return Optional.of(exact);
        int dot = path.indexOf('.');
        String head = dot < 0 ? path : path.substring(0, dot);
        Value v = root.get(head);
        if (v == null) return Optional.empty();
        if (dot < 0) return Optional.of(v);
        if (!v.isMap()) return Optional.empty();
        return resolve(v.asMap(), path.substring(dot + 1));
    }

    /** Same as {@link #resolve} but a miss yields {@link Value#NULL}. */
    public static Value resolveOrNull(Map<String, Value> root, String path) {
        return resolve(root, path).orElse(Value.NULL);
    }
}
