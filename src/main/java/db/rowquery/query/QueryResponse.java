package db.rowquery.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import db.rowquery.exec.Row;
import db.rowquery.value.Json;

/**
 * Outcome of one query: formatted data and row count on success, a message on error.
 */
public final class QueryResponse {
    public enum Status {
        SUCCESS, ERROR;

        public String wireName() { return name().toLowerCase(Locale.ROOT); }
    }

    private final Status status;
    private final Object data;
    private final String error;
    private final int count;
    private final String format;
    private final List<Row> rows;

    private QueryResponse(Status status, Object data, String error, int count, String format, List<Row> rows) {
        this.status = status;
        this.data = data;
        this.error = error;
        this.count = count;
        this.format = format;
        this.rows = rows;
    }

    public static QueryResponse success(Object data, List<Row> rows, String format) {
        return new QueryResponse(Status.SUCCESS, data, null, rows.size(), format, List.copyOf(rows));
    }

    public static QueryResponse error(String message, String format) {
        return new QueryResponse(Status.ERROR, null, message, 0, format, List.of());
    }

    public Status status() { return status; }
    public boolean isSuccess() { return status == Status.SUCCESS; }
    /** Formatted payload: a list of maps for json, text for csv and table. Null on error. */
    public Object data() { return data; }
    public String error() { return error; }
    public int count() { return count; }
    public String format() { return format; }
    /** The final rows before formatting; empty on error. */
    public List<Row> rows() { return rows; }

    /** Keys status, format, count, then data or error. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", status.wireName());
        out.put("format", format);
        out.put("count", count);
        if (status == Status.SUCCESS) out.put("data", data);
        else out.put("error", error);
        return out;
    }

    public String toJson() {
        return Json.gson().toJson(toMap());
    }

    @Override
    public String toString() {
        return isSuccess() ? "QueryResponse[success, " + count + " row(s), " + format + "]"
            : "QueryResponse[error: " + error + "]";
    }
}
