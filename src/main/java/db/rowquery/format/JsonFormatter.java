package db.rowquery.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import db.rowquery.exec.Row;

/**
 * Passes rows through as plain Java maps; serializing them is left to the caller.
 */
public class JsonFormatter implements Formatter {
    @Override
    public String name() { return "json"; }

    @Override
    public List<Map<String, Object>> format(List<Row> rows) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Row r : rows) out.add(r.toJava());
        return out;
    }
}
