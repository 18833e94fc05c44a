package db.rowquery.format;

import java.util.List;

import db.rowquery.exec.Row;

/**
 * Renders final result rows into an output payload.
 */
public interface Formatter {
    /** Format name as accepted by {@link FormatFactory#create(String)}. */
    String name();

    Object format(List<Row> rows);
}
