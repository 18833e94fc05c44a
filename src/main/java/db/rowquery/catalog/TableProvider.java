package db.rowquery.catalog;

import java.util.List;
import java.util.Set;

import db.rowquery.exec.Row;

/**
 * Source of named tables. Every rows call returns a fresh snapshot that the engine only reads.
 */
public interface TableProvider {
    boolean hasTable(String name);

    Set<String> tableNames();

    List<Row> rows(String name);

    default String description(String name) {
        return "";
    }
}
