package db.rowquery.catalog;

import java.util.Map;

// Inferred description of a table; fields in first-seen order.
public record TableSchema(String table, String description, int rowCount, Map<String, FieldInfo> fields) {}
