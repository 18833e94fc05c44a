package db.rowquery.catalog;

import java.util.List;

import db.rowquery.value.Value;

/**
 * Observed shape of one top-level field: its type name, whether a null was seen, and up to
 * three distinct non-null sample values.
 */
public record FieldInfo(String type, boolean nullable, List<Value> sampleValues) {}
