package db.rowquery.catalog;

import java.util.List;
import java.util.Map;

/**
 * Row count per table plus the total. A table whose rows could not be fetched counts as 0
 * and contributes a message to errors.
 */
public record TableCounts(Map<String, Integer> counts, int total, List<String> errors) {}
