package db.rowquery.query;

import java.util.List;

import db.rowquery.exec.OrderSpec;

/**
 * Fully parsed query. limit is null when the query has no LIMIT clause.
 */
public record ParsedQuery(String table, SelectClause select, WhereExpression where, List<String> groupBy,
                          List<OrderSpec> orderBy, Integer limit) {

    public boolean hasGroupBy() { return !groupBy.isEmpty(); }
}
