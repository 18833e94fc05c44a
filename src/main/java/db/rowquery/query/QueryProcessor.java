package db.rowquery.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.rowquery.catalog.TableProvider;
import db.rowquery.exec.DistinctOperator;
import db.rowquery.exec.FilterOperator;
import db.rowquery.exec.GroupOperator;
import db.rowquery.exec.LimitOperator;
import db.rowquery.exec.ListScanOperator;
import db.rowquery.exec.OrderSpec;
import db.rowquery.exec.ProjectionOperator;
import db.rowquery.exec.Row;
import db.rowquery.exec.SortOperator;
import db.rowquery.format.FormatFactory;
import db.rowquery.format.Formatter;
import db.rowquery.value.Value;

/**
 * Processor combining validation, parsing and the execution pipeline:
 * scan -> WHERE -> GROUP BY / aggregates -> DISTINCT -> ORDER BY -> LIMIT -> projection -> format.
 *
 * Each stage is materialized on its own so a failure can be reported with the stage it
 * happened in. execute never throws: every failure becomes an error response.
 */
public class QueryProcessor {
    private static final Logger log = LoggerFactory.getLogger(QueryProcessor.class);

    private final TableProvider provider;
    private final EngineConfig config;
    private final QueryParser parser = new QueryParser();
    private final SyntaxValidator validator = new SyntaxValidator(parser);
    private final QueryExecutor executor = new QueryExecutor();

    public QueryProcessor(TableProvider provider) {
        this(provider, EngineConfig.defaultConfig());
    }

    public QueryProcessor(TableProvider provider, EngineConfig config) {
        this.provider = provider;
        this.config = config;
    }

    /** Runs the query without a row limit, rendering rows as json. */
    public QueryResponse execute(String query) {
        return execute(query, 0, config.defaultFormat);
    }

    /**
     * @param limit  maximum rows returned; 0 or less means unlimited. A LIMIT clause in the
     *               query applies as well, the smaller of the two wins.
     * @param format json, csv or table (case-insensitive)
     */
    public QueryResponse execute(String query, int limit, String format) {
        String requested = format == null ? config.defaultFormat : format;
        try {
            return run(query, limit, requested);
        } catch (StageFailure e) {
            log.warn("Query failed: {}", e.getMessage());
            return QueryResponse.error(e.getMessage(), requested);
        } catch (RuntimeException e) {
            log.warn("Unexpected error executing query: {}", query, e);
            return QueryResponse.error("Unexpected error executing query: " + e.getMessage(), requested);
        }
    }

    private QueryResponse run(String query, int limit, String format) {
        Formatter formatter = stage(null, () -> FormatFactory.create(format));

        Optional<String> syntaxError = validator.validate(query);
        if (syntaxError.isPresent()) throw new StageFailure("Query syntax error: " + syntaxError.get());

        ParsedQuery parsed = parse(query);
        List<Row> result = pipeline(parsed, limit);

        Object payload = stage("Error formatting output", () -> formatter.format(result));
        log.debug("Returning {} row(s) as {}", result.size(), formatter.name());
        return QueryResponse.success(payload, result, formatter.name());
    }

    // Clause by clause, so a failure names its clause
    private ParsedQuery parse(String query) {
        ClauseExtractor.Clauses clauses = parser.clauses(query);
        String table = resolveTable(clauses.table());
        SelectClause select = stage("SELECT clause error", () -> parser.parseSelect(clauses.select()));
        WhereExpression where = stage("WHERE clause error", () -> parser.parseWhere(clauses.where()));
        List<String> groupBy = stage("GROUP BY clause error", () -> parser.parseGroupBy(clauses.groupBy()));
        List<OrderSpec> orderBy = stage("ORDER BY clause error", () -> parser.parseOrderBy(clauses.orderBy()));
        Integer queryLimit = stage("LIMIT clause error", () -> parser.parseLimit(clauses.limit()));
        return new ParsedQuery(table, select, where, groupBy, orderBy, queryLimit);
    }

    private List<Row> pipeline(ParsedQuery q, int limit) {
        String table = q.table();
        SelectClause select = q.select();

        List<Row> data = stage("Error loading data from table '" + table + "'", () -> provider.rows(table));
        log.debug("Loaded {} row(s) from '{}'", data.size(), table);

        if (!data.isEmpty() && !select.isSelectAll()) validateFields(select, data, table);

        if (!q.where().isEmpty()) {
            FilterOperator filter = new FilterOperator(new ListScanOperator(data), q.where());
            data = stage("Error applying WHERE clause", () -> executor.collect(filter));
            log.debug("WHERE kept {} row(s), rejected {}", data.size(), filter.rejected());
        }

        if (q.hasGroupBy()) {
            List<Row> input = data;
            data = stage("Error applying GROUP BY",
                () -> executor.collect(new GroupOperator(new ListScanOperator(input), q.groupBy(), select.aggregates())));
            log.debug("GROUP BY produced {} group(s)", data.size());
        } else if (select.hasAggregates()) {
            List<Row> input = data;
            data = stage("Error applying aggregate functions",
                () -> executor.collect(new GroupOperator(new ListScanOperator(input), List.of(), select.aggregates())));
        }

        if (select.distinct() && !q.hasGroupBy()) {
            List<String> keys = new ArrayList<>();
            if (!select.isSelectAll()) {
                for (String f : select.fields()) keys.add(select.sourceOf(f));
            }
            List<Row> input = data;
            data = stage("Error applying DISTINCT",
                () -> executor.collect(new DistinctOperator(new ListScanOperator(input), keys)));
            log.debug("DISTINCT kept {} row(s)", data.size());
        }

        if (!q.orderBy().isEmpty()) {
            List<OrderSpec> keys = new ArrayList<>(q.orderBy().size());
            for (OrderSpec k : q.orderBy()) keys.add(new OrderSpec(select.sourceOf(k.field()), k.direction()));
            List<Row> input = data;
            data = stage("Error applying ORDER BY",
                () -> executor.collect(SortOperator.orderBy(new ListScanOperator(input), keys)));
        }

        int effectiveLimit = limit > 0 ? limit : -1;
        if (q.limit() != null) {
            effectiveLimit = effectiveLimit < 0 ? q.limit() : Math.min(q.limit(), effectiveLimit);
        }
        if (effectiveLimit >= 0) {
            data = executor.collect(new LimitOperator(new ListScanOperator(data), effectiveLimit));
        }

        if (!select.isSelectAll() && !select.hasAggregates()) {
            List<ProjectionOperator.Column> columns = new ArrayList<>();
            for (String f : select.fields()) columns.add(new ProjectionOperator.Column(f, select.sourceOf(f)));
            List<Row> input = data;
            data = stage("Error selecting fields",
                () -> executor.collect(new ProjectionOperator(new ListScanOperator(input), columns)));
        }
        return data;
    }

    // Exact name first, then the lower-cased form
    private String resolveTable(String raw) {
        if (provider.hasTable(raw)) return raw;
        String lower = raw.toLowerCase(Locale.ROOT);
        if (provider.hasTable(lower)) return lower;
        throw new StageFailure("Unknown table: '" + lower + "'. Available tables: "
            + String.join(", ", new TreeSet<>(provider.tableNames())));
    }

    private void validateFields(SelectClause select, List<Row> data, String table) {
        List<Row> sample = data.subList(0, Math.min(config.validationSampleRows, data.size()));
        for (String field : select.fields()) {
            if (field.equals("*") || select.aggregates().containsKey(field) || select.aliases().containsKey(field)) continue;
            boolean found = false;
            for (Row r : sample) {
                if (r.resolve(field).isPresent()) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                throw new StageFailure("Field '" + field + "' not found in table '" + table
                    + "'. Available fields: " + String.join(", ", suggestFields(data)));
            }
        }
    }

    private List<String> suggestFields(List<Row> data) {
        TreeSet<String> paths = new TreeSet<>();
        for (Row r : data.subList(0, Math.min(config.fieldSuggestionRows, data.size()))) {
            collectPaths(r.values(), "", 0, paths);
        }
        List<String> out = new ArrayList<>();
        for (String p : paths) {
            if (out.size() == config.maxFieldSuggestions) {
                out.add("...");
                break;
            }
            out.add(p);
        }
        return out;
    }

    // Nested maps, and the first element of a sequence of maps, contribute dotted paths
    private void collectPaths(Map<String, Value> values, String prefix, int depth, TreeSet<String> out) {
        if (depth > config.fieldSuggestionDepth) return;
        for (Map.Entry<String, Value> e : values.entrySet()) {
            String path = prefix.isEmpty() ? e.getKey() : prefix + "." + e.getKey();
            out.add(path);
            Value v = e.getValue();
            if (v.isMap()) {
                collectPaths(v.asMap(), path, depth + 1, out);
            } else if (v.isSequence() && !v.asSequence().isEmpty() && v.asSequence().get(0).isMap()) {
                collectPaths(v.asSequence().get(0).asMap(), path, depth + 1, out);
            }
        }
    }

    /** Runs one stage; a failure is rethrown with the stage name prefixed to its message. */
    private static <T> T stage(String name, Supplier<T> work) {
        try {
            return work.get();
        } catch (StageFailure e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StageFailure(name == null ? e.getMessage() : name + ": " + e.getMessage(), e);
        }
    }

    private static final class StageFailure extends RuntimeException {
        StageFailure(String message) {
            super(message);
        }

        StageFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
