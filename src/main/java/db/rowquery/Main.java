package db.rowquery;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Scanner;

import db.rowquery.catalog.FieldInfo;
import db.rowquery.catalog.JsonTableProvider;
import db.rowquery.catalog.SchemaInspector;
import db.rowquery.catalog.TableCounts;
import db.rowquery.catalog.TableSchema;
import db.rowquery.cli.CliConfig;
import db.rowquery.format.FormatFactory;
import db.rowquery.query.QueryProcessor;
import db.rowquery.query.QueryResponse;
import db.rowquery.value.Json;
import db.rowquery.value.Value;

/**
 * Interactive shell over a directory of JSON tables.
 *   .tables          row count per table
 *   .schema <table>  inferred fields of a table
 *   exit             quit
 * Anything else runs as a query.
 */
public class Main {
    public static void main(String[] args) {
        CliConfig config = CliConfig.fromArgs(args);
        if (!FormatFactory.isAvailable(config.format)) {
            System.err.println("Unknown format: " + config.format + ". Available formats: "
                + String.join(", ", FormatFactory.availableFormats()));
            return;
        }
        JsonTableProvider provider = new JsonTableProvider(config.dataDir);
        QueryProcessor qp = new QueryProcessor(provider);
        SchemaInspector inspector = new SchemaInspector(provider);

        System.out.println("Tables from " + provider.directory().toAbsolutePath() + " (format: " + config.format + ")");
        System.out.println("Query mode\n");
        try (Scanner scanner = new Scanner(System.in)) {
            while (true) {
                System.out.print("sql> ");
                String line;
                try {
                    line = scanner.nextLine();
                } catch (NoSuchElementException eof) {
                    break;
                }
                line = line.trim();
                if (line.equalsIgnoreCase("exit")) {
                    System.out.println("Exiting query mode");
                    break;
                }
                if (line.isEmpty()) continue;
                try {
                    if (line.equalsIgnoreCase(".tables")) {
                        printCounts(inspector.tableCounts(), System.out);
                    } else if (line.toLowerCase(Locale.ROOT).startsWith(".schema")) {
                        String table = line.substring(".schema".length()).trim();
                        if (table.isEmpty()) System.out.println("Usage: .schema <table>");
                        else printSchema(inspector.describe(table), System.out);
                    } else {
                        printResponse(qp.execute(line, config.limit, config.format), System.out);
                    }
                } catch (Exception ex) {
                    System.out.println("Error: " + ex.getMessage());
                }
            }
        }
    }

    static void printResponse(QueryResponse response, PrintStream out) {
        if (!response.isSuccess()) {
            out.println("Error: " + response.error());
            return;
        }
        Object data = response.data();
        out.println(data instanceof String ? data : Json.gson().toJson(data));
        out.println("(" + response.count() + " row(s))");
    }

    static void printCounts(TableCounts counts, PrintStream out) {
        for (Map.Entry<String, Integer> e : counts.counts().entrySet()) {
            out.println(e.getKey() + ": " + e.getValue());
        }
        out.println("total: " + counts.total());
        for (String err : counts.errors()) out.println("Error: " + err);
    }

    static void printSchema(TableSchema schema, PrintStream out) {
        String description = schema.description().isEmpty() ? "" : " - " + schema.description();
        out.println(schema.table() + description + " (" + schema.rowCount() + " row(s))");
        for (Map.Entry<String, FieldInfo> f : schema.fields().entrySet()) {
            FieldInfo info = f.getValue();
            out.println("  " + f.getKey() + " " + info.type() + (info.nullable() ? " NULL" : "")
                + (info.sampleValues().isEmpty() ? "" : "  e.g. " + Json.compact(Value.ofSequence(info.sampleValues()))));
        }
    }
}
