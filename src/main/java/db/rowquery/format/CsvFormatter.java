package db.rowquery.format;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import com.opencsv.CSVWriter;

import db.rowquery.exec.Row;

/**
 * CSV text: a header from the first row's fields, then one line per row.
 * Values needing it are quoted with doubled inner quotes; lines end with '\n'.
 * Fields absent from a later row are written empty, fields the first row lacks are dropped.
 */
public class CsvFormatter implements Formatter {
    @Override
    public String name() { return "csv"; }

    @Override
    public String format(List<Row> rows) {
        if (rows.isEmpty()) return "";
        List<String> header = new ArrayList<>(rows.get(0).fieldNames());
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out, CSVWriter.DEFAULT_SEPARATOR, CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_QUOTE_CHARACTER, "\n")) {
            writer.writeNext(header.toArray(new String[0]), false);
            for (Row r : rows) {
                String[] line = new String[header.size()];
                for (int i = 0; i < line.length; i++) line[i] = CellFormatter.format(r.get(header.get(i)));
                writer.writeNext(line, false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed writing CSV", e);
        }
        return out.toString();
    }
}
