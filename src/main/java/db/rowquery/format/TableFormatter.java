package db.rowquery.format;

import java.util.ArrayList;
import java.util.List;

import db.rowquery.exec.Row;

/**
 * ASCII table: a header line, a '-' rule as wide as the header, then one line per row.
 * Cells are left-justified to the column width and joined with " | ". No trailing newline.
 */
public class TableFormatter implements Formatter {
    static final String NO_DATA = "No data";
    private static final String COLUMN_SEPARATOR = " | ";

    @Override
    public String name() { return "table"; }

    @Override
    public String format(List<Row> rows) {
        if (rows.isEmpty()) return NO_DATA;
        List<String> headers = new ArrayList<>(rows.get(0).fieldNames());
        int colCount = headers.size();
        List<String[]> cells = new ArrayList<>(rows.size());
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers.get(i).length();
        for (Row r : rows) {
            String[] line = new String[colCount];
            for (int i = 0; i < colCount; i++) {
                line[i] = CellFormatter.format(r.get(headers.get(i)));
                if (line[i].length() > widths[i]) widths[i] = line[i].length();
            }
            cells.add(line);
        }
        String header = buildLine(headers.toArray(new String[0]), widths);
        StringBuilder sb = new StringBuilder();
        sb.append(header).append('\n');
        sb.append("-".repeat(header.length()));
        for (String[] line : cells) {
            sb.append('\n').append(buildLine(line, widths));
        }
        return sb.toString();
    }

    private static String buildLine(String[] values, int[] widths) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(COLUMN_SEPARATOR);
            sb.append(pad(values[i], widths[i]));
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
