package db.rowquery.query;

import java.util.ArrayList;
import java.util.List;

/**
 * GROUP BY list: comma-separated field paths.
 */
public class GroupByParser {

    public List<String> parse(String groupByText) {
        try {
            String text = groupByText == null ? "" : groupByText.trim();
            if (text.isEmpty()) throw new QuerySyntaxException("Empty GROUP BY clause");
            List<String> fields = new ArrayList<>();
            for (String item : SqlText.splitTopLevel(text, ',', "GROUP BY clause")) {
                if (item.isEmpty()) throw new QuerySyntaxException("Empty field name in GROUP BY");
                if (item.equals("*")) throw new QuerySyntaxException("Invalid field name in GROUP BY: *");
                try {
                    fields.add(SelectParser.fieldName(item));
                } catch (QuerySyntaxException e) {
                    throw new QuerySyntaxException("Invalid field name in GROUP BY: " + item);
                }
            }
            return List.copyOf(fields);
        } catch (QuerySyntaxException e) {
            throw new QuerySyntaxException("Error parsing GROUP BY clause: " + e.getMessage(), e);
        }
    }
}
