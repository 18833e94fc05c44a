package db.rowquery.query;

import java.util.ArrayList;
import java.util.List;

import db.rowquery.exec.Operator;
import db.rowquery.exec.Row;

/**
 * Drives operator pipelines.
 */
public class QueryExecutor {

    /** Drains the operator into a list; the operator is closed even when a row fails. */
    public List<Row> collect(Operator op) {
        List<Row> out = new ArrayList<>();
        op.open();
        try {
            Row r;
            while ((r = op.next()) != null) out.add(r);
        } finally {
            op.close();
        }
        return out;
    }
}
