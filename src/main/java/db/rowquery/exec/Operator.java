package db.rowquery.exec;

/**
 * Pull-based pipeline operator: open, drain with next until null, close.
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();
}
