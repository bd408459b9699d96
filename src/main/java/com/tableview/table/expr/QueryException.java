package com.tableview.table.expr;

/**
 * A row expression or filter clause that cannot be evaluated: bad syntax, an unknown column
 * or function, or operands of the wrong type.
 */
public class QueryException extends IllegalArgumentException {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
