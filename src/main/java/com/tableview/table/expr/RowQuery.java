package com.tableview.table.expr;

import com.tableview.table.DataTable;
import com.tableview.table.RowMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Evaluates a free-form boolean expression over every row of a table, with column names as
 * variables. Flat comparison chains take a column-wise fast path; anything else is parsed in
 * full and evaluated row by row.
 */
public class RowQuery {
    private static final Logger log = LoggerFactory.getLogger(RowQuery.class);

    private final ExpressionParser parser = new ExpressionParser();

    /**
     * @throws QueryException on bad syntax, an unknown column or function, or a type error
     */
    public RowMask evaluate(DataTable table, String expression) {
        Optional<ComparisonChain> chain = ComparisonChain.compile(expression, table);
        if (chain.isPresent()) {
            log.debug("Evaluating '{}' on the comparison fast path", expression);
            return chain.get().evaluate(table);
        }

        log.debug("Evaluating '{}' row by row", expression);
        RowExpression parsed = parser.parse(expression);
        ExpressionEvaluator evaluator = new ExpressionEvaluator(table);
        evaluator.validate(parsed);
        return RowMask.where(table.totalRowCount(), row -> evaluator.test(parsed, row));
    }
}
