package com.tableview.table;

import com.tableview.table.expr.QueryException;
import com.tableview.table.expr.RowQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Builds the row selection for the filter bar from a free-form expression and a list of
 * structured clauses.
 *
 * <p>Clauses combine strictly left to right with their own connective, without precedence:
 * {@code A OR B AND C} means {@code (A OR B) AND C}. The first clause starts the mask and its
 * connective is ignored, unless an expression was given, in which case the expression's mask
 * comes first and every clause combines with it. With no expression and no clauses every row
 * is selected.
 */
public class RowFilterEvaluator {
    private static final Logger log = LoggerFactory.getLogger(RowFilterEvaluator.class);

    private final RowQuery query = new RowQuery();

    public RowMask evaluate(DataTable table, String expression, List<FilterClause> clauses) {
        int rows = table.totalRowCount();
        RowMask mask = null;

        if (expression != null && !expression.isBlank()) {
            mask = query.evaluate(table, expression.trim());
        }

        for (FilterClause clause : clauses) {
            Optional<FilterOperator> operator = FilterOperator.fromLabel(clause.operator());
            if (operator.isEmpty()) {
                log.warn("Skipping filter on {}: unknown operator '{}'", clause.column(), clause.operator());
                continue;
            }
            RowMask clauseMask = evaluate(table, clause, operator.get());
            mask = mask == null ? clauseMask : clause.connective().apply(mask, clauseMask);
        }

        return mask == null ? RowMask.all(rows) : mask;
    }

    /**
     * Applies the selection to {@code table}. An empty expression with no clauses clears the
     * filter.
     */
    public RowMask apply(DataTable table, String expression, List<FilterClause> clauses) {
        RowMask mask = evaluate(table, expression, clauses);
        if ((expression == null || expression.isBlank()) && clauses.isEmpty()) {
            table.clearFilter();
        } else {
            table.applyFilter(mask);
        }
        log.debug("{}: {} of {} rows selected", table.name(), mask.count(), mask.size());
        return mask;
    }

    private static RowMask evaluate(DataTable table, FilterClause clause, FilterOperator operator) {
        int column = table.columnIndex(clause.column());
        if (column < 0) {
            throw new QueryException("Unknown column: " + clause.column());
        }
        String value = clause.value();
        return RowMask.where(table.totalRowCount(), row -> operator.test(table.rawCell(row, column), value));
    }
}
