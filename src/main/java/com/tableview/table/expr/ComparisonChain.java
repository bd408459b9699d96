package com.tableview.table.expr;

import com.tableview.table.DataTable;
import com.tableview.table.RowMask;
import com.tableview.table.expr.ExpressionLexer.Kind;
import com.tableview.table.expr.ExpressionLexer.Token;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Fast path for the common shape {@code column OP literal}, joined by {@code and} / {@code or}.
 * Each comparison is evaluated down its column in one pass; {@code and} binds tighter than
 * {@code or}. Anything else is left to {@link ExpressionParser}.
 */
final class ComparisonChain {

    record Term(int column, CompareOp op, Object literal) {}

    /** Disjunction of conjunctions. */
    private final MutableList<MutableList<Term>> groups;

    private ComparisonChain(MutableList<MutableList<Term>> groups) {
        this.groups = groups;
    }

    /**
     * Compiles {@code expression} against {@code table}, or returns empty when the expression
     * is not a flat comparison chain over known columns.
     */
    static Optional<ComparisonChain> compile(String expression, DataTable table) {
        MutableList<Token> tokens;
        try {
            tokens = ExpressionLexer.tokenize(expression);
        } catch (QueryException e) {
            return Optional.empty();
        }

        MutableList<MutableList<Term>> groups = Lists.mutable.empty();
        MutableList<Term> group = Lists.mutable.empty();
        int i = 0;
        while (true) {
            if (i + 2 >= tokens.size()) {
                return Optional.empty();
            }
            Token name = tokens.get(i);
            Token op = tokens.get(i + 1);
            Token value = tokens.get(i + 2);

            if (name.kind() != Kind.IDENTIFIER && name.kind() != Kind.COLUMN) {
                return Optional.empty();
            }
            int column = table.columnIndex(name.text());
            Optional<CompareOp> compareOp = op.kind() == Kind.OPERATOR ? CompareOp.fromSymbol(op.text()) : Optional.empty();
            Optional<Object> literal = literal(value);
            if (column < 0 || compareOp.isEmpty() || literal.isEmpty()) {
                return Optional.empty();
            }
            group.add(new Term(column, compareOp.get(), literal.get() == NULL ? null : literal.get()));

            Token joiner = tokens.get(i + 3);
            if (joiner.kind() == Kind.END) {
                groups.add(group);
                return Optional.of(new ComparisonChain(groups));
            }
            if (joiner.isWord("or")) {
                groups.add(group);
                group = Lists.mutable.empty();
            } else if (!joiner.isWord("and")) {
                return Optional.empty();
            }
            i += 4;
        }
    }

    private static final Object NULL = new Object();

    private static Optional<Object> literal(Token token) {
        switch (token.kind()) {
            case NUMBER:
                try {
                    return Optional.of(token.text().matches("\\d{1,18}")
                        ? (Object) Long.parseLong(token.text())
                        : (Object) Double.parseDouble(token.text()));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            case STRING:
                return Optional.of(token.text());
            case IDENTIFIER:
                return switch (token.text()) {
                    case "true", "True" -> Optional.of(Boolean.TRUE);
                    case "false", "False" -> Optional.of(Boolean.FALSE);
                    case "null", "None" -> Optional.of(NULL);
                    default -> Optional.empty();
                };
            default:
                return Optional.empty();
        }
    }

    RowMask evaluate(DataTable table) {
        int rows = table.totalRowCount();
        RowMask result = RowMask.none(rows);
        for (MutableList<Term> group : groups) {
            RowMask conjunction = RowMask.all(rows);
            for (Term term : group) {
                conjunction = conjunction.and(RowMask.where(rows,
                    row -> ExpressionEvaluator.compare(term.op(), table.rawCell(row, term.column()), term.literal())));
            }
            result = result.or(conjunction);
        }
        return result;
    }
}
