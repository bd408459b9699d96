package com.tableview.table.expr;

import com.tableview.table.Cells;
import com.tableview.table.DataTable;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Evaluates a {@link RowExpression} against rows of one table. Column names resolve to the
 * row's cells; everything is evaluated per row.
 */
public class ExpressionEvaluator {
    static final ImmutableSet<String> FUNCTIONS = Sets.immutable.with(
        "len", "lower", "upper", "str", "num", "abs", "contains", "startswith", "endswith", "isnull", "notnull", "list");

    private final DataTable table;

    public ExpressionEvaluator(DataTable table) {
        this.table = table;
    }

    /**
     * Checks column and function names up front, so a bad name fails even on an empty table.
     */
    public void validate(RowExpression expression) {
        if (expression instanceof RowExpression.Column column) {
            if (table.columnIndex(column.name()) < 0) {
                throw new QueryException("Unknown column: " + column.name());
            }
        } else if (expression instanceof RowExpression.Comparison c) {
            validate(c.left());
            validate(c.right());
        } else if (expression instanceof RowExpression.And a) {
            validate(a.left());
            validate(a.right());
        } else if (expression instanceof RowExpression.Or o) {
            validate(o.left());
            validate(o.right());
        } else if (expression instanceof RowExpression.Not n) {
            validate(n.operand());
        } else if (expression instanceof RowExpression.Arithmetic a) {
            validate(a.left());
            validate(a.right());
        } else if (expression instanceof RowExpression.Negate n) {
            validate(n.operand());
        } else if (expression instanceof RowExpression.Call call) {
            if (!FUNCTIONS.contains(call.function())) {
                throw new QueryException("Unknown function: " + call.function());
            }
            call.arguments().forEach(this::validate);
        } else if (expression instanceof RowExpression.In in) {
            validate(in.operand());
            in.candidates().forEach(this::validate);
        }
    }

    public boolean test(RowExpression expression, int row) {
        return truthy(evaluate(expression, row));
    }

    public Object evaluate(RowExpression expression, int row) {
        if (expression instanceof RowExpression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof RowExpression.Column column) {
            int index = table.columnIndex(column.name());
            if (index < 0) {
                throw new QueryException("Unknown column: " + column.name());
            }
            return table.rawCell(row, index);
        }
        if (expression instanceof RowExpression.Comparison c) {
            return compare(c.op(), evaluate(c.left(), row), evaluate(c.right(), row));
        }
        if (expression instanceof RowExpression.And a) {
            return test(a.left(), row) && test(a.right(), row);
        }
        if (expression instanceof RowExpression.Or o) {
            return test(o.left(), row) || test(o.right(), row);
        }
        if (expression instanceof RowExpression.Not n) {
            return !test(n.operand(), row);
        }
        if (expression instanceof RowExpression.Negate n) {
            Object value = evaluate(n.operand(), row);
            if (value == null) {
                return null;
            }
            if (value instanceof Long l) {
                return -l;
            }
            return -requireNumber(value, "-");
        }
        if (expression instanceof RowExpression.Arithmetic a) {
            return arithmetic(a.operator(), evaluate(a.left(), row), evaluate(a.right(), row));
        }
        if (expression instanceof RowExpression.In in) {
            Object value = evaluate(in.operand(), row);
            boolean found = false;
            for (RowExpression candidate : in.candidates()) {
                if (compare(CompareOp.EQ, value, evaluate(candidate, row))) {
                    found = true;
                    break;
                }
            }
            return found != in.negated();
        }
        if (expression instanceof RowExpression.Call call) {
            return call(call, row);
        }
        throw new QueryException("Unsupported expression: " + expression);
    }

    private Object call(RowExpression.Call call, int row) {
        List<RowExpression> args = call.arguments();
        switch (call.function()) {
            case "len":
                return (long) Cells.text(single(call, row)).length();
            case "lower":
                return nullOr(single(call, row), v -> Cells.text(v).toLowerCase(Locale.ROOT));
            case "upper":
                return nullOr(single(call, row), v -> Cells.text(v).toUpperCase(Locale.ROOT));
            case "str":
                return Cells.text(single(call, row));
            case "num":
                return Cells.number(single(call, row));
            case "abs": {
                Object value = single(call, row);
                if (value instanceof Long l) {
                    return Math.abs(l);
                }
                return value == null ? null : Math.abs(requireNumber(value, "abs"));
            }
            case "isnull":
                return single(call, row) == null;
            case "notnull":
                return single(call, row) != null;
            case "contains":
            case "startswith":
            case "endswith": {
                requireArity(call, 2);
                Object subject = evaluate(args.get(0), row);
                String part = Cells.text(evaluate(args.get(1), row));
                if (subject == null) {
                    return false;
                }
                String text = Cells.text(subject);
                return switch (call.function()) {
                    case "contains" -> text.contains(part);
                    case "startswith" -> text.startsWith(part);
                    default -> text.endsWith(part);
                };
            }
            case "list":
                throw new QueryException("A list can only follow 'in'");
            default:
                throw new QueryException("Unknown function: " + call.function());
        }
    }

    private Object single(RowExpression.Call call, int row) {
        requireArity(call, 1);
        return evaluate(call.arguments().get(0), row);
    }

    private static void requireArity(RowExpression.Call call, int arity) {
        if (call.arguments().size() != arity) {
            throw new QueryException(call.function() + "() takes " + arity + " argument(s) but got "
                + call.arguments().size());
        }
    }

    private static Object nullOr(Object value, Function<Object, Object> f) {
        return value == null ? null : f.apply(value);
    }

    /**
     * Compares two cell values. Numbers (and text that parses as a number) compare numerically
     * against numbers; other values compare as text. Anything ordered against {@code null} is
     * false, and {@code null} equals only {@code null}.
     */
    public static boolean compare(CompareOp op, Object left, Object right) {
        if (left == null || right == null) {
            boolean bothNull = left == null && right == null;
            return switch (op) {
                case EQ -> bothNull;
                case NE -> !bothNull;
                default -> false;
            };
        }
        if (left instanceof Boolean a && right instanceof Boolean b) {
            return op.holds(Boolean.compare(a, b));
        }
        if (left instanceof Number || right instanceof Number) {
            Double a = Cells.number(left);
            Double b = Cells.number(right);
            if (a == null || b == null) {
                return op == CompareOp.NE;
            }
            return op.holds(Double.compare(a, b));
        }
        return op.holds(Cells.text(left).compareTo(Cells.text(right)));
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        return !Cells.text(value).isEmpty();
    }

    private static Object arithmetic(char operator, Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (operator == '+' && (left instanceof String || right instanceof String)
            && !(left instanceof Number) && !(right instanceof Number)) {
            return Cells.text(left) + Cells.text(right);
        }
        if (left instanceof Long a && right instanceof Long b && operator != '/') {
            return switch (operator) {
                case '+' -> a + b;
                case '-' -> a - b;
                case '*' -> a * b;
                default -> b == 0 ? null : a % b;
            };
        }
        double a = requireNumber(left, String.valueOf(operator));
        double b = requireNumber(right, String.valueOf(operator));
        return switch (operator) {
            case '+' -> a + b;
            case '-' -> a - b;
            case '*' -> a * b;
            case '/' -> a / b;
            default -> a % b;
        };
    }

    private static double requireNumber(Object value, String operator) {
        Double number = Cells.number(value);
        if (number == null) {
            throw new QueryException("Cannot apply " + operator + " to non-numeric value '" + Cells.text(value) + "'");
        }
        return number;
    }
}
