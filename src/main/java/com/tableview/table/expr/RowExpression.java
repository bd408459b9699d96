package com.tableview.table.expr;

import java.util.List;

public sealed interface RowExpression {
    record Column(String name) implements RowExpression {}
    record Literal(Object value) implements RowExpression {}
    record Comparison(CompareOp op, RowExpression left, RowExpression right) implements RowExpression {}
    record And(RowExpression left, RowExpression right) implements RowExpression {}
    record Or(RowExpression left, RowExpression right) implements RowExpression {}
    record Not(RowExpression operand) implements RowExpression {}
    record Arithmetic(char operator, RowExpression left, RowExpression right) implements RowExpression {}
    record Negate(RowExpression operand) implements RowExpression {}
    record Call(String function, List<RowExpression> arguments) implements RowExpression {}  // len(name), lower(city)
    record In(RowExpression operand, List<RowExpression> candidates, boolean negated) implements RowExpression {}
}
