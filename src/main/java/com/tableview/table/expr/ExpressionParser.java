package com.tableview.table.expr;

import com.tableview.table.expr.ExpressionLexer.Kind;
import com.tableview.table.expr.ExpressionLexer.Token;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Recursive-descent parser for row expressions.
 *
 * <pre>
 * or         := and (("or" | "||" | "|") and)*
 * and        := not (("and" | "&amp;&amp;" | "&amp;") not)*
 * not        := ("not" | "!" | "~") not | comparison
 * comparison := sum ((== | != | &gt; | &gt;= | &lt; | &lt;=) sum | ["not"] "in" list)?
 * sum        := product (("+" | "-") product)*
 * product    := unary (("*" | "/" | "%") unary)*
 * unary      := "-" unary | primary
 * primary    := number | string | true | false | null | name "(" args ")" | name | `name` | "(" or ")" | list
 * </pre>
 *
 * Keywords are matched in lower case, plus {@code True}, {@code False} and {@code None}.
 */
public class ExpressionParser {

    public RowExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new QueryException("Empty expression");
        }
        return new Cursor(ExpressionLexer.tokenize(expression)).parseAll();
    }

    private static final class Cursor {
        private final MutableList<Token> tokens;
        private int position;

        Cursor(MutableList<Token> tokens) {
            this.tokens = tokens;
        }

        RowExpression parseAll() {
            RowExpression expression = parseOr();
            if (peek().kind() != Kind.END) {
                throw unexpected(peek());
            }
            return expression;
        }

        private RowExpression parseOr() {
            RowExpression left = parseAnd();
            while (peek().isWord("or") || peek().is(Kind.OPERATOR, "||") || peek().is(Kind.OPERATOR, "|")) {
                next();
                left = new RowExpression.Or(left, parseAnd());
            }
            return left;
        }

        private RowExpression parseAnd() {
            RowExpression left = parseNot();
            while (peek().isWord("and") || peek().is(Kind.OPERATOR, "&&") || peek().is(Kind.OPERATOR, "&")) {
                next();
                left = new RowExpression.And(left, parseNot());
            }
            return left;
        }

        private RowExpression parseNot() {
            Token token = peek();
            if (token.isWord("not") || token.is(Kind.OPERATOR, "!") || token.is(Kind.OPERATOR, "~")) {
                next();
                return new RowExpression.Not(parseNot());
            }
            return parseComparison();
        }

        private RowExpression parseComparison() {
            RowExpression left = parseSum();
            Token token = peek();
            if (token.kind() == Kind.OPERATOR) {
                var op = CompareOp.fromSymbol(token.text());
                if (op.isPresent()) {
                    next();
                    return new RowExpression.Comparison(op.get(), left, parseSum());
                }
            }
            if (token.isWord("in")) {
                next();
                return new RowExpression.In(left, parseList(), false);
            }
            if (token.isWord("not") && peekAt(1).isWord("in")) {
                next();
                next();
                return new RowExpression.In(left, parseList(), true);
            }
            return left;
        }

        private RowExpression parseSum() {
            RowExpression left = parseProduct();
            while (peek().is(Kind.OPERATOR, "+") || peek().is(Kind.OPERATOR, "-")) {
                char operator = next().text().charAt(0);
                left = new RowExpression.Arithmetic(operator, left, parseProduct());
            }
            return left;
        }

        private RowExpression parseProduct() {
            RowExpression left = parseUnary();
            while (peek().is(Kind.OPERATOR, "*") || peek().is(Kind.OPERATOR, "/") || peek().is(Kind.OPERATOR, "%")) {
                char operator = next().text().charAt(0);
                left = new RowExpression.Arithmetic(operator, left, parseUnary());
            }
            return left;
        }

        private RowExpression parseUnary() {
            if (peek().is(Kind.OPERATOR, "-")) {
                next();
                return new RowExpression.Negate(parseUnary());
            }
            return parsePrimary();
        }

        private RowExpression parsePrimary() {
            Token token = next();
            switch (token.kind()) {
                case NUMBER:
                    return new RowExpression.Literal(parseNumber(token));
                case STRING:
                    return new RowExpression.Literal(token.text());
                case COLUMN:
                    return new RowExpression.Column(token.text());
                case LPAREN: {
                    RowExpression inner = parseOr();
                    expect(Kind.RPAREN);
                    return inner;
                }
                case LBRACKET:
                    position--;
                    return new RowExpression.Call("list", parseList());
                case IDENTIFIER:
                    return parseName(token);
                default:
                    throw unexpected(token);
            }
        }

        private RowExpression parseName(Token token) {
            switch (token.text()) {
                case "true":
                case "True":
                    return new RowExpression.Literal(Boolean.TRUE);
                case "false":
                case "False":
                    return new RowExpression.Literal(Boolean.FALSE);
                case "null":
                case "None":
                    return new RowExpression.Literal(null);
                default:
                    break;
            }
            if (peek().kind() == Kind.LPAREN) {
                next();
                MutableList<RowExpression> arguments = Lists.mutable.empty();
                if (peek().kind() != Kind.RPAREN) {
                    do {
                        arguments.add(parseOr());
                    } while (accept(Kind.COMMA));
                }
                expect(Kind.RPAREN);
                return new RowExpression.Call(token.text(), arguments);
            }
            return new RowExpression.Column(token.text());
        }

        private MutableList<RowExpression> parseList() {
            expect(Kind.LBRACKET);
            MutableList<RowExpression> items = Lists.mutable.empty();
            if (peek().kind() != Kind.RBRACKET) {
                do {
                    items.add(parseOr());
                } while (accept(Kind.COMMA));
            }
            expect(Kind.RBRACKET);
            return items;
        }

        private static Object parseNumber(Token token) {
            String text = token.text();
            try {
                if (text.matches("\\d{1,18}")) {
                    return Long.parseLong(text);
                }
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new QueryException("Invalid number '" + text + "' at position " + token.position(), e);
            }
        }

        private Token peek() {
            return tokens.get(position);
        }

        private Token peekAt(int offset) {
            return tokens.get(Math.min(position + offset, tokens.size() - 1));
        }

        private Token next() {
            Token token = tokens.get(position);
            if (token.kind() != Kind.END) {
                position++;
            }
            return token;
        }

        private boolean accept(Kind kind) {
            if (peek().kind() == kind) {
                next();
                return true;
            }
            return false;
        }

        private void expect(Kind kind) {
            Token token = next();
            if (token.kind() != kind) {
                throw unexpected(token);
            }
        }

        private static QueryException unexpected(Token token) {
            if (token.kind() == Kind.END) {
                return new QueryException("Unexpected end of expression");
            }
            return new QueryException("Unexpected '" + token.text() + "' at position " + token.position());
        }
    }
}
