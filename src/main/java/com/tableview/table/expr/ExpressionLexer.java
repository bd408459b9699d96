package com.tableview.table.expr;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Splits a row expression into tokens. Shared by the fast comparison path and the full parser.
 */
final class ExpressionLexer {

    enum Kind { NUMBER, STRING, IDENTIFIER, COLUMN, OPERATOR, LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, END }

    record Token(Kind kind, String text, int position) {
        boolean is(Kind k, String t) {
            return kind == k && text.equals(t);
        }

        boolean isWord(String word) {
            return kind == Kind.IDENTIFIER && text.equals(word);
        }
    }

    private static final String[] OPERATORS = {
        "==", "!=", ">=", "<=", "&&", "||", ">", "<", "+", "-", "*", "/", "%", "!", "~", "&", "|"
    };

    private ExpressionLexer() {
    }

    static MutableList<Token> tokenize(String expression) {
        MutableList<Token> tokens = Lists.mutable.empty();
        int i = 0;
        int n = expression.length();
        while (i < n) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(expression.charAt(i + 1)))) {
                int start = i;
                while (i < n && (Character.isDigit(expression.charAt(i)) || expression.charAt(i) == '.')) {
                    i++;
                }
                if (i < n && (expression.charAt(i) == 'e' || expression.charAt(i) == 'E')) {
                    i++;
                    if (i < n && (expression.charAt(i) == '+' || expression.charAt(i) == '-')) {
                        i++;
                    }
                    while (i < n && Character.isDigit(expression.charAt(i))) {
                        i++;
                    }
                }
                tokens.add(new Token(Kind.NUMBER, expression.substring(start, i), start));
            } else if (c == '\'' || c == '"') {
                int start = i;
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < n && expression.charAt(i) != c) {
                    char ch = expression.charAt(i);
                    if (ch == '\\' && i + 1 < n) {
                        i++;
                        ch = expression.charAt(i);
                    }
                    sb.append(ch);
                    i++;
                }
                if (i >= n) {
                    throw new QueryException("Unterminated string starting at position " + start);
                }
                i++;
                tokens.add(new Token(Kind.STRING, sb.toString(), start));
            } else if (c == '`') {
                int start = i;
                int close = expression.indexOf('`', i + 1);
                if (close < 0) {
                    throw new QueryException("Unterminated column name starting at position " + start);
                }
                tokens.add(new Token(Kind.COLUMN, expression.substring(i + 1, close), start));
                i = close + 1;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(expression.charAt(i)) || expression.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(Kind.IDENTIFIER, expression.substring(start, i), start));
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")", i++));
            } else if (c == '[') {
                tokens.add(new Token(Kind.LBRACKET, "[", i++));
            } else if (c == ']') {
                tokens.add(new Token(Kind.RBRACKET, "]", i++));
            } else if (c == ',') {
                tokens.add(new Token(Kind.COMMA, ",", i++));
            } else {
                String operator = matchOperator(expression, i);
                if (operator == null) {
                    throw new QueryException("Unexpected character '" + c + "' at position " + i);
                }
                tokens.add(new Token(Kind.OPERATOR, operator, i));
                i += operator.length();
            }
        }
        tokens.add(new Token(Kind.END, "", n));
        return tokens;
    }

    private static String matchOperator(String expression, int position) {
        for (String operator : OPERATORS) {
            if (expression.startsWith(operator, position)) {
                return operator;
            }
        }
        return null;
    }
}
