package com.tableview.table;

/**
 * One structured row rule from the filter bar. {@code operator} is kept as typed so that an
 * unknown operator can be skipped instead of rejected.
 */
public record FilterClause(String column, String operator, String value, Connective connective) {

    public FilterClause {
        if (connective == null) {
            connective = Connective.AND;
        }
        if (value == null) {
            value = "";
        }
    }

    public static FilterClause of(String column, String operator, String value) {
        return new FilterClause(column, operator, value, Connective.AND);
    }

    /**
     * Parses {@code column:operator:value[:connective]}, as given on the command line. The value
     * may itself contain colons; only a trailing {@code and}, {@code or} or {@code not} is read
     * as the connective.
     */
    public static FilterClause parse(String text) {
        String[] parts = text.split(":", 3);
        if (parts.length < 2) {
            throw new IllegalArgumentException("Expected column:operator[:value[:connective]] but got: " + text);
        }
        String value = parts.length == 3 ? parts[2] : "";
        Connective connective = Connective.AND;
        int last = value.lastIndexOf(':');
        if (last >= 0 && isConnective(value.substring(last + 1))) {
            connective = Connective.parse(value.substring(last + 1));
            value = value.substring(0, last);
        }
        return new FilterClause(parts[0], parts[1], value, connective);
    }

    private static boolean isConnective(String text) {
        if (text.isBlank()) {
            return true;
        }
        for (Connective connective : Connective.values()) {
            if (connective.name().equalsIgnoreCase(text.trim())) {
                return true;
            }
        }
        return false;
    }
}
