package com.tableview.table;

import java.util.Locale;

/**
 * How a filter clause joins the mask built by the clauses before it.
 */
public enum Connective {
    AND,
    OR,
    /** Keep rows selected so far that the clause does not select. */
    NOT;

    boolean combine(boolean accumulated, boolean clause) {
        return switch (this) {
            case AND -> accumulated && clause;
            case OR -> accumulated || clause;
            case NOT -> accumulated && !clause;
        };
    }

    public RowMask apply(RowMask accumulated, RowMask clause) {
        return switch (this) {
            case AND -> accumulated.and(clause);
            case OR -> accumulated.or(clause);
            case NOT -> accumulated.andNot(clause);
        };
    }

    /**
     * Parses {@code and}, {@code or} or {@code not} in any case; blank means {@link #AND}.
     */
    public static Connective parse(String text) {
        if (text == null || text.isBlank()) {
            return AND;
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown connective: " + text);
        }
    }
}
