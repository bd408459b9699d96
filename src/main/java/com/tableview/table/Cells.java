package com.tableview.table;

/**
 * Helpers for reading table cells, which hold {@code String}, {@code Long}, {@code Double},
 * {@code Boolean}, {@code byte[]} or {@code null}.
 */
public final class Cells {

    private Cells() {
    }

    public static String text(Object cell) {
        if (cell == null) {
            return "";
        }
        if (cell instanceof byte[] bytes) {
            return "<" + bytes.length + " bytes>";
        }
        return cell.toString();
    }

    /**
     * Numeric value of a cell, parsing text cells; {@code null} when the cell is not a number.
     */
    public static Double number(Object cell) {
        if (cell instanceof Number n) {
            return n.doubleValue();
        }
        if (cell instanceof String s) {
            return parseNumber(s);
        }
        return null;
    }

    public static Double parseNumber(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            double value = Double.parseDouble(trimmed);
            return Double.isNaN(value) ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Types a raw text field the way loaders store it: integers as {@code Long}, decimals as
     * {@code Double}, empty text as {@code null}, anything else unchanged.
     */
    public static Object sniff(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.matches("[-+]?\\d{1,18}")) {
            return Long.parseLong(trimmed);
        }
        if (trimmed.matches("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?")) {
            return Double.parseDouble(trimmed);
        }
        return raw;
    }
}
