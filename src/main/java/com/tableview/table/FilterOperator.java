package com.tableview.table;

import java.util.Locale;
import java.util.Optional;

/**
 * Per-cell tests offered by the filter bar. Labels are matched case-sensitively.
 */
public enum FilterOperator {
    CONTAINS("contains") {
        @Override
        public boolean test(Object cell, String value) {
            return cell != null && Cells.text(cell).contains(value);
        }
    },
    EXCLUDES("excludes") {
        @Override
        public boolean test(Object cell, String value) {
            return !CONTAINS.test(cell, value);
        }
    },
    EQUALS("equals") {
        @Override
        public boolean test(Object cell, String value) {
            if (cell == null) {
                return false;
            }
            Double expected = Cells.parseNumber(value);
            if (expected != null) {
                Double actual = Cells.number(cell);
                return actual != null && actual.doubleValue() == expected.doubleValue();
            }
            return Cells.text(cell).equals(value);
        }
    },
    NOT_EQUALS("not equals") {
        @Override
        public boolean test(Object cell, String value) {
            return !EQUALS.test(cell, value);
        }
    },
    GREATER(">") {
        @Override
        public boolean test(Object cell, String value) {
            Double actual = Cells.number(cell);
            Double bound = Cells.parseNumber(value);
            return actual != null && bound != null && actual > bound;
        }
    },
    LESS("<") {
        @Override
        public boolean test(Object cell, String value) {
            Double actual = Cells.number(cell);
            Double bound = Cells.parseNumber(value);
            return actual != null && bound != null && actual < bound;
        }
    },
    IS_EMPTY("is empty") {
        @Override
        public boolean test(Object cell, String value) {
            return cell == null || (cell instanceof String s && s.isEmpty());
        }
    },
    NOT_EMPTY("not empty") {
        @Override
        public boolean test(Object cell, String value) {
            return !IS_EMPTY.test(cell, value);
        }
    },
    STARTS_WITH("starts with") {
        @Override
        public boolean test(Object cell, String value) {
            return cell != null && Cells.text(cell).startsWith(value);
        }
    },
    HAS_LENGTH("has length") {
        @Override
        public boolean test(Object cell, String value) {
            Double length = Cells.parseNumber(value);
            return cell != null && length != null && Cells.text(cell).length() > length;
        }
    },
    IS_NUMBER("is number") {
        @Override
        public boolean test(Object cell, String value) {
            if (cell instanceof Number) {
                return true;
            }
            return cell instanceof String s && !s.isEmpty() && s.chars().allMatch(Character::isDigit);
        }
    },
    IS_LOWERCASE("is lowercase") {
        @Override
        public boolean test(Object cell, String value) {
            return cell instanceof String s && hasCased(s) && s.equals(s.toLowerCase(Locale.ROOT));
        }
    },
    IS_UPPERCASE("is uppercase") {
        @Override
        public boolean test(Object cell, String value) {
            return cell instanceof String s && hasCased(s) && s.equals(s.toUpperCase(Locale.ROOT));
        }
    };

    private final String label;

    FilterOperator(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public abstract boolean test(Object cell, String value);

    public static Optional<FilterOperator> fromLabel(String label) {
        for (FilterOperator operator : values()) {
            if (operator.label.equals(label)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    private static boolean hasCased(String s) {
        return s.chars().anyMatch(c -> Character.isUpperCase(c) || Character.isLowerCase(c));
    }

    @Override
    public String toString() {
        return label;
    }
}
