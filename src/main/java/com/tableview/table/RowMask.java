package com.tableview.table;

import org.eclipse.collections.api.list.primitive.BooleanList;
import org.eclipse.collections.api.list.primitive.MutableBooleanList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.primitive.BooleanLists;
import org.eclipse.collections.impl.factory.primitive.IntLists;

import java.util.function.IntPredicate;

/**
 * One flag per table row; {@code true} keeps the row.
 */
public final class RowMask {
    private final MutableBooleanList flags;

    private RowMask(MutableBooleanList flags) {
        this.flags = flags;
    }

    public static RowMask all(int size) {
        return fill(size, true);
    }

    public static RowMask none(int size) {
        return fill(size, false);
    }

    public static RowMask of(boolean... flags) {
        return new RowMask(BooleanLists.mutable.with(flags));
    }

    public static RowMask where(int size, IntPredicate predicate) {
        MutableBooleanList flags = BooleanLists.mutable.empty();
        for (int row = 0; row < size; row++) {
            flags.add(predicate.test(row));
        }
        return new RowMask(flags);
    }

    private static RowMask fill(int size, boolean value) {
        MutableBooleanList flags = BooleanLists.mutable.empty();
        for (int i = 0; i < size; i++) {
            flags.add(value);
        }
        return new RowMask(flags);
    }

    public int size() {
        return flags.size();
    }

    public boolean get(int row) {
        return flags.get(row);
    }

    public int count() {
        return flags.count(flag -> flag);
    }

    public RowMask and(RowMask other) {
        return zip(other, Connective.AND);
    }

    public RowMask or(RowMask other) {
        return zip(other, Connective.OR);
    }

    public RowMask andNot(RowMask other) {
        return zip(other, Connective.NOT);
    }

    private RowMask zip(RowMask other, Connective connective) {
        if (other.size() != size()) {
            throw new IllegalArgumentException("Mask sizes differ: " + size() + " vs " + other.size());
        }
        MutableBooleanList result = BooleanLists.mutable.empty();
        for (int i = 0; i < size(); i++) {
            result.add(connective.combine(flags.get(i), other.flags.get(i)));
        }
        return new RowMask(result);
    }

    /** Indexes of the kept rows, ascending. */
    public MutableIntList selected() {
        MutableIntList rows = IntLists.mutable.empty();
        for (int i = 0; i < flags.size(); i++) {
            if (flags.get(i)) {
                rows.add(i);
            }
        }
        return rows;
    }

    public BooleanList flags() {
        return flags.asUnmodifiable();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RowMask other && flags.equals(other.flags);
    }

    @Override
    public int hashCode() {
        return flags.hashCode();
    }

    @Override
    public String toString() {
        return flags.toString();
    }
}
