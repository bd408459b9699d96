package com.tableview.table;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.eclipse.collections.impl.list.primitive.IntInterval;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named grid of cells. All loaded rows are kept; a filter only changes which of them are
 * visible, so {@link #clearFilter()} always restores the full table.
 */
public class DataTable {
    private final String name;
    private final ImmutableList<String> columns;
    private final ImmutableList<Object[]> rows;
    private MutableIntList visible;
    private RowMask filter;

    /**
     * Rows shorter than the headings are padded with nulls. Rows longer than the headings add
     * columns named {@code Unnamed: <index>}, so no loaded cell is dropped.
     */
    public DataTable(String name, List<String> columns, List<Object[]> rows) {
        this.name = name;
        this.columns = widen(columns, rows);
        int width = this.columns.size();
        MutableList<Object[]> padded = Lists.mutable.withInitialCapacity(rows.size());
        for (Object[] row : rows) {
            padded.add(row.length == width ? row : Arrays.copyOf(row, width));
        }
        this.rows = padded.toImmutable();
        this.visible = allRows();
    }

    private static ImmutableList<String> widen(List<String> columns, List<Object[]> rows) {
        int width = columns.size();
        for (Object[] row : rows) {
            width = Math.max(width, row.length);
        }
        if (width == columns.size()) {
            return Lists.immutable.withAll(columns);
        }
        MutableList<String> headings = Lists.mutable.withAll(columns);
        while (headings.size() < width) {
            headings.add(null);
        }
        return ColumnNames.uniquify(headings).toImmutable();
    }

    /**
     * Builds a table from rows of cells where the first row holds the headings.
     */
    public static DataTable fromGrid(String name, List<? extends List<?>> grid) {
        if (grid.isEmpty()) {
            return new DataTable(name, Lists.mutable.empty(), Lists.mutable.empty());
        }
        MutableList<String> headings = Lists.mutable.empty();
        grid.get(0).forEach(h -> headings.add(h == null ? null : h.toString()));
        MutableList<String> columns = ColumnNames.uniquify(headings);
        MutableList<Object[]> rows = Lists.mutable.empty();
        for (List<?> row : grid.subList(1, grid.size())) {
            rows.add(row.toArray());
        }
        return new DataTable(name, columns, rows);
    }

    public String name() {
        return name;
    }

    public ImmutableList<String> columns() {
        return columns;
    }

    public int columnCount() {
        return columns.size();
    }

    public int columnIndex(String column) {
        return columns.indexOf(column);
    }

    /** Visible rows. */
    public int rowCount() {
        return visible.size();
    }

    /** All rows, filtered or not. */
    public int totalRowCount() {
        return rows.size();
    }

    /** Cell of a visible row. */
    public Object cell(int row, int column) {
        return rows.get(visible.get(row))[column];
    }

    /** Cell of a row by its index in the full table. */
    public Object rawCell(int row, int column) {
        return rows.get(row)[column];
    }

    public Object rawCell(int row, String column) {
        int index = columnIndex(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rawCell(row, index);
    }

    /** Index in the full table of a visible row. */
    public int sourceRow(int row) {
        return visible.get(row);
    }

    /**
     * Visible row as a column-name keyed map, in column order.
     */
    public Map<String, Object> record(int row) {
        Map<String, Object> record = new LinkedHashMap<>();
        Object[] cells = rows.get(visible.get(row));
        for (int c = 0; c < columns.size(); c++) {
            record.put(columns.get(c), cells[c]);
        }
        return record;
    }

    public void applyFilter(RowMask mask) {
        if (mask.size() != rows.size()) {
            throw new IllegalArgumentException(
                "Mask has " + mask.size() + " rows but table " + name + " has " + rows.size());
        }
        this.filter = mask;
        this.visible = mask.selected();
    }

    public void clearFilter() {
        this.filter = null;
        this.visible = allRows();
    }

    private MutableIntList allRows() {
        return rows.isEmpty() ? IntLists.mutable.empty() : IntInterval.zeroTo(rows.size() - 1).toList();
    }

    public boolean isFiltered() {
        return filter != null;
    }

    /**
     * A copy with rows in reverse order, so the last loaded row shows first.
     */
    public DataTable reversed() {
        return new DataTable(name, columns.castToList(), rows.toReversed().castToList());
    }

    @Override
    public String toString() {
        return name + " (" + rows.size() + " rows x " + columns.size() + " columns)";
    }
}
