package com.tableview.ui;

import com.tableview.table.Cells;
import com.tableview.table.DataTable;

import javax.swing.table.AbstractTableModel;

/**
 * Swing view of the visible rows of a {@link DataTable}.
 */
public class SnapshotTableModel extends AbstractTableModel {
    private final DataTable table;
    private final Class<?>[] columnClasses;

    public SnapshotTableModel(DataTable table) {
        this.table = table;
        this.columnClasses = new Class<?>[table.columnCount()];
        for (int column = 0; column < columnClasses.length; column++) {
            columnClasses[column] = columnClass(column);
        }
    }

    public DataTable table() {
        return table;
    }

    @Override
    public int getRowCount() {
        return table.rowCount();
    }

    @Override
    public int getColumnCount() {
        return table.columnCount();
    }

    @Override
    public String getColumnName(int column) {
        return table.columns().get(column);
    }

    @Override
    public Object getValueAt(int row, int column) {
        Object cell = table.cell(row, column);
        return cell instanceof byte[] ? Cells.text(cell) : cell;
    }

    @Override
    public Class<?> getColumnClass(int column) {
        return columnClasses[column];
    }

    public void refresh() {
        fireTableDataChanged();
    }

    /** Number, Boolean or String when every non-null cell agrees, else Object. */
    private Class<?> columnClass(int column) {
        Class<?> type = null;
        for (int row = 0; row < table.totalRowCount(); row++) {
            Object cell = table.rawCell(row, column);
            if (cell == null) {
                continue;
            }
            Class<?> cellType = cell instanceof Number ? Number.class : cell.getClass();
            if (type == null) {
                type = cellType;
            } else if (type != cellType) {
                return Object.class;
            }
        }
        return type == null || type == byte[].class ? Object.class : type;
    }
}
