package com.tableview.ui;

import com.tableview.data.DataValue;
import com.tableview.data.DataValues;
import com.tableview.output.JsonFormatter;
import com.tableview.table.DataTable;
import com.tableview.table.FilterClause;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import javax.swing.JMenuItem;
import javax.swing.JPanel;
import javax.swing.JPopupMenu;
import javax.swing.JScrollPane;
import javax.swing.JTable;
import javax.swing.table.TableRowSorter;
import java.awt.BorderLayout;
import java.awt.Toolkit;
import java.awt.datatransfer.StringSelection;
import java.util.Comparator;
import java.util.List;

/**
 * One table tab: filter controls on top, a sortable grid below.
 */
public class TablePanel extends JPanel {
    private final DataTable table;
    private final SnapshotTableModel model;
    private final JTable grid;
    private final FilterBar filterBar;

    public TablePanel(DataTable table, ViewerSettings settings) {
        super(new BorderLayout());
        this.table = table;
        this.model = new SnapshotTableModel(table);
        this.grid = new JTable(model);
        grid.setFont(settings.font());
        grid.setRowHeight(grid.getFontMetrics(settings.font()).getHeight() + settings.padding());
        grid.setAutoResizeMode(JTable.AUTO_RESIZE_OFF);
        grid.setFillsViewportHeight(true);

        TableRowSorter<SnapshotTableModel> sorter = new TableRowSorter<>(model);
        for (int column = 0; column < model.getColumnCount(); column++) {
            if (model.getColumnClass(column) == Number.class) {
                sorter.setComparator(column, Comparator.comparingDouble(Number::doubleValue));
            }
        }
        grid.setRowSorter(sorter);

        JPopupMenu popup = new JPopupMenu();
        JMenuItem copy = new JMenuItem("Copy rows as JSON");
        copy.addActionListener(e -> Toolkit.getDefaultToolkit().getSystemClipboard()
            .setContents(new StringSelection(selectedRowsAsJson()), null));
        popup.add(copy);
        grid.setComponentPopupMenu(popup);

        this.filterBar = new FilterBar(table, settings, model::refresh);
        add(filterBar, BorderLayout.NORTH);
        add(new JScrollPane(settings.decorate(grid, "table")), BorderLayout.CENTER);
    }

    public DataTable table() {
        return table;
    }

    public FilterBar filterBar() {
        return filterBar;
    }

    /** Seeds the filter controls and applies them. */
    public boolean applyQuery(String expression, List<FilterClause> clauses) {
        filterBar.setExpression(expression);
        clauses.forEach(filterBar::addClause);
        return filterBar.apply();
    }

    String selectedRowsAsJson() {
        int[] selected = grid.getSelectedRows();
        MutableList<DataValue> records = Lists.mutable.empty();
        for (int viewRow : selected) {
            int row = grid.convertRowIndexToModel(viewRow);
            records.add(DataValues.of(table.record(row)));
        }
        return new JsonFormatter(true, false).format(new DataValue.Sequence(records));
    }
}
