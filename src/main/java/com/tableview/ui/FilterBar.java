package com.tableview.ui;

import com.tableview.table.Connective;
import com.tableview.table.DataTable;
import com.tableview.table.FilterClause;
import com.tableview.table.FilterOperator;
import com.tableview.table.RowFilterEvaluator;
import com.tableview.table.expr.QueryException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.Box;
import javax.swing.BoxLayout;
import javax.swing.JButton;
import javax.swing.JComboBox;
import javax.swing.JLabel;
import javax.swing.JPanel;
import javax.swing.JTextField;
import java.awt.BorderLayout;
import java.awt.Color;
import java.awt.FlowLayout;
import java.util.Arrays;
import java.util.List;

/**
 * Query controls above a table: a free-form expression plus any number of structured clauses.
 * Applying filters the table in place; resetting shows every row again.
 */
public class FilterBar extends JPanel {
    private static final Logger log = LoggerFactory.getLogger(FilterBar.class);

    private final DataTable table;
    private final Runnable onChange;
    private final ViewerSettings settings;
    private final RowFilterEvaluator evaluator = new RowFilterEvaluator();

    private final JTextField expressionField = new JTextField(30);
    private final JPanel clausePanel = new JPanel();
    private final MutableList<ClauseRow> clauseRows = Lists.mutable.empty();
    private final JLabel status = new JLabel(" ");

    public FilterBar(DataTable table, ViewerSettings settings, Runnable onChange) {
        super(new BorderLayout());
        this.table = table;
        this.settings = settings;
        this.onChange = onChange;

        JPanel top = new JPanel(new FlowLayout(FlowLayout.LEFT, settings.padding(), settings.padding()));
        top.add(new JLabel("Query:"));
        expressionField.setFont(settings.font());
        expressionField.addActionListener(e -> apply());
        top.add(settings.decorate(expressionField, "textentry"));

        JButton apply = settings.decorate(new JButton("Apply"), "button");
        apply.addActionListener(e -> apply());
        JButton reset = settings.decorate(new JButton("Reset"), "button");
        reset.addActionListener(e -> reset());
        JButton addClause = settings.decorate(new JButton("+ Filter"), "button");
        addClause.addActionListener(e -> addClause(null));
        top.add(apply);
        top.add(reset);
        top.add(addClause);

        clausePanel.setLayout(new BoxLayout(clausePanel, BoxLayout.Y_AXIS));
        status.setFont(settings.font());

        add(top, BorderLayout.NORTH);
        add(clausePanel, BorderLayout.CENTER);
        add(settings.decorate(status, "label"), BorderLayout.SOUTH);
        setBorder(BorderFactory.createEmptyBorder(0, settings.padding(), 0, settings.padding()));
        settings.decorate(this, "filter");
        showCount();
    }

    public void setExpression(String expression) {
        expressionField.setText(expression == null ? "" : expression);
    }

    public String expression() {
        return expressionField.getText();
    }

    public void addClause(FilterClause clause) {
        ClauseRow row = new ClauseRow(clause);
        clauseRows.add(row);
        clausePanel.add(row);
        clausePanel.revalidate();
        clausePanel.repaint();
    }

    public List<FilterClause> clauses() {
        return clauseRows.collect(ClauseRow::toClause);
    }

    /**
     * Filters the table with the current expression and clauses.
     *
     * @return false if the query could not be evaluated; the table is left unchanged
     */
    public boolean apply() {
        try {
            evaluator.apply(table, expression(), clauses());
            showCount();
            onChange.run();
            return true;
        } catch (QueryException e) {
            log.info("query failed on {}: {}", table.name(), e.getMessage());
            status.setForeground(Color.RED);
            status.setText(e.getMessage());
            return false;
        }
    }

    public void reset() {
        expressionField.setText("");
        clauseRows.forEach(clausePanel::remove);
        clauseRows.clear();
        clausePanel.revalidate();
        clausePanel.repaint();
        table.clearFilter();
        showCount();
        onChange.run();
    }

    String statusText() {
        return status.getText();
    }

    private void showCount() {
        status.setForeground(getForeground());
        status.setText(table.isFiltered()
            ? table.rowCount() + " of " + table.totalRowCount() + " rows"
            : table.totalRowCount() + " rows");
    }

    private final class ClauseRow extends JPanel {
        private final JComboBox<String> connective = new JComboBox<>(
            Arrays.stream(Connective.values()).map(Enum::name).toArray(String[]::new));
        private final JComboBox<String> column = new JComboBox<>(table.columns().toArray(new String[0]));
        private final JComboBox<String> operator = new JComboBox<>(
            Arrays.stream(FilterOperator.values()).map(FilterOperator::label).toArray(String[]::new));
        private final JTextField value = new JTextField(12);

        ClauseRow(FilterClause clause) {
            super(new FlowLayout(FlowLayout.LEFT, settings.padding(), 0));
            operator.setEditable(true);
            if (clause != null) {
                connective.setSelectedItem(clause.connective().name());
                column.setSelectedItem(clause.column());
                operator.setSelectedItem(clause.operator());
                value.setText(clause.value());
            }
            JButton remove = new JButton("x");
            remove.addActionListener(e -> {
                clauseRows.remove(this);
                clausePanel.remove(this);
                clausePanel.revalidate();
                clausePanel.repaint();
            });
            add(settings.decorate(connective, "combobox"));
            add(settings.decorate(column, "combobox"));
            add(settings.decorate(operator, "combobox"));
            add(settings.decorate(value, "textentry"));
            add(remove);
            add(Box.createHorizontalGlue());
        }

        FilterClause toClause() {
            return new FilterClause(
                (String) column.getSelectedItem(),
                String.valueOf(operator.getSelectedItem()),
                value.getText(),
                Connective.valueOf((String) connective.getSelectedItem()));
        }
    }
}
