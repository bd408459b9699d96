package com.tableview.output;

import com.tableview.table.Cells;
import com.tableview.table.DataTable;
import com.tableview.table.TableSnapshot;
import com.tableview.tree.DisplayNode;
import com.tableview.tree.DisplayTree;

/**
 * Plain-text rendering of trees and tables, for print mode.
 */
public class TextRenderer {
    static final int MAX_CELL_WIDTH = 40;

    public String renderTree(DisplayTree tree) {
        StringBuilder sb = new StringBuilder();
        tree.roots().forEach(id -> renderNode(tree, id, 0, sb));
        return sb.toString();
    }

    private void renderNode(DisplayTree tree, int id, int depth, StringBuilder sb) {
        DisplayNode node = tree.node(id);
        sb.append("  ".repeat(depth)).append(node.label());
        if (node.isLeaf()) {
            sb.append(node.label().endsWith(":") ? " " : ": ").append(node.value());
        }
        sb.append('\n');
        node.children().forEach(child -> renderNode(tree, child, depth + 1, sb));
    }

    public String renderSnapshot(TableSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        for (DataTable table : snapshot.tables()) {
            if (snapshot.size() > 1) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append("== ").append(table.name()).append(" ==\n");
            }
            sb.append(renderTable(table));
        }
        return sb.toString();
    }

    /**
     * Visible rows of {@code table} as aligned columns under a header line.
     */
    public String renderTable(DataTable table) {
        int columns = table.columnCount();
        int rows = table.rowCount();
        String[][] grid = new String[rows + 1][columns];
        int[] widths = new int[columns];

        for (int c = 0; c < columns; c++) {
            grid[0][c] = clip(table.columns().get(c));
            widths[c] = grid[0][c].length();
        }
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                String text = clip(Cells.text(table.cell(r, c)));
                grid[r + 1][c] = text;
                widths[c] = Math.max(widths[c], text.length());
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int r = 0; r <= rows; r++) {
            appendLine(grid[r], widths, sb);
            if (r == 0) {
                String[] rule = new String[columns];
                for (int c = 0; c < columns; c++) {
                    rule[c] = "-".repeat(widths[c]);
                }
                appendLine(rule, widths, sb);
            }
        }
        sb.append('(').append(rows).append(rows == 1 ? " row" : " rows");
        if (table.isFiltered()) {
            sb.append(" of ").append(table.totalRowCount());
        }
        sb.append(")\n");
        return sb.toString();
    }

    private static void appendLine(String[] cells, int[] widths, StringBuilder sb) {
        for (int c = 0; c < cells.length; c++) {
            if (c > 0) {
                sb.append("  ");
            }
            boolean last = c == cells.length - 1;
            sb.append(last ? cells[c] : pad(cells[c], widths[c]));
        }
        sb.append('\n');
    }

    private static String pad(String text, int width) {
        return text + " ".repeat(width - text.length());
    }

    private static String clip(String text) {
        String flat = text.replace("\r", "").replace('\n', ' ');
        return flat.length() > MAX_CELL_WIDTH ? flat.substring(0, MAX_CELL_WIDTH - 3) + "..." : flat;
    }
}
