package com.tableview.ui;

import com.tableview.tree.DisplayNode;
import com.tableview.tree.DisplayTree;

import javax.swing.JButton;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JTree;
import javax.swing.tree.DefaultMutableTreeNode;
import javax.swing.tree.DefaultTreeModel;
import javax.swing.tree.TreePath;
import java.awt.BorderLayout;
import java.awt.FlowLayout;

/**
 * Collapsible view of a {@link DisplayTree}. Each row is one node: a branch shows its label,
 * a leaf shows {@code label = value}.
 */
public class TreePanel extends JPanel {
    private final DisplayTree tree;
    private final DefaultMutableTreeNode[] swingNodes;
    private final JTree view;

    public TreePanel(DisplayTree tree, ViewerSettings settings) {
        super(new BorderLayout());
        this.tree = tree;
        this.swingNodes = new DefaultMutableTreeNode[tree.size()];

        DefaultMutableTreeNode root = new DefaultMutableTreeNode(tree.source() == null ? "" : "data");
        tree.roots().forEach(id -> root.add(build(id)));
        view = new JTree(new DefaultTreeModel(root));
        view.setRootVisible(false);
        view.setShowsRootHandles(true);
        view.setFont(settings.font());

        JButton expand = settings.decorate(new JButton("Expand all"), "button");
        expand.addActionListener(e -> expandAll());
        JButton collapse = settings.decorate(new JButton("Collapse all"), "button");
        collapse.addActionListener(e -> collapseAll());
        JPanel buttons = new JPanel(new FlowLayout(FlowLayout.LEFT, settings.padding(), settings.padding()));
        buttons.add(expand);
        buttons.add(collapse);

        add(buttons, BorderLayout.NORTH);
        add(new JScrollPane(settings.decorate(view, "tree")), BorderLayout.CENTER);
        syncExpansion();
    }

    private DefaultMutableTreeNode build(int id) {
        DisplayNode node = tree.node(id);
        DefaultMutableTreeNode swingNode = new DefaultMutableTreeNode(node);
        swingNodes[id] = swingNode;
        node.children().forEach(child -> swingNode.add(build(child)));
        return swingNode;
    }

    public void expandAll() {
        tree.expandAll();
        syncExpansion();
    }

    public void collapseAll() {
        tree.collapseAll();
        syncExpansion();
    }

    public DisplayTree tree() {
        return tree;
    }

    JTree view() {
        return view;
    }

    /** Pushes the expansion flags of the display tree onto the Swing tree, deepest nodes first. */
    private void syncExpansion() {
        for (int id = swingNodes.length - 1; id >= 0; id--) {
            DisplayNode node = tree.node(id);
            if (node.isLeaf()) {
                continue;
            }
            TreePath path = new TreePath(swingNodes[id].getPath());
            if (node.isExpanded()) {
                view.expandPath(path);
            } else {
                view.collapsePath(path);
            }
        }
    }
}
