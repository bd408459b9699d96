package com.tableview.ui;

import com.tableview.tree.DisplayTree;
import com.tableview.tree.TreeRenderer;
import org.junit.jupiter.api.Test;

import javax.swing.tree.TreeModel;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TreePanelTest {

    @Test
    public void testExpandAndCollapseUpdateTheDisplayTree() {
        DisplayTree tree = new TreeRenderer().render(Map.of("a", Map.of("b", List.of(1, 2)), "c", 3));
        TreePanel panel = new TreePanel(tree, ViewerSettings.defaults());

        panel.expandAll();
        tree.nodeIds().forEach(id -> assertEquals(!tree.node(id).isLeaf(), tree.node(id).isExpanded()));

        panel.collapseAll();
        tree.nodeIds().forEach(id -> assertFalse(tree.node(id).isExpanded()));
    }

    @Test
    public void testRowsShowLabelAndValue() {
        DisplayTree tree = new TreeRenderer(true, false).render(Map.of("a", 1, "b", List.of("x")));
        TreePanel panel = new TreePanel(tree, ViewerSettings.defaults());

        TreeModel model = panel.view().getModel();
        Object root = model.getRoot();
        assertEquals(2, model.getChildCount(root));
        assertEquals("a = 1", model.getChild(root, 0).toString());
        Object branch = model.getChild(root, 1);
        assertEquals("b (1):", branch.toString());
        assertEquals("0 = x", model.getChild(branch, 0).toString());
    }
}
