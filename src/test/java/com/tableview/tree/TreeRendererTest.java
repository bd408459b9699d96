package com.tableview.tree;

import com.tableview.data.DataValue;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TreeRendererTest {

    private static Map<String, Object> map(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    private static DisplayNode root(DisplayTree tree, int index) {
        return tree.node(tree.roots().get(index));
    }

    @Test
    public void testNestedMappingLabels() {
        DisplayTree tree = new TreeRenderer().render(map("a", map("b", 1, "c", List.of(1, 2))));

        assertEquals(1, tree.roots().size());
        DisplayNode a = root(tree, 0);
        assertEquals("a (2)", a.label());
        assertFalse(a.isLeaf());

        List<DisplayNode> children = tree.children(a.id());
        assertEquals(2, children.size());
        assertEquals("b", children.get(0).label());
        assertEquals("1", children.get(0).value());
        assertEquals("c (2):", children.get(1).label());

        List<DisplayNode> items = tree.children(children.get(1).id());
        assertEquals("0", items.get(0).label());
        assertEquals("1", items.get(0).value());
        assertEquals("1", items.get(1).label());
        assertEquals("2", items.get(1).value());
    }

    @Test
    public void testEmptyListIsLeaf() {
        DisplayTree tree = new TreeRenderer().render(map("x", List.of()));

        DisplayNode x = root(tree, 0);
        assertTrue(x.isLeaf());
        assertEquals("x (0):", x.label());
        assertEquals("(empty)", x.value());
        assertTrue(tree.children(x.id()).isEmpty());
    }

    @Test
    public void testEmptyMappingIsBranchWithoutChildren() {
        DisplayTree tree = new TreeRenderer().render(map("m", map()));

        DisplayNode m = root(tree, 0);
        assertFalse(m.isLeaf());
        assertEquals("m (0)", m.label());
        assertEquals(0, m.children().size());
    }

    @Test
    public void testNullBecomesNoData() {
        DisplayTree tree = new TreeRenderer().render(null);

        assertEquals(1, tree.size());
        DisplayNode data = root(tree, 0);
        assertEquals("data", data.label());
        assertEquals("no data", data.value());
    }

    @Test
    public void testNullValueDisplaysAsNone() {
        DisplayTree tree = new TreeRenderer().render(map("missing", null));
        assertEquals("None", root(tree, 0).value());
    }

    @Test
    public void testBooleansAndNumbers() {
        DisplayTree tree = new TreeRenderer(false, false).render(map("yes", true, "pi", 3.5, "n", 7L));

        assertEquals("True", root(tree, 0).value());
        assertEquals("3.5", root(tree, 1).value());
        assertEquals("7", root(tree, 2).value());
    }

    @Test
    public void testMultilineText() {
        DisplayTree tree = new TreeRenderer().render(map("note", "first\nsecond\nthird"));

        DisplayNode note = root(tree, 0);
        assertEquals("note (3):", note.label());
        List<DisplayNode> lines = tree.children(note.id());
        assertEquals(3, lines.size());
        assertEquals("0", lines.get(0).label());
        assertEquals("first", lines.get(0).value());
        assertEquals("third", lines.get(2).value());
    }

    @Test
    public void testSingleLineTextIsLeaf() {
        DisplayTree tree = new TreeRenderer().render(map("note", "just one line"));
        assertTrue(root(tree, 0).isLeaf());
        assertEquals("just one line", root(tree, 0).value());
    }

    @Test
    public void testShowUnitsLabels() {
        DisplayTree tree = new TreeRenderer(true, true).render(
            map("d", map("k", 1), "l", List.of(1, 2, 3), "t", "a\nb"));

        assertEquals("d [dict] (1 keys)", root(tree, 0).label());
        assertEquals("l [list] (3 items):", root(tree, 1).label());
        assertEquals("t [text] (2 lines):", root(tree, 2).label());
    }

    @Test
    public void testSortKeysOrdersMappingKeys() {
        Map<String, Object> value = map("zeta", 1, "alpha", 2, "mid", 3);

        DisplayTree sorted = new TreeRenderer(true, false).render(value);
        DisplayTree unsorted = new TreeRenderer(false, false).render(value);

        assertEquals("alpha", root(sorted, 0).label());
        assertEquals("mid", root(sorted, 1).label());
        assertEquals("zeta", root(sorted, 2).label());
        assertEquals("zeta", root(unsorted, 0).label());
        assertEquals("alpha", root(unsorted, 1).label());
        assertEquals(sorted.size(), unsorted.size());
    }

    @Test
    public void testSequencesKeepIndexOrderWhenSorting() {
        DisplayTree tree = new TreeRenderer(true, false).render(map("l", Arrays.asList("b", "a", "c")));

        List<DisplayNode> items = tree.children(root(tree, 0).id());
        assertEquals("b", items.get(0).value());
        assertEquals("a", items.get(1).value());
        assertEquals("c", items.get(2).value());
    }

    @Test
    public void testSetsAreSorted() {
        DisplayTree tree = new TreeRenderer().render(map("s", new LinkedHashSet<>(List.of(3, 1, 2))));

        List<DisplayNode> items = tree.children(root(tree, 0).id());
        assertEquals("1", items.get(0).value());
        assertEquals("2", items.get(1).value());
        assertEquals("3", items.get(2).value());
    }

    @Test
    public void testTopLevelSequenceIsIndexed() {
        DisplayTree tree = new TreeRenderer().render(List.of("x", "y"));

        assertEquals(2, tree.roots().size());
        assertEquals("0", root(tree, 0).label());
        assertEquals("y", root(tree, 1).value());
    }

    @Test
    public void testTopLevelScalar() {
        DisplayTree tree = new TreeRenderer().render(42);

        assertEquals(1, tree.size());
        assertEquals("value", root(tree, 0).label());
        assertEquals("42", root(tree, 0).value());
    }

    @Test
    public void testFailingValueIsSkipped() {
        TreeRenderer renderer = new TreeRenderer() {
            @Override
            protected String leafText(DataValue value) {
                if (value instanceof DataValue.Text text && text.value().equals("boom")) {
                    throw new IllegalStateException("cannot display");
                }
                return super.leafText(value);
            }
        };

        DisplayTree tree = renderer.render(map("a", 1, "b", "boom", "c", 3));

        assertEquals(2, tree.roots().size());
        assertEquals("a", root(tree, 0).label());
        assertEquals("c", root(tree, 1).label());
    }

    @Test
    public void testExoticValuesUseStringForm() {
        DisplayTree tree = new TreeRenderer().render(map("when", java.time.LocalDate.of(2024, 1, 2),
            "blob", new byte[] {1, 2, 3}));

        assertEquals("<3 bytes>", root(tree, 0).value());
        assertEquals("2024-01-02", root(tree, 1).value());
    }

    @Test
    public void testSourceIsCopied() {
        Map<String, Object> inner = map("k", 1);
        DisplayTree tree = new TreeRenderer().render(map("inner", inner));
        inner.put("added", 2);

        DataValue.Mapping source = (DataValue.Mapping) tree.source();
        DataValue.Mapping copied = (DataValue.Mapping) source.entries().get("inner");
        assertEquals(1, copied.size());
    }

    @Test
    public void testReloadReplacesContents() {
        TreeRenderer renderer = new TreeRenderer();
        DisplayTree tree = renderer.render(map("a", 1, "b", 2));
        renderer.load(tree, new DataValue.Text("single"));

        assertEquals(1, tree.size());
        assertEquals("single", root(tree, 0).value());
    }

    @Test
    public void testExpandAndCollapseAll() {
        DisplayTree tree = new TreeRenderer().render(map("a", map("b", map("c", 1)), "leaf", 2));

        tree.expandAll();
        tree.nodeIds().forEach(id -> {
            DisplayNode node = tree.node(id);
            assertEquals(!node.isLeaf(), node.isExpanded());
        });

        tree.collapseAll();
        tree.nodeIds().forEach(id -> assertFalse(tree.node(id).isExpanded()));
    }

    @Test
    public void testNodeCountMatchesStructure() {
        // a(2) -> b, c(2) -> 0, 1 : five nodes, three leaves
        DisplayTree tree = new TreeRenderer().render(map("a", map("b", 1, "c", List.of(1, 2))));

        assertEquals(5, tree.size());
        assertEquals(3, tree.leafCount());
        assertEquals(5, tree.nodeIds().size());
    }
}
