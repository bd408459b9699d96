package com.tableview.output;

import com.tableview.table.DataTable;
import com.tableview.table.RowMask;
import com.tableview.table.TableSnapshot;
import com.tableview.tree.DisplayTree;
import com.tableview.tree.TreeRenderer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TextRendererTest {

    private final TextRenderer renderer = new TextRenderer();

    private static DataTable table(String name) {
        return DataTable.fromGrid(name, List.of(
            List.of("city", "pop"),
            Arrays.asList("Oslo", 700000L),
            Arrays.asList("Rome", null)));
    }

    @Test
    public void testRenderTree() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("a", Map.of("b", 1));
        value.put("l", List.of("x"));
        value.put("e", List.of());
        DisplayTree tree = new TreeRenderer(false, false).render(value);

        assertEquals("a (1)\n  b: 1\nl (1):\n  0: x\ne (0): (empty)\n", renderer.renderTree(tree));
    }

    @Test
    public void testRenderTable() {
        String text = renderer.renderTable(table("cities"));

        assertEquals(
            "city  pop\n"
                + "----  ------\n"
                + "Oslo  700000\n"
                + "Rome  \n"
                + "(2 rows)\n",
            text);
    }

    @Test
    public void testFilteredFooter() {
        DataTable table = table("cities");
        table.applyFilter(RowMask.of(true, false));

        assertTrue(renderer.renderTable(table).endsWith("(1 row of 2)\n"));
    }

    @Test
    public void testLongCellsAreClipped() {
        DataTable table = DataTable.fromGrid("t", List.of(
            List.of("text"),
            List.of("x".repeat(100))));

        String line = renderer.renderTable(table).split("\n")[2];
        assertEquals(TextRenderer.MAX_CELL_WIDTH, line.length());
        assertTrue(line.endsWith("..."));
    }

    @Test
    public void testSnapshotHeadersOnlyForSeveralTables() {
        String single = renderer.renderSnapshot(TableSnapshot.of("f", table("one")));
        assertFalse(single.contains("=="));

        String several = renderer.renderSnapshot(TableSnapshot.of("f", table("one"), table("two")));
        assertTrue(several.startsWith("== one ==\n"));
        assertTrue(several.contains("\n\n== two ==\n"));
    }
}
