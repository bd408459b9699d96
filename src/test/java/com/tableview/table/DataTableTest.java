package com.tableview.table;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DataTableTest {

    @Test
    public void testFromGrid() {
        DataTable table = TestTables.people();

        assertEquals("people", table.name());
        assertEquals(List.of("name", "age", "city"), table.columns().castToList());
        assertEquals(5, table.rowCount());
        assertEquals(1, table.columnIndex("age"));
        assertEquals(-1, table.columnIndex("nope"));
        assertEquals(25L, table.rawCell(1, "age"));
        assertEquals("people (5 rows x 3 columns)", table.toString());
    }

    @Test
    public void testShortRowsArePadded() {
        DataTable table = DataTable.fromGrid("t", List.of(
            List.of("a", "b", "c"),
            List.of("1")));

        assertEquals("1", table.cell(0, 0));
        assertNull(table.cell(0, 2));
    }

    @Test
    public void testLongRowsAddColumns() {
        DataTable table = DataTable.fromGrid("t", List.of(
            List.of("a", "b"),
            List.of(1, 2),
            List.of(3, 4, 5, 6)));

        assertEquals(List.of("a", "b", "Unnamed: 2", "Unnamed: 3"), table.columns().castToList());
        assertEquals(5, table.cell(1, 2));
        assertEquals(6, table.cell(1, 3));
        assertNull(table.cell(0, 3));
    }

    @Test
    public void testDuplicateHeadersAreRenamed() {
        DataTable table = DataTable.fromGrid("t", List.of(
            Arrays.asList("x", null, "x"),
            List.of(1, 2, 3)));
        assertEquals(List.of("x", "Unnamed: 1", "x.1"), table.columns().castToList());
    }

    @Test
    public void testEmptyGrid() {
        DataTable table = DataTable.fromGrid("empty", List.of());
        assertEquals(0, table.columnCount());
        assertEquals(0, table.rowCount());
        table.clearFilter();
        assertEquals(0, table.rowCount());
    }

    @Test
    public void testFilterAndClearRestoresRows() {
        DataTable table = TestTables.people();

        table.applyFilter(RowMask.of(false, true, false, false, true));
        assertTrue(table.isFiltered());
        assertEquals(2, table.rowCount());
        assertEquals(5, table.totalRowCount());
        assertEquals("Bob", table.cell(0, 0));
        assertEquals("EVE", table.cell(1, 0));
        assertEquals(4, table.sourceRow(1));

        table.clearFilter();
        assertFalse(table.isFiltered());
        assertEquals(5, table.rowCount());
        assertEquals("Ann", table.cell(0, 0));
    }

    @Test
    public void testMaskSizeMustMatch() {
        DataTable table = TestTables.people();
        assertThrows(IllegalArgumentException.class, () -> table.applyFilter(RowMask.all(3)));
    }

    @Test
    public void testRecordFollowsVisibleRows() {
        DataTable table = TestTables.people();
        table.applyFilter(RowMask.of(false, false, true, false, false));

        Map<String, Object> record = table.record(0);
        assertEquals(List.of("name", "age", "city"), List.copyOf(record.keySet()));
        assertEquals("Cid", record.get("name"));
        assertEquals(40L, record.get("age"));
    }

    @Test
    public void testReversed() {
        DataTable reversed = TestTables.people().reversed();

        assertEquals("EVE", reversed.cell(0, 0));
        assertEquals("Ann", reversed.cell(4, 0));
        assertEquals(5, reversed.rowCount());
    }

    @Test
    public void testUnknownColumnByName() {
        assertThrows(IllegalArgumentException.class, () -> TestTables.people().rawCell(0, "nope"));
    }
}
