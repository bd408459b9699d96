package com.tableview.table;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CellsTest {

    @Test
    public void testSniff() {
        assertEquals(30L, Cells.sniff("30"));
        assertEquals(-7L, Cells.sniff("-7"));
        assertEquals(2.5, Cells.sniff("2.5"));
        assertEquals(1.0e3, Cells.sniff("1e3"));
        assertNull(Cells.sniff(""));
        assertNull(Cells.sniff(null));
        assertEquals("Oslo", Cells.sniff("Oslo"));
        assertEquals("12 apples", Cells.sniff("12 apples"));
    }

    @Test
    public void testNumber() {
        assertEquals(3.0, Cells.number(3L));
        assertEquals(4.5, Cells.number(" 4.5 "));
        assertNull(Cells.number("four"));
        assertNull(Cells.number(null));
        assertNull(Cells.number(Boolean.TRUE));
        assertNull(Cells.parseNumber("NaN"));
    }

    @Test
    public void testText() {
        assertEquals("", Cells.text(null));
        assertEquals("<4 bytes>", Cells.text(new byte[4]));
        assertEquals("12", Cells.text(12L));
    }

    @Test
    public void testUniquifyColumnNames() {
        assertEquals(List.of("a", "a.1", "a.2", "Unnamed: 3", "b"),
            ColumnNames.uniquify(Arrays.asList("a", "a", "a", " ", "b")));
        assertEquals(List.of("a.1", "a", "a.2"),
            ColumnNames.uniquify(Arrays.asList("a.1", "a", "a")));
    }
}
