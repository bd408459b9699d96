package com.tableview.table;

import java.util.Arrays;
import java.util.List;

/**
 * Small tables shared by the filter tests.
 */
public final class TestTables {

    private TestTables() {
    }

    /** name, age, city: five people, one with no age. */
    public static DataTable people() {
        return DataTable.fromGrid("people", List.of(
            List.of("name", "age", "city"),
            Arrays.asList("Ann", 30L, "Oslo"),
            Arrays.asList("Bob", 25L, "Paris"),
            Arrays.asList("Cid", 40L, "Oslo"),
            Arrays.asList("dee", null, "Rome"),
            Arrays.asList("EVE", 35L, "")));
    }
}
