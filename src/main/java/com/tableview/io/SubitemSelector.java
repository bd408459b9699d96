package com.tableview.io;

import java.util.List;

/**
 * Resolves a sheet or table given by name or zero-based index.
 */
final class SubitemSelector {

    private SubitemSelector() {
    }

    static String select(List<String> names, String subitem) throws SubitemNotFoundException {
        if (names.contains(subitem)) {
            return subitem;
        }
        String trimmed = subitem.trim();
        if (trimmed.matches("\\d{1,9}")) {
            int index = Integer.parseInt(trimmed);
            if (index < names.size()) {
                return names.get(index);
            }
        }
        throw new SubitemNotFoundException(subitem, names);
    }
}
