package com.tableview.table;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.List;

/**
 * Header clean-up shared by the loaders.
 */
public final class ColumnNames {

    private ColumnNames() {
    }

    /**
     * Fills blank headers with {@code Unnamed: <index>} and suffixes repeats with
     * {@code .1}, {@code .2}, ... so every column can be addressed by name.
     */
    public static MutableList<String> uniquify(List<String> headers) {
        MutableList<String> result = Lists.mutable.withInitialCapacity(headers.size());
        MutableSet<String> seen = Sets.mutable.empty();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            String base = header == null || header.isBlank() ? "Unnamed: " + i : header.trim();
            String name = base;
            for (int n = 1; !seen.add(name); n++) {
                name = base + "." + n;
            }
            result.add(name);
        }
        return result;
    }
}
