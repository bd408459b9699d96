package com.tableview.table;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * The datasets read from one file or from standard input, in load order.
 */
public class TableSnapshot {
    private final String source;
    private final ImmutableList<DataTable> tables;

    public TableSnapshot(String source, MutableList<DataTable> tables) {
        this.source = source;
        this.tables = tables.toImmutable();
    }

    public static TableSnapshot of(String source, DataTable... tables) {
        return new TableSnapshot(source, Lists.mutable.with(tables));
    }

    /** File path, or {@code (from stdin)}. */
    public String source() {
        return source;
    }

    public ImmutableList<DataTable> tables() {
        return tables;
    }

    public ImmutableList<String> names() {
        return tables.collect(DataTable::name);
    }

    public Optional<DataTable> table(String name) {
        return Optional.ofNullable(tables.detect(t -> t.name().equals(name)));
    }

    public int size() {
        return tables.size();
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    public TableSnapshot reversed() {
        return new TableSnapshot(source, tables.collect(DataTable::reversed).toList());
    }
}
