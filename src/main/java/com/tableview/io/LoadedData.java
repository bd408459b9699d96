package com.tableview.io;

import com.tableview.data.DataValue;
import com.tableview.table.TableSnapshot;

/**
 * What a load produced: tables for the grid view, or a nested document for the tree view.
 */
public sealed interface LoadedData {

    String source();

    record Tables(TableSnapshot snapshot) implements LoadedData {
        @Override
        public String source() {
            return snapshot.source();
        }
    }

    record Document(String source, DataValue value) implements LoadedData {}
}
