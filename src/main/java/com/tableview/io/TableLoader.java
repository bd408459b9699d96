package com.tableview.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads one file format.
 */
public interface TableLoader {

    /**
     * Loads {@code path}. With a {@code subitem} (sheet or table name, or zero-based index) only
     * that dataset is read; with {@code null} every dataset is read.
     */
    LoadedData load(Path path, String subitem) throws IOException;
}
