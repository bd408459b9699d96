package com.tableview.io;

import java.io.IOException;
import java.util.List;

/**
 * The requested sheet or table does not exist in the file.
 */
public class SubitemNotFoundException extends IOException {

    public SubitemNotFoundException(String subitem, List<String> available) {
        super("No sheet or table '" + subitem + "'; available: " + String.join(", ", available));
    }
}
