package com.tableview.io;

import java.io.IOException;

/**
 * The file extension is not one the viewer can read.
 */
public class UnsupportedFormatException extends IOException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
