package com.tableview.io;

import java.io.IOException;
import java.nio.file.Path;

public class InputNotFoundException extends IOException {

    public InputNotFoundException(Path path) {
        super("File not found: " + path);
    }
}
