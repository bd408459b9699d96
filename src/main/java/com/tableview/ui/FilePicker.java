package com.tableview.ui;

import com.tableview.io.DataFormat;

import javax.swing.JFileChooser;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.Component;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * Modal chooser limited to the extensions a loader exists for.
 */
public class FilePicker {

    public Optional<Path> choose(Component parent) {
        JFileChooser chooser = new JFileChooser();
        chooser.setDialogTitle("Open data file");
        chooser.setFileFilter(new FileNameExtensionFilter("Data files", supportedExtensions()));
        if (chooser.showOpenDialog(parent) != JFileChooser.APPROVE_OPTION) {
            return Optional.empty();
        }
        return Optional.ofNullable(chooser.getSelectedFile()).map(file -> file.toPath());
    }

    static String[] supportedExtensions() {
        return Arrays.stream(DataFormat.values())
            .flatMap(format -> format.extensions().stream())
            .sorted()
            .toArray(String[]::new);
    }
}
