package com.tableview.ui;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RelauncherTest {

    @Test
    public void testCommand() {
        Path file = Path.of("data.csv");
        List<String> command = new Relauncher("com.tableview.TableView")
            .command(List.of("--tree"), file);

        assertEquals(Relauncher.javaExecutable(), command.get(0));
        assertEquals("-cp", command.get(1));
        assertEquals(System.getProperty("java.class.path"), command.get(2));
        assertEquals("com.tableview.TableView", command.get(3));
        assertEquals("--tree", command.get(4));
        assertEquals(file.toAbsolutePath().toString(), command.get(5));
    }

    @Test
    public void testPickerOffersEveryReadableExtension() {
        List<String> extensions = Arrays.asList(FilePicker.supportedExtensions());
        assertTrue(extensions.containsAll(List.of("csv", "tsv", "xlsx", "xls", "json", "db", "sqlite", "sqlite3")));
        assertFalse(extensions.contains("ods"));
    }
}
