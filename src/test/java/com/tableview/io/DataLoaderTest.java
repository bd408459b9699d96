package com.tableview.io;

import com.tableview.data.DataValue;
import com.tableview.table.DataTable;
import com.tableview.table.TableSnapshot;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class DataLoaderTest {

    @TempDir
    Path dir;

    private final DataLoader loader = new DataLoader();

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static TableSnapshot tables(LoadedData data) {
        assertTrue(data instanceof LoadedData.Tables, "expected tables but got " + data);
        return ((LoadedData.Tables) data).snapshot();
    }

    @Test
    public void testCsv() throws IOException {
        Path file = write("people.csv", "name,age,score\nAnn,30,2.5\n\nBob,,x\n\"Smith, J\",41,\n");

        TableSnapshot snapshot = tables(loader.load(file, null));

        assertEquals(1, snapshot.size());
        DataTable table = snapshot.tables().getFirst();
        assertEquals("people", table.name());
        assertEquals(List.of("name", "age", "score"), table.columns().castToList());
        assertEquals(3, table.rowCount());
        assertEquals(30L, table.cell(0, 1));
        assertEquals(2.5, table.cell(0, 2));
        assertNull(table.cell(1, 1));
        assertEquals("x", table.cell(1, 2));
        assertEquals("Smith, J", table.cell(2, 0));
        assertTrue(snapshot.source().endsWith("people.csv"));
    }

    @Test
    public void testCsvShortRowsArePadded() throws IOException {
        Path file = write("short.csv", "a,b,c\n1\n");

        DataTable table = tables(loader.load(file, null)).tables().getFirst();
        assertEquals(1L, table.cell(0, 0));
        assertNull(table.cell(0, 2));
    }

    @Test
    public void testCsvLongRowsKeepEveryCell() throws IOException {
        Path file = write("long.csv", "a,b\n1,2,3\n4,5\n");

        DataTable table = tables(loader.load(file, null)).tables().getFirst();
        assertEquals(List.of("a", "b", "Unnamed: 2"), table.columns().castToList());
        assertEquals(3L, table.cell(0, 2));
        assertNull(table.cell(1, 2));
    }

    @Test
    public void testExcelLongRowsKeepEveryCell() throws IOException {
        Path file = dir.resolve("long.xlsx");
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet("s");
            sheet.createRow(0).createCell(0).setCellValue("a");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue("x");
            row.createCell(2).setCellValue(7);
            workbook.write(out);
        }

        DataTable table = tables(loader.load(file, null)).tables().getFirst();
        assertEquals(List.of("a", "Unnamed: 1", "Unnamed: 2"), table.columns().castToList());
        assertEquals("x", table.cell(0, 0));
        assertNull(table.cell(0, 1));
        assertEquals(7L, table.cell(0, 2));
    }

    @Test
    public void testCsvDuplicateHeaders() throws IOException {
        Path file = write("dup.csv", "x,x,\n1,2,3\n");

        DataTable table = tables(loader.load(file, null)).tables().getFirst();
        assertEquals(List.of("x", "x.1", "Unnamed: 2"), table.columns().castToList());
    }

    @Test
    public void testTsv() throws IOException {
        Path file = write("data.tsv", "city\tpop\nOslo\t700000\n");

        DataTable table = tables(loader.load(file, null)).tables().getFirst();
        assertEquals(List.of("city", "pop"), table.columns().castToList());
        assertEquals(700000L, table.cell(0, 1));
    }

    @Test
    public void testJsonRecordsBecomeTable() throws IOException {
        Path file = write("rows.json", "[{\"a\": 1, \"b\": {\"x\": true}}, {\"c\": \"z\", \"a\": 2.5}]");

        DataTable table = tables(loader.load(file, null)).tables().getFirst();
        assertEquals(List.of("a", "b", "c"), table.columns().castToList());
        assertEquals(1L, table.cell(0, 0));
        assertEquals("{\"x\":true}", table.cell(0, 1));
        assertNull(table.cell(0, 2));
        assertEquals(2.5, table.cell(1, 0));
        assertEquals("z", table.cell(1, 2));
    }

    @Test
    public void testJsonDocumentBecomesTree() throws IOException {
        Path file = write("doc.json", "{\"a\": [1, 2]}");

        LoadedData data = loader.load(file, null);
        assertTrue(data instanceof LoadedData.Document);
        assertTrue(((LoadedData.Document) data).value() instanceof DataValue.Mapping);
    }

    @Test
    public void testExcel() throws IOException {
        Path file = dir.resolve("book.xlsx");
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet first = workbook.createSheet("first");
            Row header = first.createRow(0);
            header.createCell(0).setCellValue("name");
            header.createCell(1).setCellValue("qty");
            header.createCell(2).setCellValue("ok");
            Row row = first.createRow(1);
            row.createCell(0).setCellValue("bolt");
            row.createCell(1).setCellValue(12);
            row.createCell(2).setCellValue(true);
            Row second = first.createRow(2);
            second.createCell(0).setCellValue("nut");
            second.createCell(1).setCellValue(0.25);

            Sheet other = workbook.createSheet("other");
            other.createRow(0).createCell(0).setCellValue("only");
            workbook.write(out);
        }

        TableSnapshot all = tables(loader.load(file, null));
        assertEquals(List.of("first", "other"), all.names().castToList());
        DataTable table = all.table("first").orElseThrow();
        assertEquals(List.of("name", "qty", "ok"), table.columns().castToList());
        assertEquals(2, table.rowCount());
        assertEquals(12L, table.cell(0, 1));
        assertEquals(Boolean.TRUE, table.cell(0, 2));
        assertEquals(0.25, table.cell(1, 1));
        assertNull(table.cell(1, 2));

        TableSnapshot one = tables(loader.load(file, "1"));
        assertEquals(List.of("other"), one.names().castToList());
        assertEquals(0, one.tables().getFirst().rowCount());

        assertThrows(SubitemNotFoundException.class, () -> loader.load(file, "missing"));
    }

    @Test
    public void testSqlite() throws IOException, SQLException {
        Path file = dir.resolve("store.db");
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + file);
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("CREATE TABLE items (id INTEGER, name TEXT, price REAL)");
            statement.executeUpdate("INSERT INTO items VALUES (1, 'bolt', 0.5), (2, 'nut', NULL)");
            statement.executeUpdate("CREATE TABLE \"a table\" (v TEXT)");
        }

        TableSnapshot snapshot = tables(loader.load(file, null));
        assertEquals(List.of("a table", "items"), snapshot.names().castToList());

        DataTable items = snapshot.table("items").orElseThrow();
        assertEquals(List.of("id", "name", "price"), items.columns().castToList());
        assertEquals(2, items.rowCount());
        assertEquals(1L, items.cell(0, 0));
        assertEquals("bolt", items.cell(0, 1));
        assertEquals(0.5, items.cell(0, 2));
        assertNull(items.cell(1, 2));

        TableSnapshot selected = tables(loader.load(file, "items"));
        assertEquals(1, selected.size());
    }

    @Test
    public void testMissingFile() {
        InputNotFoundException e = assertThrows(InputNotFoundException.class,
            () -> loader.load(dir.resolve("nope.csv"), null));
        assertTrue(e.getMessage().startsWith("File not found: "));
    }

    @Test
    public void testUnsupportedFile() throws IOException {
        Path file = write("notes.txt", "hello");
        assertThrows(UnsupportedFormatException.class, () -> loader.load(file, null));
    }

    @Test
    public void testStdinCsv() throws IOException {
        byte[] input = "a,b\n1,x\n2,y\n".getBytes(StandardCharsets.UTF_8);

        Optional<LoadedData> data = loader.loadStdin(new ByteArrayInputStream(input));

        TableSnapshot snapshot = tables(data.orElseThrow());
        assertEquals(DataLoader.STDIN_SOURCE, snapshot.source());
        assertEquals(2, snapshot.tables().getFirst().rowCount());
        assertEquals(2L, snapshot.tables().getFirst().cell(1, 0));
    }

    @Test
    public void testStdinJson() throws IOException {
        byte[] input = "  {\"k\": \"v\"}\n".getBytes(StandardCharsets.UTF_8);

        LoadedData data = loader.loadStdin(new ByteArrayInputStream(input)).orElseThrow();
        assertTrue(data instanceof LoadedData.Document);
        assertEquals(DataLoader.STDIN_SOURCE, data.source());
    }

    @Test
    public void testStdinJsonRecords() throws IOException {
        byte[] input = "[{\"k\": 1}, {\"k\": 2}]".getBytes(StandardCharsets.UTF_8);

        TableSnapshot snapshot = tables(loader.loadStdin(new ByteArrayInputStream(input)).orElseThrow());
        assertEquals(Arrays.asList(1L, 2L), Arrays.asList(snapshot.tables().getFirst().cell(0, 0),
            snapshot.tables().getFirst().cell(1, 0)));
    }

    @Test
    public void testEmptyStdin() throws IOException {
        assertTrue(loader.loadStdin(new ByteArrayInputStream(new byte[0])).isEmpty());
        assertTrue(loader.loadStdin(new ByteArrayInputStream(" \n\t".getBytes(StandardCharsets.UTF_8))).isEmpty());
    }
}
