package com.tableview.io;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * File formats the viewer reads, chosen by file extension.
 */
public enum DataFormat {
    CSV(Set.of("csv")),
    TSV(Set.of("tsv")),
    EXCEL(Set.of("xlsx", "xls")),
    JSON(Set.of("json")),
    SQLITE(Set.of("db", "sqlite", "sqlite3"));

    private final Set<String> extensions;

    DataFormat(Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> extensions() {
        return extensions;
    }

    public static DataFormat of(Path path) throws UnsupportedFormatException {
        String extension = extension(path);
        if (extension.equals("ods")) {
            throw new UnsupportedFormatException("OpenDocument spreadsheets (.ods) cannot be read; save as .xlsx");
        }
        for (DataFormat format : values()) {
            if (format.extensions.contains(extension)) {
                return format;
            }
        }
        throw new UnsupportedFormatException("Unsupported file type: "
            + (extension.isEmpty() ? path.getFileName() : "." + extension));
    }

    public TableLoader loader() {
        return switch (this) {
            case CSV -> new CsvTableLoader(',');
            case TSV -> new CsvTableLoader('\t');
            case EXCEL -> new ExcelTableLoader();
            case JSON -> new JsonTableLoader();
            case SQLITE -> new SqliteTableLoader();
        };
    }

    static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static String baseName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
