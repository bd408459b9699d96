package com.tableview.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tableview.table.Cells;
import com.tableview.table.ColumnNames;
import com.tableview.table.DataTable;
import com.tableview.table.TableSnapshot;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Delimited text. The first non-blank line holds the headings; cells are typed with
 * {@link Cells#sniff(String)}.
 */
public class CsvTableLoader implements TableLoader {
    private final CsvMapper mapper = new CsvMapper();
    private final char separator;

    public CsvTableLoader(char separator) {
        this.separator = separator;
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    @Override
    public LoadedData load(Path path, String subitem) throws IOException {
        // a delimited file holds a single dataset, so any subitem is ignored
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            DataTable table = read(DataFormat.baseName(path), reader);
            return new LoadedData.Tables(TableSnapshot.of(path.toString(), table));
        }
    }

    public DataTable read(String name, Reader reader) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);
        MutableList<String> header = null;
        MutableList<Object[]> rows = Lists.mutable.empty();

        try (MappingIterator<String[]> lines = mapper.readerFor(String[].class).with(schema).readValues(reader)) {
            while (lines.hasNextValue()) {
                String[] line = lines.nextValue();
                if (isBlank(line)) {
                    continue;
                }
                if (header == null) {
                    header = ColumnNames.uniquify(Arrays.asList(line));
                    continue;
                }
                Object[] cells = new Object[Math.max(line.length, header.size())];
                for (int i = 0; i < line.length; i++) {
                    cells[i] = Cells.sniff(line[i]);
                }
                rows.add(cells);
            }
        }

        if (header == null) {
            return new DataTable(name, Lists.mutable.empty(), rows);
        }
        return new DataTable(name, header, rows);
    }

    private static boolean isBlank(String[] line) {
        return line.length == 0 || (line.length == 1 && line[0].isBlank());
    }
}
