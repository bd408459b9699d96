package com.tableview.io;

import com.tableview.data.DataValue;
import com.tableview.data.DataValues;
import com.tableview.data.JsonDataParser;
import com.tableview.output.JsonFormatter;
import com.tableview.table.DataTable;
import com.tableview.table.TableSnapshot;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * JSON documents. An array of objects becomes one table whose columns are the union of the
 * objects' keys in first-seen order; any other document is shown as a tree.
 */
public class JsonTableLoader implements TableLoader {
    private final JsonDataParser parser = new JsonDataParser();
    private final JsonFormatter compact = new JsonFormatter(false, false);

    @Override
    public LoadedData load(Path path, String subitem) throws IOException {
        try (InputStream input = Files.newInputStream(path)) {
            return fromValue(path.toString(), DataFormat.baseName(path), parser.parse(input));
        }
    }

    public LoadedData fromValue(String source, String name, DataValue value) {
        if (isRecords(value)) {
            return new LoadedData.Tables(TableSnapshot.of(source, toTable(name, (DataValue.Sequence) value)));
        }
        return new LoadedData.Document(source, value);
    }

    static boolean isRecords(DataValue value) {
        return value instanceof DataValue.Sequence sequence
            && sequence.elements().notEmpty()
            && sequence.elements().allSatisfy(element -> element instanceof DataValue.Mapping);
    }

    private DataTable toTable(String name, DataValue.Sequence records) {
        Set<String> keys = new LinkedHashSet<>();
        records.elements().forEach(record -> keys.addAll(((DataValue.Mapping) record).entries().keySet()));
        MutableList<String> columns = Lists.mutable.withAll(keys);

        MutableList<Object[]> rows = Lists.mutable.withInitialCapacity(records.size());
        for (DataValue record : records.elements()) {
            DataValue.Mapping mapping = (DataValue.Mapping) record;
            Object[] cells = new Object[columns.size()];
            for (int c = 0; c < columns.size(); c++) {
                DataValue cell = mapping.entries().get(columns.get(c));
                cells[c] = cell == null ? null : cell(cell);
            }
            rows.add(cells);
        }
        return new DataTable(name, columns, rows);
    }

    private Object cell(DataValue value) {
        if (value instanceof DataValue.Mapping || value instanceof DataValue.Sequence) {
            return compact.format(value);
        }
        return DataValues.toCell(value);
    }
}
