package com.tableview.io;

import com.tableview.table.ColumnNames;
import com.tableview.table.DataTable;
import com.tableview.table.TableSnapshot;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite databases, one dataset per table via {@code SELECT * FROM <table>}. The database is
 * opened read-only.
 */
public class SqliteTableLoader implements TableLoader {
    private static final String LIST_TABLES =
        "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name";

    @Override
    public LoadedData load(Path path, String subitem) throws IOException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + path, config.toProperties())) {
            MutableList<String> names = tableNames(connection);
            MutableList<DataTable> tables = Lists.mutable.empty();
            if (subitem != null) {
                tables.add(read(connection, SubitemSelector.select(names, subitem)));
            } else {
                for (String name : names) {
                    tables.add(read(connection, name));
                }
            }
            return new LoadedData.Tables(new TableSnapshot(path.toString(), tables));
        } catch (SQLException e) {
            throw new IOException("Cannot read SQLite database " + path + ": " + e.getMessage(), e);
        }
    }

    private static MutableList<String> tableNames(Connection connection) throws SQLException {
        MutableList<String> names = Lists.mutable.empty();
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(LIST_TABLES)) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }

    private static DataTable read(Connection connection, String table) throws SQLException {
        String sql = "SELECT * FROM \"" + table.replace("\"", "\"\"") + "\"";
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            int width = meta.getColumnCount();
            MutableList<String> columns = Lists.mutable.empty();
            for (int c = 1; c <= width; c++) {
                columns.add(meta.getColumnLabel(c));
            }
            MutableList<Object[]> rows = Lists.mutable.empty();
            while (rs.next()) {
                Object[] cells = new Object[width];
                for (int c = 1; c <= width; c++) {
                    cells[c - 1] = cell(rs.getObject(c));
                }
                rows.add(cells);
            }
            return new DataTable(table, ColumnNames.uniquify(columns), rows);
        }
    }

    private static Object cell(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }
}
