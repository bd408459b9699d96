package com.tableview.io;

import com.tableview.table.ColumnNames;
import com.tableview.table.DataTable;
import com.tableview.table.TableSnapshot;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Excel workbooks, one dataset per sheet. The first row of a sheet holds the headings.
 */
public class ExcelTableLoader implements TableLoader {
    private final DataFormatter formatter = new DataFormatter();

    @Override
    public LoadedData load(Path path, String subitem) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            MutableList<String> names = Lists.mutable.empty();
            workbook.forEach(sheet -> names.add(sheet.getSheetName()));

            MutableList<DataTable> tables = Lists.mutable.empty();
            if (subitem != null) {
                tables.add(read(workbook.getSheet(SubitemSelector.select(names, subitem))));
            } else {
                for (Sheet sheet : workbook) {
                    tables.add(read(sheet));
                }
            }
            return new LoadedData.Tables(new TableSnapshot(path.toString(), tables));
        }
    }

    private DataTable read(Sheet sheet) {
        Row headerRow = null;
        int first = sheet.getFirstRowNum();
        int last = sheet.getLastRowNum();
        int r = first;
        while (r <= last && headerRow == null) {
            headerRow = sheet.getRow(r++);
        }
        if (headerRow == null) {
            return new DataTable(sheet.getSheetName(), Lists.mutable.empty(), Lists.mutable.empty());
        }

        int width = Math.max(headerRow.getLastCellNum(), 0);
        MutableList<String> headings = Lists.mutable.empty();
        for (int c = 0; c < width; c++) {
            Cell cell = headerRow.getCell(c);
            headings.add(cell == null ? null : formatter.formatCellValue(cell));
        }

        MutableList<Object[]> rows = Lists.mutable.empty();
        for (; r <= last; r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            // cells past the headings become extra columns
            Object[] cells = new Object[Math.max(width, row.getLastCellNum())];
            for (int c = 0; c < cells.length; c++) {
                cells[c] = value(row.getCell(c));
            }
            rows.add(cells);
        }
        return new DataTable(sheet.getSheetName(), ColumnNames.uniquify(headings), rows);
    }

    private Object value(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return formatter.formatCellValue(cell);
                }
                double number = cell.getNumericCellValue();
                if (number == Math.rint(number) && Math.abs(number) < 1e15) {
                    return (long) number;
                }
                return number;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case STRING:
                String text = cell.getStringCellValue();
                return text.isEmpty() ? null : text;
            case BLANK:
                return null;
            default:
                return formatter.formatCellValue(cell);
        }
    }
}
