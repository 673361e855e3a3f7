package com.exhibition.ledger.bulk;

import com.exhibition.ledger.core.model.Table;
import com.exhibition.ledger.rules.ValueNormalizer;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a fused table to a single-sheet workbook, {@code CompanyID} first.
 * Every cell is written as a string after {@link ValueNormalizer}, so no value
 * is ever evaluated as a formula.
 */
public class ExcelTableWriter {
    private static final Logger log = LoggerFactory.getLogger(ExcelTableWriter.class);

    public static final String DEFAULT_SHEET_NAME = "Ledger";

    private final String sheetName;

    public ExcelTableWriter() {
        this(DEFAULT_SHEET_NAME);
    }

    public ExcelTableWriter(String sheetName) {
        this.sheetName = sheetName;
    }

    /**
     * Writes the workbook to a file, replacing any existing one.
     *
     * @return number of data rows written
     */
    public int write(Table table, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            int rows = write(table, out);
            log.info("excel.written path={} rows={} columns={}", path, rows, table.columnCount());
            return rows;
        }
    }

    public int write(Table table, OutputStream out) throws IOException {
        List<String> columns = orderedColumns(table);
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(sheetName);

            CellStyle headerStyle = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);

            Row header = sheet.createRow(0);
            for (int c = 0; c < columns.size(); c++) {
                Cell cell = header.createCell(c);
                cell.setCellValue(columns.get(c));
                cell.setCellStyle(headerStyle);
            }

            for (int r = 0; r < table.rowCount(); r++) {
                Row row = sheet.createRow(r + 1);
                for (int c = 0; c < columns.size(); c++) {
                    row.createCell(c).setCellValue(ValueNormalizer.normalize(table.get(r, columns.get(c))));
                }
            }
            sheet.createFreezePane(0, 1);
            workbook.write(out);
        }
        return table.rowCount();
    }

    private static List<String> orderedColumns(Table table) {
        List<String> columns = new ArrayList<>(table.columnCount() + 1);
        columns.add(Table.COMPANY_ID);
        for (String column : table.columns()) {
            if (!Table.COMPANY_ID.equals(column)) {
                columns.add(column);
            }
        }
        return columns;
    }
}
