package com.exhibition.ledger.bulk;

import com.exhibition.ledger.core.model.RawRecord;
import com.exhibition.ledger.core.model.RecordSource;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the first sheet of an operator workbook; the first row is the header.
 * Cells are rendered as displayed ({@link DataFormatter}), so a phone number stored
 * as a number keeps its digits.
 */
public class ExcelTableReader implements RecordReader {
    private static final Logger log = LoggerFactory.getLogger(ExcelTableReader.class);

    @Override
    public ReadResult read(InputStream input, String origin) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(input)) {
            if (workbook.getNumberOfSheets() == 0) {
                return ReadResult.empty();
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return ReadResult.empty();
            }

            DataFormatter fmt = new DataFormatter();
            int width = Math.max(0, headerRow.getLastCellNum());
            List<String> rawHeader = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                Cell cell = headerRow.getCell(c);
                rawHeader.add(cell == null ? "" : fmt.formatCellValue(cell));
            }
            List<String> header = TabularRows.uniqueHeader(rawHeader);

            List<List<String>> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                List<String> values = new ArrayList<>(width);
                for (int c = 0; c < width; c++) {
                    Cell cell = row.getCell(c);
                    values.add(cell == null ? "" : fmt.formatCellValue(cell));
                }
                rows.add(values);
            }

            ReadResult result = TabularRows.toRecords(header, rows, RecordSource.EXCEL_OPERATOR, origin);
            log.info("excel.read origin={} sheet={} records={} skipped={}",
                    origin, sheet.getSheetName(), result.size(), result.skipped());
            return result;
        } catch (IllegalArgumentException e) {
            // POI reports empty and unrecognized files as IllegalArgumentException subtypes
            throw new IOException("Not a readable workbook: " + origin, e);
        }
    }

    @Override
    public String getFormat() {
        return "xlsx";
    }
}
