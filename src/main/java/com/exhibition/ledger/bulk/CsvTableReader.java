package com.exhibition.ledger.bulk;

import com.exhibition.ledger.core.model.RecordSource;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a UTF-8 CSV export of an operator sheet. The first record is the header;
 * a leading byte-order mark is ignored.
 */
public class CsvTableReader implements RecordReader {
    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    private static final char BOM = '\uFEFF';

    @Override
    public ReadResult read(InputStream input, String origin) throws IOException {
        Reader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        reader.mark(1);
        if (reader.read() != BOM) {
            reader.reset();
        }

        CSVParser parser = CSVFormat.DEFAULT.builder()
                .setIgnoreEmptyLines(true)
                .build()
                .parse(reader);

        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();
        for (CSVRecord record : parser) {
            List<String> values = new ArrayList<>(record.size());
            record.forEach(values::add);
            if (header == null) {
                header = TabularRows.uniqueHeader(values);
            } else {
                rows.add(values);
            }
        }
        if (header == null) {
            return ReadResult.empty();
        }

        ReadResult result = TabularRows.toRecords(header, rows, RecordSource.EXCEL_OPERATOR, origin);
        log.info("csv.read origin={} records={} skipped={}", origin, result.size(), result.skipped());
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }
}
