package com.exhibition.ledger.bulk;

import com.exhibition.ledger.core.model.RawRecord;
import com.exhibition.ledger.core.model.RecordSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads web-enrichment output: an array of {@code {url, status, error, ...fields}}.
 * Only {@code SUCCESS} entries are kept, without their {@code status} and {@code error}.
 */
public class ScrapeJsonReader implements RecordReader {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJsonReader.class);

    static final String SUCCESS = "SUCCESS";

    private final ObjectMapper objectMapper;

    public ScrapeJsonReader() {
        this(new ObjectMapper());
    }

    public ScrapeJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ReadResult read(InputStream input, String origin) throws IOException {
        JsonNode root = objectMapper.readTree(input);
        if (root == null || root.isMissingNode()) {
            return ReadResult.empty();
        }
        if (!root.isArray()) {
            throw new IOException("Expected a JSON array of scraped sites in " + origin);
        }

        List<RawRecord> records = new ArrayList<>();
        int skipped = 0;
        for (JsonNode entry : root) {
            if (!entry.isObject() || !SUCCESS.equals(entry.path("status").asText(""))) {
                skipped++;
                continue;
            }
            ObjectNode fields = entry.deepCopy();
            fields.remove("status");
            fields.remove("error");
            Map<String, String> row = JsonRecordFlattener.flatten(fields);
            if (row.isEmpty()) {
                skipped++;
                continue;
            }
            records.add(new RawRecord(RecordSource.SCRAPE, origin, row));
        }

        log.info("scrape.read origin={} records={} skipped={}", origin, records.size(), skipped);
        return new ReadResult(records, skipped, List.of());
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
