package com.exhibition.ledger.bulk;

import com.exhibition.ledger.core.model.RawRecord;
import com.exhibition.ledger.core.model.RecordSource;
import com.exhibition.ledger.core.model.Table;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the combined OCR + QR extraction file, producing one record per document page.
 *
 * <p>Expected format:</p>
 * <pre>
 * [
 *   {"file_id": "f1", "file_name": "card.pdf",
 *    "result": [{"page": 1, "qr_link": "https://acme.com", "result": {"phones": ["021..."]}}]},
 *   {"file_id": "f2", "file_name": "booth.jpg", "result": {"company_names": ["ACME"]}}
 * ]
 * </pre>
 */
public class OcrQrJsonReader implements RecordReader {
    private static final Logger log = LoggerFactory.getLogger(OcrQrJsonReader.class);

    private final ObjectMapper objectMapper;

    public OcrQrJsonReader() {
        this(new ObjectMapper());
    }

    public OcrQrJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ReadResult read(InputStream input, String origin) throws IOException {
        JsonNode root = objectMapper.readTree(input);
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of files in " + origin);
        }

        List<RawRecord> records = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int skipped = 0;
        int itemIndex = 0;

        for (JsonNode item : root) {
            itemIndex++;
            String fileName = item.path("file_name").asText("").strip();
            if (!item.isObject() || fileName.isEmpty()) {
                warnings.add("item " + itemIndex + " in " + origin + " has no file_name");
                log.warn("ocrqr.skipped item={} origin={} reason=missing-file-name", itemIndex, origin);
                skipped++;
                continue;
            }

            for (JsonNode page : pagesOf(item.get("result"))) {
                Map<String, String> fields = new LinkedHashMap<>();
                fields.put(Table.FILE_NAME, fileName);
                String fileId = item.path("file_id").asText("");
                if (!fileId.isBlank()) {
                    fields.put("file_id", fileId);
                }

                Map<String, String> flat = new LinkedHashMap<>();
                JsonNode nested = page.get("result");
                if (nested != null && nested.isObject()) {
                    // page wrapper: page number and QR payload sit next to the nested result
                    ObjectNode meta = page.deepCopy();
                    meta.remove("result");
                    flat.putAll(JsonRecordFlattener.flatten(meta));
                    flat.putAll(JsonRecordFlattener.flatten(nested));
                } else {
                    flat.putAll(JsonRecordFlattener.flatten(page));
                }
                flat.remove("result");
                if (flat.isEmpty() || (flat.size() == 1 && flat.containsKey("page"))) {
                    skipped++;
                    continue;
                }
                fields.putAll(flat);
                records.add(new RawRecord(RecordSource.OCR_QR, fileName, fields));
            }
        }

        log.info("ocrqr.read origin={} records={} skipped={}", origin, records.size(), skipped);
        return new ReadResult(records, skipped, warnings);
    }

    private static List<JsonNode> pagesOf(JsonNode result) {
        List<JsonNode> pages = new ArrayList<>();
        if (result == null) {
            return pages;
        }
        if (result.isObject()) {
            pages.add(result);
        } else if (result.isArray()) {
            for (JsonNode page : result) {
                if (page.isObject()) {
                    pages.add(page);
                }
            }
        }
        return pages;
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
