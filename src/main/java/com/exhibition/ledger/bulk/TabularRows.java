package com.exhibition.ledger.bulk;

import com.exhibition.ledger.core.model.RawRecord;
import com.exhibition.ledger.core.model.RecordSource;
import com.exhibition.ledger.rules.ValueNormalizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared cleanup for header-plus-rows inputs (workbooks and CSV exports).
 *
 * <ul>
 *   <li>if a {@code status} column has values, only {@code SUCCESS} rows are kept</li>
 *   <li>{@code status} and {@code error} columns are dropped</li>
 *   <li>all-empty rows and all-empty columns are dropped</li>
 *   <li>exact duplicate rows are collapsed</li>
 * </ul>
 */
final class TabularRows {

    private static final String STATUS = "status";
    private static final String ERROR = "error";

    private TabularRows() {
        // Utility class
    }

    /**
     * Trims header names, names blank ones {@code column{n}} and suffixes repeated ones
     * with their occurrence number ({@code Email}, {@code Email2}).
     */
    static List<String> uniqueHeader(List<String> raw) {
        List<String> header = new ArrayList<>(raw.size());
        Set<String> used = new HashSet<>();
        Map<String, Integer> occurrences = new HashMap<>();
        for (int i = 0; i < raw.size(); i++) {
            String name = ValueNormalizer.normalize(raw.get(i));
            if (name.isEmpty()) {
                name = "column" + (i + 1);
            }
            String candidate = name;
            int n = occurrences.getOrDefault(name, 1);
            while (used.contains(candidate)) {
                n++;
                candidate = name + n;
            }
            occurrences.put(name, n);
            used.add(candidate);
            header.add(candidate);
        }
        return header;
    }

    static ReadResult toRecords(List<String> header, List<List<String>> rows,
                                RecordSource source, String origin) {
        int statusIndex = header.indexOf(STATUS);
        boolean filterByStatus = statusIndex >= 0 && rows.stream()
                .anyMatch(r -> statusIndex < r.size() && !ValueNormalizer.isBlank(r.get(statusIndex)));

        List<Map<String, String>> kept = new ArrayList<>();
        int skipped = 0;
        for (List<String> values : rows) {
            if (filterByStatus) {
                String status = statusIndex < values.size() ? ValueNormalizer.normalize(values.get(statusIndex)) : "";
                if (!ScrapeJsonReader.SUCCESS.equals(status)) {
                    skipped++;
                    continue;
                }
            }
            Map<String, String> row = new LinkedHashMap<>();
            boolean hasData = false;
            for (int c = 0; c < header.size(); c++) {
                String column = header.get(c);
                if (STATUS.equals(column) || ERROR.equals(column)) {
                    continue;
                }
                String value = c < values.size() ? ValueNormalizer.normalize(values.get(c)) : "";
                row.put(column, value);
                hasData |= !value.isEmpty();
            }
            if (hasData) {
                kept.add(row);
            } else {
                skipped++;
            }
        }

        Set<Map<String, String>> distinct = new LinkedHashSet<>(kept);
        skipped += kept.size() - distinct.size();

        Set<String> usedColumns = new HashSet<>();
        for (Map<String, String> row : distinct) {
            row.forEach((column, value) -> {
                if (!value.isEmpty()) {
                    usedColumns.add(column);
                }
            });
        }

        List<RawRecord> records = new ArrayList<>(distinct.size());
        for (Map<String, String> row : distinct) {
            Map<String, String> trimmed = new LinkedHashMap<>(row);
            trimmed.keySet().retainAll(usedColumns);
            records.add(new RawRecord(source, origin, trimmed));
        }
        return new ReadResult(records, skipped, List.of());
    }
}
