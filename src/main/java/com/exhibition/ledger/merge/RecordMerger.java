package com.exhibition.ledger.merge;

import com.exhibition.ledger.core.model.MergedRecord;
import com.exhibition.ledger.core.model.Table;
import com.exhibition.ledger.identity.IdentityKeyResolver;
import com.exhibition.ledger.reconcile.ValueJoiner;
import com.exhibition.ledger.rules.ValueNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Folds the rows of a table into one row per entity.
 *
 * <p>Rows are grouped by their {@code CompanyID} when one is already assigned, otherwise
 * by the company ID of their identity key. Groups keep the order in which their first
 * row appears. A single-row group is emitted as is; a larger group gets, for every column,
 * the distinct non-empty values of its rows joined in row order. A repeated-value
 * post-pass then runs over every output row.</p>
 */
public class RecordMerger {
    private static final Logger log = LoggerFactory.getLogger(RecordMerger.class);

    private static final Pattern UNKNOWN_ID = Pattern.compile("COMP_UNKNOWN_[A-F0-9]+");

    private final IdentityKeyResolver resolver;
    private final RepeatedValueScrubber scrubber;

    public RecordMerger() {
        this(new IdentityKeyResolver(), RepeatedValueScrubber.DEFAULT_THRESHOLD);
    }

    public RecordMerger(IdentityKeyResolver resolver, int repeatThreshold) {
        this(resolver, new RepeatedValueScrubber(repeatThreshold, Set.of(Table.COMPANY_ID, Table.FILE_NAME)));
    }

    public RecordMerger(IdentityKeyResolver resolver, RepeatedValueScrubber scrubber) {
        this.resolver = resolver;
        this.scrubber = scrubber;
    }

    public MergeResult merge(Table input) {
        Map<String, List<Map<String, String>>> groups = new LinkedHashMap<>();
        for (Map<String, String> row : input.rows()) {
            groups.computeIfAbsent(companyIdOf(row), k -> new ArrayList<>()).add(row);
        }

        List<String> columns = new ArrayList<>();
        columns.add(Table.COMPANY_ID);
        for (String column : input.columns()) {
            if (!Table.COMPANY_ID.equals(column)) {
                columns.add(column);
            }
        }

        Table output = new Table(columns);
        List<MergedRecord> records = new ArrayList<>(groups.size());
        int mergedGroups = 0;
        int scrubbed = 0;

        for (Map.Entry<String, List<Map<String, String>>> group : groups.entrySet()) {
            String companyId = group.getKey();
            List<Map<String, String>> rows = group.getValue();
            Map<String, String> merged = new LinkedHashMap<>();
            merged.put(Table.COMPANY_ID, companyId);

            if (rows.size() == 1) {
                Map<String, String> only = rows.get(0);
                for (String column : columns.subList(1, columns.size())) {
                    merged.put(column, only.getOrDefault(column, ""));
                }
            } else {
                mergedGroups++;
                for (String column : columns.subList(1, columns.size())) {
                    List<String> values = new ArrayList<>(rows.size());
                    for (Map<String, String> row : rows) {
                        values.add(row.getOrDefault(column, ""));
                    }
                    merged.put(column, ValueJoiner.join(values));
                }
                log.debug("merge.group companyId={} rows={}", companyId, rows.size());
            }

            scrubbed += scrubber.scrub(merged);
            output.addRow(merged);
            records.add(new MergedRecord(companyId, merged, rows.size()));
        }

        log.info("merge.completed inputRows={} outputRows={} mergedGroups={} scrubbedCells={}",
                input.rowCount(), records.size(), mergedGroups, scrubbed);
        return new MergeResult(output, records, input.rowCount(), mergedGroups, scrubbed);
    }

    private String companyIdOf(Map<String, String> row) {
        String assigned = cleanCompanyId(row.get(Table.COMPANY_ID));
        if (!assigned.isEmpty()) {
            return assigned;
        }
        return resolver.resolve(row).companyId();
    }

    /**
     * Reduces a possibly pipe-joined company ID to a single one. An unknown-entity ID
     * anywhere in the value wins; otherwise the first segment is used.
     */
    static String cleanCompanyId(String value) {
        String normalized = ValueNormalizer.normalize(value);
        if (normalized.isEmpty()) {
            return "";
        }
        Matcher m = UNKNOWN_ID.matcher(normalized);
        if (m.find()) {
            return m.group();
        }
        int pipe = normalized.indexOf('|');
        return pipe >= 0 ? normalized.substring(0, pipe).strip() : normalized;
    }
}
