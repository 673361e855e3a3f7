package com.exhibition.ledger.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entity's canonical, fused row. Each value is either a single normalized string
 * or a {@code " | "}-joined list of the distinct values contributed by its source rows.
 *
 * @param companyId        identifier derived from the entity's identity key
 * @param values           canonical column name to value, {@code CompanyID} first
 * @param contributingRows number of raw rows folded into this record
 */
public record MergedRecord(String companyId, Map<String, String> values, int contributingRows) {

    public MergedRecord {
        Objects.requireNonNull(companyId, "companyId is required");
        Map<String, String> ordered = new LinkedHashMap<>();
        ordered.put(Table.COMPANY_ID, companyId);
        if (values != null) {
            values.forEach((k, v) -> {
                if (!Table.COMPANY_ID.equals(k)) {
                    ordered.put(k, v != null ? v : "");
                }
            });
        }
        values = Collections.unmodifiableMap(ordered);
    }

    public boolean isMerged() {
        return contributingRows > 1;
    }

    public String get(String column) {
        return values.getOrDefault(column, "");
    }
}
