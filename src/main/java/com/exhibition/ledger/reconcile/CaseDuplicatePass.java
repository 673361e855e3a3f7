package com.exhibition.ledger.reconcile;

import com.exhibition.ledger.core.model.ColumnGroup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Groups columns whose names coincide ignoring case and surrounding whitespace
 * ({@code Email}, {@code email}, {@code EMAIL }). The first spelling in table order survives.
 */
public class CaseDuplicatePass implements ReconciliationPass {

    @Override
    public String name() {
        return "case";
    }

    @Override
    public List<ColumnGroup> detect(List<String> columns, Set<String> protectedColumns) {
        Map<String, List<String>> byLower = new LinkedHashMap<>();
        for (String column : columns) {
            if (protectedColumns.contains(column)) {
                continue;
            }
            byLower.computeIfAbsent(column.strip().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(column);
        }

        List<ColumnGroup> groups = new ArrayList<>();
        for (List<String> members : byLower.values()) {
            if (members.size() > 1) {
                groups.add(new ColumnGroup(members.get(0), members));
            }
        }
        return groups;
    }
}
