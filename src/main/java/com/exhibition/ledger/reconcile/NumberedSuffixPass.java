package com.exhibition.ledger.reconcile;

import com.exhibition.ledger.core.model.ColumnGroup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups columns that differ only by a trailing number: {@code Phone1}, {@code Phone2},
 * {@code phone_3}. The shortest name survives ({@code Phone1}); values merge in
 * (length, name) order so {@code Phone2} precedes {@code Phone10}.
 */
public class NumberedSuffixPass implements ReconciliationPass {

    // base must end in something other than a digit or separator, so "2024" has no base
    private static final Pattern NUMBERED = Pattern.compile("^(.*[^\\d_\\s-])[_\\s-]?\\d+$");

    private static final Comparator<String> SHORTEST_FIRST =
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    @Override
    public String name() {
        return "numbered";
    }

    @Override
    public List<ColumnGroup> detect(List<String> columns, Set<String> protectedColumns) {
        Map<String, List<String>> byBase = new LinkedHashMap<>();
        for (String column : columns) {
            if (protectedColumns.contains(column)) {
                continue;
            }
            byBase.computeIfAbsent(baseName(column), k -> new ArrayList<>()).add(column);
        }

        List<ColumnGroup> groups = new ArrayList<>();
        for (List<String> members : byBase.values()) {
            if (members.size() < 2) {
                continue;
            }
            List<String> ordered = new ArrayList<>(members);
            ordered.sort(SHORTEST_FIRST);
            groups.add(new ColumnGroup(ordered.get(0), ordered));
        }
        return groups;
    }

    /**
     * Lower-cased column name with any trailing number removed.
     */
    static String baseName(String column) {
        String lower = column.strip().toLowerCase(Locale.ROOT);
        Matcher m = NUMBERED.matcher(lower);
        return m.matches() ? m.group(1) : lower;
    }
}
