package com.exhibition.ledger.reconcile;

import com.exhibition.ledger.core.model.ColumnGroup;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pairs an English column with its Persian counterpart by naming convention and
 * folds the Persian values into the English column.
 *
 * <p>Conventions, tried in order for each column:</p>
 * <ul>
 *   <li>{@code XEN} / {@code XFA}</li>
 *   <li>{@code X_en} / {@code X_fa}</li>
 *   <li>{@code XEnglish} / {@code XPersian}</li>
 *   <li>{@code X} / {@code XFA}</li>
 *   <li>{@code X} / {@code X_translated}</li>
 * </ul>
 */
public class BilingualPairPass implements ReconciliationPass {

    private record Convention(String englishSuffix, String persianSuffix) {
    }

    private static final List<Convention> CONVENTIONS = List.of(
            new Convention("EN", "FA"),
            new Convention("_en", "_fa"),
            new Convention("English", "Persian"),
            new Convention("", "FA"),
            new Convention("", "_translated")
    );

    @Override
    public String name() {
        return "bilingual";
    }

    @Override
    public List<ColumnGroup> detect(List<String> columns, Set<String> protectedColumns) {
        Set<String> available = new HashSet<>(columns);
        available.removeAll(protectedColumns);
        Set<String> paired = new HashSet<>();
        List<ColumnGroup> groups = new ArrayList<>();

        for (String column : columns) {
            if (!available.contains(column) || paired.contains(column)) {
                continue;
            }
            for (Convention convention : CONVENTIONS) {
                String persian = counterpart(column, convention);
                if (persian != null && available.contains(persian) && !paired.contains(persian)) {
                    groups.add(new ColumnGroup(column, List.of(column, persian)));
                    paired.add(column);
                    paired.add(persian);
                    break;
                }
            }
        }
        return groups;
    }

    private static String counterpart(String column, Convention convention) {
        String en = convention.englishSuffix();
        if (en.isEmpty()) {
            return column + convention.persianSuffix();
        }
        if (column.length() > en.length() && column.endsWith(en)) {
            return column.substring(0, column.length() - en.length()) + convention.persianSuffix();
        }
        return null;
    }
}
