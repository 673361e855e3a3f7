package com.exhibition.ledger.reconcile;

import com.exhibition.ledger.core.model.ColumnGroup;

import java.util.List;
import java.util.Set;

/**
 * One column-collapsing rule. A pass only detects groups; {@link ColumnReconciler}
 * merges their values and drops the redundant columns.
 */
public interface ReconciliationPass {

    /**
     * Short name used in logs and metrics (e.g. {@code numbered}).
     */
    String name();

    /**
     * Detects the column groups to merge, given the table's columns in order.
     * Members are listed in value-merge order; groups must not overlap.
     *
     * @param columns          current column names
     * @param protectedColumns columns that must never be merged
     * @return groups with at least one redundant member (never null)
     */
    List<ColumnGroup> detect(List<String> columns, Set<String> protectedColumns);
}
