package com.exhibition.ledger.reconcile;

import com.exhibition.ledger.core.model.ColumnGroup;
import com.exhibition.ledger.core.model.Table;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a reconciliation run.
 *
 * @param table          the reconciled table (a new instance; the input is untouched)
 * @param appliedGroups  every group merged, in the order applied
 * @param rounds         number of full pass sequences executed, including the final no-op round
 */
public record ReconciliationResult(Table table, List<AppliedGroup> appliedGroups, int rounds) {

    /**
     * A group merged by a named pass.
     */
    public record AppliedGroup(String pass, ColumnGroup group) {
    }

    public ReconciliationResult {
        appliedGroups = List.copyOf(appliedGroups);
    }

    /**
     * Number of columns dropped across all passes.
     */
    public int removedColumnCount() {
        return appliedGroups.stream().mapToInt(g -> g.group().redundant().size()).sum();
    }

    /**
     * Dropped column count per pass name, in pass order of first use.
     */
    public Map<String, Integer> removedColumnsByPass() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (AppliedGroup applied : appliedGroups) {
            counts.merge(applied.pass(), applied.group().redundant().size(), Integer::sum);
        }
        return counts;
    }

    public boolean changed() {
        return !appliedGroups.isEmpty();
    }
}
