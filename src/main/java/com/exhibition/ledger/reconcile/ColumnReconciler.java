package com.exhibition.ledger.reconcile;

import com.exhibition.ledger.core.model.ColumnGroup;
import com.exhibition.ledger.core.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collapses column variants emitted by different extractors into one canonical schema.
 *
 * <p>The passes run in order (numbered suffixes, case duplicates, bilingual pairs,
 * alias groups) and the whole sequence repeats until a round removes nothing. For each
 * merged group, every row's distinct non-empty member values are joined into the
 * canonical column with {@link ValueJoiner}, which keeps its position; the other
 * members are dropped. A reconciled table is a fixpoint, so reconciling it again
 * changes nothing.</p>
 *
 * <p>Protected columns ({@code CompanyID} and {@code file_name} by default) never
 * take part in a group.</p>
 */
public class ColumnReconciler {
    private static final Logger log = LoggerFactory.getLogger(ColumnReconciler.class);

    private final List<ReconciliationPass> passes;
    private final Set<String> protectedColumns;

    public ColumnReconciler() {
        this(defaultPasses(), Set.of(Table.COMPANY_ID, Table.FILE_NAME));
    }

    public ColumnReconciler(List<ReconciliationPass> passes, Set<String> protectedColumns) {
        this.passes = List.copyOf(passes);
        this.protectedColumns = Set.copyOf(protectedColumns);
    }

    public static List<ReconciliationPass> defaultPasses() {
        return List.of(
                new NumberedSuffixPass(),
                new CaseDuplicatePass(),
                new BilingualPairPass(),
                new AliasGroupPass(AliasGroupPass.defaultAliases())
        );
    }

    /**
     * Reconciles a copy of the given table.
     */
    public ReconciliationResult reconcile(Table input) {
        Table table = input.copy();
        List<ReconciliationResult.AppliedGroup> applied = new ArrayList<>();
        int columnsBefore = table.columnCount();

        // a productive round drops a column or renames one to an alias canonical, so this terminates
        int rounds = 0;
        boolean removed;
        do {
            rounds++;
            removed = false;
            for (ReconciliationPass pass : passes) {
                List<ColumnGroup> groups = pass.detect(table.columns(), protectedColumns);
                for (ColumnGroup group : groups) {
                    if (apply(table, group)) {
                        applied.add(new ReconciliationResult.AppliedGroup(pass.name(), group));
                        removed = true;
                        log.debug("reconcile.group pass={} canonical={} members={}",
                                pass.name(), group.canonical(), group.members());
                    }
                }
            }
        } while (removed);

        log.info("reconcile.completed columnsBefore={} columnsAfter={} groups={} rounds={}",
                columnsBefore, table.columnCount(), applied.size(), rounds);
        return new ReconciliationResult(table, applied, rounds);
    }

    /**
     * Merges one group in place. Returns false when fewer than two members or
     * only the canonical column remain.
     */
    static boolean apply(Table table, ColumnGroup group) {
        Set<String> present = new LinkedHashSet<>();
        for (String member : group.members()) {
            if (table.hasColumn(member)) {
                present.add(member);
            }
        }
        String canonical = group.canonical();
        if (present.isEmpty() || (present.size() == 1 && present.contains(canonical))) {
            return false;
        }

        if (!table.hasColumn(canonical)) {
            table.addColumn(table.indexOf(present.iterator().next()), canonical);
        }

        for (int i = 0; i < table.rowCount(); i++) {
            List<String> values = new ArrayList<>(present.size());
            for (String member : present) {
                values.add(table.get(i, member));
            }
            table.set(i, canonical, ValueJoiner.join(values));
        }

        for (String member : present) {
            if (!member.equals(canonical)) {
                table.removeColumn(member);
            }
        }
        return true;
    }
}
