package com.exhibition.ledger.pipeline;

import com.exhibition.ledger.core.model.IdentityKey;
import com.exhibition.ledger.core.model.Table;
import com.exhibition.ledger.identity.IdentityKeyResolver;
import com.exhibition.ledger.rules.ValueNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fills the {@code CompanyID} column and moves it to the front.
 */
public class CompanyIdAssigner {
    private static final Logger log = LoggerFactory.getLogger(CompanyIdAssigner.class);

    private final IdentityKeyResolver resolver;

    public CompanyIdAssigner(IdentityKeyResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Gives every page of a document the same company ID, then sorts rows by
     * ({@code file_name}, {@code CompanyID}).
     *
     * <p>An ID already present on any row of the document is propagated. Otherwise the
     * strongest identity key among the document's rows is used, the earliest row winning
     * a tie. A row without {@code file_name} forms its own group.</p>
     */
    public void assignPerDocument(Table table) {
        ensureLeadingColumn(table);

        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < table.rowCount(); i++) {
            String fileName = table.get(i, Table.FILE_NAME);
            String groupKey = fileName.isEmpty() ? "\u0000row:" + i : fileName;
            groups.computeIfAbsent(groupKey, k -> new ArrayList<>()).add(i);
        }

        int propagated = 0;
        for (List<Integer> rows : groups.values()) {
            Optional<String> existing = existingId(table, rows);
            String companyId;
            if (existing.isPresent()) {
                companyId = existing.get();
                propagated++;
            } else {
                companyId = strongestKey(table, rows).companyId();
            }
            for (int row : rows) {
                table.set(row, Table.COMPANY_ID, companyId);
            }
        }

        table.sortRows(Comparator
                .comparing((Map<String, String> r) -> r.getOrDefault(Table.FILE_NAME, ""))
                .thenComparing(r -> r.getOrDefault(Table.COMPANY_ID, "")));
        log.info("ids.assigned mode=document groups={} propagated={}", groups.size(), propagated);
    }

    /**
     * Gives each row without a company ID the ID of its own identity key.
     */
    public void assignPerRow(Table table) {
        ensureLeadingColumn(table);
        int assigned = 0;
        for (int i = 0; i < table.rowCount(); i++) {
            if (ValueNormalizer.isBlank(table.get(i, Table.COMPANY_ID))) {
                table.set(i, Table.COMPANY_ID, resolver.resolve(table.row(i)).companyId());
                assigned++;
            }
        }
        log.info("ids.assigned mode=row rows={} assigned={}", table.rowCount(), assigned);
    }

    private IdentityKey strongestKey(Table table, List<Integer> rows) {
        IdentityKey best = null;
        for (int row : rows) {
            Optional<IdentityKey> key = resolver.resolveReproducible(table.row(row));
            if (key.isPresent() && (best == null || key.get().type().isStrongerThan(best.type()))) {
                best = key.get();
            }
        }
        return best != null ? best : resolver.resolve(table.row(rows.get(0)));
    }

    private static Optional<String> existingId(Table table, List<Integer> rows) {
        for (int row : rows) {
            String id = ValueNormalizer.normalize(table.get(row, Table.COMPANY_ID));
            if (!id.isEmpty()) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    private static void ensureLeadingColumn(Table table) {
        table.addColumn(0, Table.COMPANY_ID);
        table.moveColumn(Table.COMPANY_ID, 0);
    }
}
