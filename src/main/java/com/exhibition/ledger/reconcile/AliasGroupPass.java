package com.exhibition.ledger.reconcile;

import com.exhibition.ledger.core.model.ColumnGroup;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges configured groups of synonymous columns that share no naming pattern,
 * such as {@code faxes} and {@code Fax}. When the canonical column is absent, the
 * first present member is renamed to it.
 */
public class AliasGroupPass implements ReconciliationPass {

    private final List<ColumnGroup> aliases;

    public AliasGroupPass(List<ColumnGroup> aliases) {
        this.aliases = List.copyOf(aliases);
    }

    /**
     * Aliases observed between the OCR/QR extractor, the web scraper and operator sheets.
     */
    public static List<ColumnGroup> defaultAliases() {
        return List.of(
                ColumnGroup.of("Fax", "faxes", "fax", "Fax"),
                ColumnGroup.of("Phone1", "Phone1", "phones", "Phone", "phone"),
                ColumnGroup.of("Website", "Website", "urls", "url", "URL", "website"),
                ColumnGroup.of("Email", "Email", "emails", "OtherEmails"),
                ColumnGroup.of("QRLink", "QRLink", "qr_links", "qr_link")
        );
    }

    @Override
    public String name() {
        return "alias";
    }

    @Override
    public List<ColumnGroup> detect(List<String> columns, Set<String> protectedColumns) {
        Set<String> claimed = new HashSet<>();
        List<ColumnGroup> groups = new ArrayList<>();

        for (ColumnGroup alias : aliases) {
            List<String> present = new ArrayList<>();
            // table order, so the surviving column keeps the first member's position
            for (String column : columns) {
                if (!protectedColumns.contains(column) && !claimed.contains(column)
                        && matchesMember(alias, column)) {
                    present.add(column);
                }
            }
            if (present.isEmpty()) {
                continue;
            }
            if (present.size() == 1 && present.get(0).equals(alias.canonical())) {
                continue;
            }
            claimed.addAll(present);
            groups.add(new ColumnGroup(alias.canonical(), orderCanonicalFirst(alias.canonical(), present)));
        }
        return groups;
    }

    private static boolean matchesMember(ColumnGroup alias, String column) {
        for (String member : alias.members()) {
            if (member.equals(column)) {
                return true;
            }
        }
        return alias.canonical().equals(column);
    }

    private static List<String> orderCanonicalFirst(String canonical, List<String> present) {
        List<String> ordered = new ArrayList<>(present.size() + 1);
        if (present.contains(canonical)) {
            ordered.add(canonical);
        }
        for (String column : present) {
            if (!column.equals(canonical)) {
                ordered.add(column);
            }
        }
        return ordered;
    }
}
