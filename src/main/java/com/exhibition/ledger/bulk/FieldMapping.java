package com.exhibition.ledger.bulk;

import java.util.Map;
import java.util.Set;

/**
 * Maps extractor JSON keys to workbook column names.
 */
public final class FieldMapping {

    private static final Map<String, String> COLUMNS = Map.ofEntries(
            Map.entry("addresses", "Address"),
            Map.entry("phones", "Phone1"),
            Map.entry("faxes", "Fax"),
            Map.entry("emails", "Email"),
            Map.entry("urls", "Website"),
            Map.entry("telegram", "Telegram"),
            Map.entry("instagram", "Instagram"),
            Map.entry("linkedin", "LinkedIn"),
            Map.entry("company_names", "CompanyName"),
            Map.entry("services", "Services"),
            Map.entry("persons", "ContactName"),
            Map.entry("notes", "Notes"),
            Map.entry("qr_links", "QRLink"),
            Map.entry("qr_link", "QRLink")
    );

    // raw OCR transcript, too large and unstructured for a ledger cell
    private static final Set<String> DROPPED = Set.of("ocr_text");

    private FieldMapping() {
        // Utility class
    }

    /**
     * Returns the column name for a JSON key; unmapped keys keep their name.
     */
    public static String columnFor(String key) {
        return COLUMNS.getOrDefault(key, key);
    }

    public static boolean isDropped(String key) {
        return DROPPED.contains(key);
    }
}
