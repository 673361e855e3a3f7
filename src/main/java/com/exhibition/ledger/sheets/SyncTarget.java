package com.exhibition.ledger.sheets;

import java.util.Objects;

/**
 * The remote sheet a ledger is synchronized into.
 *
 * @param spreadsheetId stable external ID of the spreadsheet
 * @param sheetName     name of the tab inside it
 */
public record SyncTarget(String spreadsheetId, String sheetName) {

    public SyncTarget {
        Objects.requireNonNull(spreadsheetId, "spreadsheetId is required");
        Objects.requireNonNull(sheetName, "sheetName is required");
        if (spreadsheetId.isBlank() || sheetName.isBlank()) {
            throw new IllegalArgumentException("spreadsheetId and sheetName must not be blank");
        }
    }

    /**
     * Qualifies an A1 range with the quoted sheet name, e.g. {@code 'Booth Cards'!A1:C1}.
     */
    public String qualify(String a1) {
        return "'" + sheetName.replace("'", "''") + "'!" + a1;
    }
}
