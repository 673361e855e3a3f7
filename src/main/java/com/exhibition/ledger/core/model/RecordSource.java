package com.exhibition.ledger.core.model;

/**
 * Channel a raw record was captured through.
 */
public enum RecordSource {
    /**
     * Optical character recognition of a scanned card or brochure page, merged with
     * the QR payloads decoded from the same page.
     */
    OCR_QR("OCR/QR"),

    /**
     * AI-driven extraction from a crawled company website.
     */
    SCRAPE("Web scrape"),

    /**
     * Spreadsheet supplied by an operator.
     */
    EXCEL_OPERATOR("Operator spreadsheet");

    private final String label;

    RecordSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
