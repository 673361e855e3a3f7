package com.exhibition.ledger.pipeline;

/**
 * Ingestion mode, selected by which raw inputs exist and yield records.
 */
public enum FusionMode {
    /** OCR + QR extraction JSON, optionally enriched by scraped websites. */
    OCR_QR,
    /** A single operator workbook or CSV export. */
    EXCEL,
    /** Both of the above, fused by identity key. */
    COMBINED
}
