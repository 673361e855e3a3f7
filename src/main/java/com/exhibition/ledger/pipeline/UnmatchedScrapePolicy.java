package com.exhibition.ledger.pipeline;

/**
 * What to do with a scraped record whose domain matches no OCR/QR document.
 */
public enum UnmatchedScrapePolicy {
    /**
     * Attach it to the document name that occurs most often. A heuristic, not a join:
     * the record may end up on the wrong company.
     */
    MOST_COMMON_FILE_NAME,
    /** Leave {@code file_name} empty; the record gets its own company ID. */
    UNASSIGNED
}
