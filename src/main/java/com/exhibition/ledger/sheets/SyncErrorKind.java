package com.exhibition.ledger.sheets;

/**
 * Classified remote failure. None of them is retried by the synchronizer.
 */
public enum SyncErrorKind {
    /** Rate or quota limit hit; retry later. */
    REMOTE_QUOTA_EXCEEDED,
    /** The credentials may not edit the sheet; a configuration issue. */
    REMOTE_PERMISSION_DENIED,
    /** The workbook cell limit would be exceeded; a new destination is needed. */
    REMOTE_CAPACITY_EXCEEDED,
    REMOTE_UNKNOWN_ERROR
}
