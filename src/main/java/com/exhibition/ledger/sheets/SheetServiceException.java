package com.exhibition.ledger.sheets;

/**
 * A failed remote sheet call, classified by {@link RemoteErrorClassifier}.
 */
public class SheetServiceException extends RuntimeException {

    private final SyncErrorKind kind;
    private final int statusCode;

    public SheetServiceException(SyncErrorKind kind, int statusCode, String message) {
        super(message);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public SheetServiceException(SyncErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = -1;
    }

    public SyncErrorKind getKind() {
        return kind;
    }

    /**
     * HTTP status of the failed call, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
