package com.exhibition.ledger.pipeline;

/**
 * Thrown when a fusion run has no usable primary source. No output is written.
 */
public class FusionException extends RuntimeException {

    private final FusionErrorKind kind;

    public FusionException(FusionErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FusionException(FusionErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FusionErrorKind getKind() {
        return kind;
    }
}
