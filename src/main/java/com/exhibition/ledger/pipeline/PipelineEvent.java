package com.exhibition.ledger.pipeline;

/**
 * Progress notification emitted by {@link SourceFusionPipeline}.
 *
 * @param stage     the stage reporting
 * @param message   short human-readable description
 * @param processed items handled so far in this stage
 * @param total     items expected in this stage, or -1 if unknown
 */
public record PipelineEvent(Stage stage, String message, long processed, long total) {

    public enum Stage {
        INGEST,
        LINK,
        ASSIGN_IDS,
        RECONCILE,
        MERGE,
        COMPLETE
    }

    public static PipelineEvent of(Stage stage, String message, long processed, long total) {
        return new PipelineEvent(stage, message, processed, total);
    }
}
