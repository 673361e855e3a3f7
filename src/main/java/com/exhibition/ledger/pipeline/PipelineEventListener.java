package com.exhibition.ledger.pipeline;

/**
 * Receives progress events from a fusion run; a UI or CLI subscribes here.
 */
@FunctionalInterface
public interface PipelineEventListener {

    void onEvent(PipelineEvent event);

    PipelineEventListener NOOP = event -> {};
}
