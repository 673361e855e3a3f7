package com.exhibition.ledger.tracing;

/**
 * One traced step. Closing the span ends it, so steps run in try-with-resources.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("sheet.append")) {
 *     span.setAttribute("rows", rows.size());
 *     client.appendRows(target, rows);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
