package com.exhibition.ledger.tracing;

import java.util.Map;

/**
 * Starts spans around remote sheet operations.
 * {@link NoOpTracingService} is the default; {@link OpenTelemetryTracingService} bridges to OpenTelemetry.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
