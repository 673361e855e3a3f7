package com.exhibition.ledger.tracing;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}. Sheet spans are
 * started as {@link SpanKind#CLIENT} since each wraps one remote call.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String INSTRUMENTATION_NAME = "com.exhibition.ledger";

    private final Tracer tracer;

    public OpenTelemetryTracingService() {
        this(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.CLIENT);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new SpanAdapter(builder.startSpan());
    }

    private static final class SpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        SpanAdapter(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
