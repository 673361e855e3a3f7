package com.exhibition.ledger.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("sheet.append", Map.of("sheetName", "Ledger"))) {
                    span.setAttribute("range", "C2:D41");
                    span.setAttribute("rows", 40L);
                    span.setStatus(Span.SpanStatus.ERROR);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("op1"), noOp.startSpan("op2"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer mockTracer;
        private SpanBuilder mockBuilder;
        private io.opentelemetry.api.trace.Span mockOtelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            mockTracer = mock(Tracer.class);
            mockBuilder = mock(SpanBuilder.class);
            mockOtelSpan = mock(io.opentelemetry.api.trace.Span.class);

            when(mockTracer.spanBuilder(anyString())).thenReturn(mockBuilder);
            when(mockBuilder.setSpanKind(any())).thenReturn(mockBuilder);
            when(mockBuilder.setAttribute(anyString(), anyString())).thenReturn(mockBuilder);
            when(mockBuilder.startSpan()).thenReturn(mockOtelSpan);

            service = new OpenTelemetryTracingService(mockTracer);
        }

        @Test
        @DisplayName("Should create a client span with the operation name and attributes")
        void createSpan() {
            Span span = service.startSpan("sheet.read-header", Map.of("spreadsheetId", "abc"));

            assertNotNull(span);
            verify(mockTracer).spanBuilder("sheet.read-header");
            verify(mockBuilder).setSpanKind(SpanKind.CLIENT);
            verify(mockBuilder).setAttribute("spreadsheetId", "abc");
            verify(mockBuilder).startSpan();
        }

        @Test
        @DisplayName("Should delegate attributes, status and exceptions")
        void delegates() {
            Span span = service.startSpan("sheet.backfill");
            RuntimeException ex = new RuntimeException("quota");

            span.setAttribute("range", "C2:D41");
            span.setAttribute("rows", 40L);
            span.recordException(ex);
            span.setStatus(Span.SpanStatus.ERROR);

            verify(mockOtelSpan).setAttribute("range", "C2:D41");
            verify(mockOtelSpan).setAttribute("rows", 40L);
            verify(mockOtelSpan).recordException(ex);
            verify(mockOtelSpan).setStatus(StatusCode.ERROR);
        }

        @Test
        @DisplayName("Should set OK status and end span on close")
        void okAndEnd() {
            Span span = service.startSpan("sheet.append");
            span.setStatus(Span.SpanStatus.OK);
            span.close();

            verify(mockOtelSpan).setStatus(StatusCode.OK);
            verify(mockOtelSpan).end();
        }
    }
}
