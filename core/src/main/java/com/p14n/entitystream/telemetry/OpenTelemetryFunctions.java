package com.p14n.entitystream.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String topic,
                        Supplier<T> action) {
                SpanBuilder sb = tracer.spanBuilder(spanName);
                if (topic != null) {
                        sb.setAttribute("topic", topic);
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        span.setStatus(StatusCode.ERROR);
                        throw e;
                } finally {
                        span.end();
                }
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName,
                        Supplier<T> action) {
                return processWithTelemetry(tracer, spanName, null, action);
        }

}
