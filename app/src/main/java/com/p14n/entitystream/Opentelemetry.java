package com.p14n.entitystream;

import com.p14n.entitystream.telemetry.DefaultTelemetryConfig;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ServiceAttributes;

/**
 * OpenTelemetry for the process. Spans go to an OTLP collector when an
 * endpoint is configured; otherwise they stay in process.
 */
public class Opentelemetry {

        private Opentelemetry() {
        }

        public static OpenTelemetry create(String serviceName, String otlpEndpoint) {
                if (otlpEndpoint == null || otlpEndpoint.isBlank()) {
                        return new DefaultTelemetryConfig(serviceName).getOpenTelemetry();
                }
                Resource resource = Resource.create(Attributes.of(ServiceAttributes.SERVICE_NAME, serviceName));

                SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                                .setResource(resource)
                                .build();

                OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
                                .setEndpoint(otlpEndpoint)
                                .build();

                SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                                .setResource(resource)
                                .build();

                return OpenTelemetrySdk.builder()
                                .setMeterProvider(meterProvider)
                                .setTracerProvider(tracerProvider)
                                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                                .build();
        }
}
