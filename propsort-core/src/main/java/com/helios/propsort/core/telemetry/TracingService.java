/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry tracing for sort and extraction runs.
 *
 * <p>The provider is private to this library and is not registered as the global
 * OpenTelemetry instance, so an embedding application keeps control of its own.
 *
 * Configuration via environment variables (or system properties of the same name):
 * - OTEL_DISABLED: disable tracing entirely (default: false)
 * - OTEL_EXPORTER_TYPE: logging|otlp (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default: 1.0)
 * - SERVICE_NAME: service identifier (default: propsort)
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.helios.propsort";
    private static final String DEFAULT_SERVICE_NAME = "propsort";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;

        if (tracerProvider != null) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "propsort-otel-shutdown"));
        }
    }

    /**
     * Singleton with double-checked locking.
     */
    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    private static TracingService initialize() {
        if (Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"))) {
            logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
            return noop();
        }

        try {
            Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
                    .put(SERVICE_NAME, getEnvOrProperty("SERVICE_NAME", DEFAULT_SERVICE_NAME))
                    .put(SERVICE_VERSION, getEnvOrProperty("SERVICE_VERSION", "unknown"))
                    .build()));

            Sampler sampler = Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio())).build();

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(configureExporter())
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .setExporterTimeout(Duration.ofSeconds(30))
                            .build())
                    .build();

            OpenTelemetry openTelemetry = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .build();

            logger.info("OpenTelemetry initialized: sampler=" + sampler.getDescription());
            return new TracingService(openTelemetry, tracerProvider);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    private static double samplingRatio() {
        String raw = getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", "1.0");
        try {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(raw)));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using default: " + raw);
            return 1.0;
        }
    }

    private static SpanExporter configureExporter() {
        String exporterType = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase();

        return switch (exporterType) {
            case "otlp" -> {
                String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
                logger.info("Using OTLP exporter: " + endpoint);
                yield OtlpGrpcSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(30, TimeUnit.SECONDS)
                        .build();
            }
            case "logging" -> LoggingSpanExporter.create();
            default -> {
                logger.warning("Unknown exporter type: " + exporterType + ", using logging");
                yield LoggingSpanExporter.create();
            }
        };
    }

    /**
     * Drains buffered spans. Safe to call more than once.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
