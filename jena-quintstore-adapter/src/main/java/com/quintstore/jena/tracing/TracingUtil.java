package com.quintstore.jena.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ServiceAttributes;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry setup for the quint store, plus the span attributes and
 * helpers shared by the store, the SQL executors and the query layer.
 *
 * <p>Settings come from the environment:</p>
 * <ul>
 *   <li>{@code OTEL_TRACING_ENABLED} - false turns every tracer into a
 *       no-op (default: true)</li>
 *   <li>{@code OTEL_SERVICE_NAME} - service name
 *       (default: jena-quintstore)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT} - OTLP gRPC endpoint
 *       (default: http://localhost:4317)</li>
 * </ul>
 */
public final class TracingUtil {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingUtil.class);

    /** Instrumentation scope for quint store operations. */
    public static final String SCOPE_QUINT_STORE =
        "com.quintstore.jena.store.QuintStore";

    /** Instrumentation scope for the Jena graph and dataset adapters. */
    public static final String SCOPE_QUINT_GRAPH =
        "com.quintstore.jena.QuintGraph";

    /** Instrumentation scope for JDBC statements. */
    public static final String SCOPE_SQL_DRIVER = "com.quintstore.jdbc";

    /** Instrumentation scope for query planning and execution. */
    public static final String SCOPE_QUERY_ENGINE =
        "com.quintstore.jena.query";

    /** Database engine, {@code sqlite} or {@code postgresql}. */
    public static final AttributeKey<String> ATTR_DB_SYSTEM =
        AttributeKey.stringKey("db.system");

    /** SQL text of a statement. */
    public static final AttributeKey<String> ATTR_DB_STATEMENT =
        AttributeKey.stringKey("db.statement");

    /** Store operation name, such as {@code multiPut}. */
    public static final AttributeKey<String> ATTR_STORE_OPERATION =
        AttributeKey.stringKey("quintstore.operation");

    /** Rows returned or affected. */
    public static final AttributeKey<Long> ATTR_ROW_COUNT =
        AttributeKey.longKey("quintstore.row_count");

    /**
     * Tracing settings read from the environment.
     *
     * @param enabled whether spans are exported
     * @param serviceName the service name resource attribute
     * @param endpoint the OTLP gRPC endpoint
     */
    record Settings(boolean enabled, String serviceName, String endpoint) {

        /** Default service name. */
        static final String DEFAULT_SERVICE_NAME = "jena-quintstore";

        /** Default OTLP endpoint. */
        static final String DEFAULT_ENDPOINT = "http://localhost:4317";

        /**
         * Read the settings through a variable lookup. Unset and empty
         * variables take their defaults.
         *
         * @param env returns a variable's value, or null
         * @return the settings
         */
        static Settings from(final UnaryOperator<String> env) {
            String enabled = blankToNull(env.apply("OTEL_TRACING_ENABLED"));
            String service = blankToNull(env.apply("OTEL_SERVICE_NAME"));
            String endpoint = blankToNull(env.apply("OTEL_EXPORTER_OTLP_ENDPOINT"));
            return new Settings(
                enabled == null || Boolean.parseBoolean(enabled),
                service == null ? DEFAULT_SERVICE_NAME : service,
                endpoint == null ? DEFAULT_ENDPOINT : endpoint);
        }

        private static String blankToNull(final String value) {
            return value == null || value.isEmpty() ? null : value;
        }
    }

    /** The SDK or no-op instance, built on first use. */
    private static volatile OpenTelemetry openTelemetry;

    /** Settings the instance was built from. */
    private static volatile Settings settings;

    /** Guards initialisation. */
    private static final Object INIT_LOCK = new Object();

    /** Prevent instantiation. */
    private TracingUtil() {
        throw new AssertionError("No instances");
    }

    /**
     * Get the OpenTelemetry instance, building it on first call.
     *
     * @return the OpenTelemetry instance
     */
    public static OpenTelemetry getOpenTelemetry() {
        if (openTelemetry == null) {
            synchronized (INIT_LOCK) {
                if (openTelemetry == null) {
                    Settings current = Settings.from(System::getenv);
                    openTelemetry = build(current);
                    settings = current;
                }
            }
        }
        return openTelemetry;
    }

    /**
     * Get a tracer for an instrumentation scope.
     *
     * @param scopeName one of the {@code SCOPE_*} names
     * @return the tracer
     */
    public static Tracer getTracer(final String scopeName) {
        return getOpenTelemetry().getTracer(scopeName);
    }

    /**
     * Check if tracing is enabled.
     *
     * @return true if spans are exported
     */
    public static boolean isTracingEnabled() {
        getOpenTelemetry();
        return settings.enabled();
    }

    /**
     * Start building a span against one database.
     *
     * @param tracer the tracer
     * @param name the span name
     * @param kind INTERNAL for store operations, CLIENT for statements
     * @param dbSystem the database engine
     * @return the span builder
     */
    public static SpanBuilder databaseSpan(final Tracer tracer,
            final String name, final SpanKind kind, final String dbSystem) {
        return tracer.spanBuilder(name)
            .setSpanKind(kind)
            .setAttribute(ATTR_DB_SYSTEM, dbSystem);
    }

    /**
     * Mark a span as failed and attach the exception.
     *
     * @param span the span
     * @param failure the exception about to be rethrown
     */
    public static void recordFailure(final Span span, final Throwable failure) {
        span.setStatus(StatusCode.ERROR, String.valueOf(failure.getMessage()));
        span.recordException(failure);
    }

    /**
     * Shut the tracing SDK down, flushing pending spans.
     */
    public static void shutdown() {
        if (openTelemetry instanceof OpenTelemetrySdk sdk) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Shutting down OpenTelemetry SDK");
            }
            sdk.getSdkTracerProvider().shutdown();
        }
    }

    private static OpenTelemetry build(final Settings current) {
        if (!current.enabled()) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Quint store tracing is disabled");
            }
            return OpenTelemetry.noop();
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Exporting quint store spans as {} to {}",
                current.serviceName(), current.endpoint());
        }

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(
                OtlpGrpcSpanExporter.builder()
                    .setEndpoint(current.endpoint())
                    .build()).build())
            .setResource(Resource.getDefault().merge(Resource.create(
                Attributes.of(ServiceAttributes.SERVICE_NAME,
                    current.serviceName()))))
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(
            tracerProvider::shutdown, "quintstore-tracing-shutdown"));

        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(
                W3CTraceContextPropagator.getInstance()))
            .build();
    }
}
