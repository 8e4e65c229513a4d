/**
 * OpenTelemetry tracing for the quint store.
 *
 * <p>{@link com.quintstore.jena.tracing.TracingUtil} owns the SDK
 * configuration and {@link com.quintstore.jena.tracing.TracedSqlExecutor}
 * records one client span per SQL statement.</p>
 */
package com.quintstore.jena.tracing;
