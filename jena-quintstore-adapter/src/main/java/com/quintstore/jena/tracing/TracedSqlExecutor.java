package com.quintstore.jena.tracing;

import com.quintstore.jena.store.SqlDialect;
import com.quintstore.jena.store.SqlExecutor;
import com.quintstore.jena.store.SqlStatement;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * A wrapper around a {@link SqlExecutor} that records one client span per
 * statement, with the SQL text and parameter count.
 *
 * <p>When tracing is disabled every call goes straight to the delegate.</p>
 */
public final class TracedSqlExecutor implements SqlExecutor {
    /** The wrapped executor. */
    private final SqlExecutor delegate;

    /** Tracer for creating spans. */
    private final Tracer tracer;

    /** Attribute key for bound parameter count. */
    private static final AttributeKey<Long> ATTR_PARAM_COUNT =
        AttributeKey.longKey("db.quintstore.param_count");

    /** Attribute key for the number of statements in a batch. */
    private static final AttributeKey<Long> ATTR_BATCH_SIZE =
        AttributeKey.longKey("db.quintstore.batch_size");

    /** A traced statement. */
    @FunctionalInterface
    private interface SqlCall<T> {
        T call() throws SQLException;
    }

    /**
     * Create a traced executor.
     *
     * @param delegate the executor to wrap
     */
    public TracedSqlExecutor(final SqlExecutor delegate) {
        this(delegate, TracingUtil.getTracer(TracingUtil.SCOPE_SQL_DRIVER));
    }

    /**
     * Create a traced executor with an explicit tracer.
     *
     * @param delegate the executor to wrap
     * @param tracer the tracer
     */
    public TracedSqlExecutor(final SqlExecutor delegate, final Tracer tracer) {
        this.delegate = delegate;
        this.tracer = tracer;
    }

    /**
     * Get the wrapped executor.
     *
     * @return the delegate
     */
    public SqlExecutor getDelegate() {
        return delegate;
    }

    @Override
    public List<Map<String, Object>> query(final String sql,
            final List<Object> params) throws SQLException {
        if (!TracingUtil.isTracingEnabled()) {
            return delegate.query(sql, params);
        }
        Span span = startSpan("SQL.query", sql, params.size());
        return run(span, () -> {
            List<Map<String, Object>> rows = delegate.query(sql, params);
            span.setAttribute(TracingUtil.ATTR_ROW_COUNT, (long) rows.size());
            return rows;
        });
    }

    @Override
    public int execute(final String sql, final List<Object> params)
            throws SQLException {
        if (!TracingUtil.isTracingEnabled()) {
            return delegate.execute(sql, params);
        }
        Span span = startSpan("SQL.execute", sql, params.size());
        return run(span, () -> {
            int affected = delegate.execute(sql, params);
            span.setAttribute(TracingUtil.ATTR_ROW_COUNT, (long) affected);
            return affected;
        });
    }

    @Override
    public int executeInTransaction(final List<SqlStatement> statements)
            throws SQLException {
        if (!TracingUtil.isTracingEnabled()) {
            return delegate.executeInTransaction(statements);
        }
        String first = statements.isEmpty() ? "" : statements.get(0).sql();
        Span span = startSpan("SQL.transaction", first, 0);
        span.setAttribute(ATTR_BATCH_SIZE, (long) statements.size());
        return run(span, () -> {
            int affected = delegate.executeInTransaction(statements);
            span.setAttribute(TracingUtil.ATTR_ROW_COUNT, (long) affected);
            return affected;
        });
    }

    @Override
    public void exec(final String sql) throws SQLException {
        if (!TracingUtil.isTracingEnabled()) {
            delegate.exec(sql);
            return;
        }
        Span span = startSpan("SQL.exec", sql, 0);
        run(span, () -> {
            delegate.exec(sql);
            return null;
        });
    }

    @Override
    public SqlDialect dialect() {
        return delegate.dialect();
    }

    @Override
    public void close() throws SQLException {
        delegate.close();
    }

    private Span startSpan(final String name, final String sql,
            final int paramCount) {
        return TracingUtil.databaseSpan(tracer, name, SpanKind.CLIENT,
                delegate.dialect().system())
            .setAttribute(TracingUtil.ATTR_DB_STATEMENT, sql)
            .setAttribute(ATTR_PARAM_COUNT, (long) paramCount)
            .startSpan();
    }

    private static <T> T run(final Span span, final SqlCall<T> call)
            throws SQLException {
        try (Scope scope = span.makeCurrent()) {
            T result = call.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (SQLException | RuntimeException e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }
}
