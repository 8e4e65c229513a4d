package com.quintstore.jena;

import com.quintstore.jena.store.Quint;
import com.quintstore.jena.store.QuintStore;
import com.quintstore.jena.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import org.apache.jena.graph.impl.TransactionHandlerBase;
import org.apache.jena.shared.JenaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transaction handler for quint-store-backed graphs.
 *
 * <p>Between {@code begin} and {@code commit} adds and deletes are
 * buffered. On commit the deletes are flushed with one
 * {@link QuintStore#multiDel} and the adds with one
 * {@link QuintStore#multiPut}, each an atomic SQL transaction. Outside a
 * transaction every change is written immediately.</p>
 *
 * <p>The buffers hold the net effect of the transaction: adding a quint
 * cancels an earlier buffered delete of it and the other way round.</p>
 */
public final class QuintTransactionHandler extends TransactionHandlerBase {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QuintTransactionHandler.class);

    /** The store changes are flushed to. */
    private final QuintStore store;

    /** Graph label for tracing. */
    private final String graphLabel;

    /** Quints to add on commit. */
    private Set<Quint> addBuffer;

    /** Quints to delete on commit. */
    private Set<Quint> deleteBuffer;

    /** Whether a transaction is currently active. */
    private volatile boolean inTransaction = false;

    /** Tracer for OpenTelemetry. */
    private final Tracer tracer;

    /** Attribute key for operation type. */
    private static final AttributeKey<String> ATTR_OPERATION =
        AttributeKey.stringKey("quintstore.operation");

    /** Attribute key for graph label. */
    private static final AttributeKey<String> ATTR_GRAPH =
        AttributeKey.stringKey("quintstore.graph");

    /** Attribute key for quint count. */
    private static final AttributeKey<Long> ATTR_QUINT_COUNT =
        AttributeKey.longKey("quintstore.quint_count");

    /**
     * Callback for a change applied immediately outside a transaction.
     */
    @FunctionalInterface
    interface ImmediateCallback {
        /**
         * Apply the change.
         *
         * @param quint the quint
         */
        void apply(Quint quint);
    }

    /** Callback for immediate adds when not in transaction. */
    private final ImmediateCallback immediateAdd;

    /** Callback for immediate deletes when not in transaction. */
    private final ImmediateCallback immediateDelete;

    /**
     * Create a transaction handler.
     *
     * @param store the store
     * @param graphLabel graph label for tracing
     * @param immediateAdd callback for non-transactional adds
     * @param immediateDelete callback for non-transactional deletes
     */
    public QuintTransactionHandler(
            final QuintStore store,
            final String graphLabel,
            final ImmediateCallback immediateAdd,
            final ImmediateCallback immediateDelete) {
        this.store = store;
        this.graphLabel = graphLabel;
        this.immediateAdd = immediateAdd;
        this.immediateDelete = immediateDelete;
        this.tracer = TracingUtil.getTracer(TracingUtil.SCOPE_QUINT_GRAPH);
    }

    @Override
    public boolean transactionsSupported() {
        return true;
    }

    @Override
    public synchronized void begin() {
        Span span = startSpan("begin");
        try (Scope scope = span.makeCurrent()) {
            if (inTransaction) {
                throw new UnsupportedOperationException(
                    "Nested transactions are not supported");
            }
            inTransaction = true;
            addBuffer = new LinkedHashSet<>();
            deleteBuffer = new LinkedHashSet<>();
            span.setStatus(StatusCode.OK);

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Transaction started on graph: {}", graphLabel);
            }
        } catch (Exception e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public synchronized void commit() {
        Span span = startSpan("commit");
        try (Scope scope = span.makeCurrent()) {
            if (!inTransaction) {
                throw new UnsupportedOperationException(
                    "No transaction in progress");
            }
            int addCount = addBuffer.size();
            int deleteCount = deleteBuffer.size();
            span.setAttribute(ATTR_QUINT_COUNT, (long) (addCount + deleteCount));

            flush();

            inTransaction = false;
            addBuffer = null;
            deleteBuffer = null;
            span.setStatus(StatusCode.OK);

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Transaction committed on graph: {} "
                    + "(adds: {}, deletes: {})", graphLabel, addCount,
                    deleteCount);
            }
        } catch (Exception e) {
            TracingUtil.recordFailure(span, e);
            if (inTransaction) {
                try {
                    abort();
                } catch (Exception abortException) {
                    e.addSuppressed(abortException);
                }
            }
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public synchronized void abort() {
        Span span = startSpan("abort");
        try (Scope scope = span.makeCurrent()) {
            if (!inTransaction) {
                throw new UnsupportedOperationException(
                    "No transaction in progress");
            }
            int addCount = addBuffer.size();
            int deleteCount = deleteBuffer.size();

            inTransaction = false;
            addBuffer = null;
            deleteBuffer = null;
            span.setStatus(StatusCode.OK);

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Transaction aborted on graph: {} "
                    + "(discarded adds: {}, discarded deletes: {})",
                    graphLabel, addCount, deleteCount);
            }
        } catch (Exception e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Buffer an add, or apply it immediately outside a transaction.
     *
     * @param quint the quint to add
     */
    public synchronized void bufferAdd(final Quint quint) {
        if (inTransaction) {
            deleteBuffer.remove(quint);
            addBuffer.add(quint);
        } else {
            immediateAdd.apply(quint);
        }
    }

    /**
     * Buffer a delete, or apply it immediately outside a transaction.
     *
     * @param quint the quint to delete
     */
    public synchronized void bufferDelete(final Quint quint) {
        if (inTransaction) {
            addBuffer.remove(quint);
            deleteBuffer.add(quint);
        } else {
            immediateDelete.apply(quint);
        }
    }

    /**
     * Check if a transaction is currently in progress.
     *
     * @return true if a transaction is active
     */
    public boolean isInTransaction() {
        return inTransaction;
    }

    private void flush() {
        try {
            if (!deleteBuffer.isEmpty()) {
                store.multiDel(new ArrayList<>(deleteBuffer));
            }
            if (!addBuffer.isEmpty()) {
                store.multiPut(new ArrayList<>(addBuffer));
            }
        } catch (SQLException e) {
            throw new JenaException("Failed to flush transaction on graph "
                + graphLabel + ": " + e.getMessage(), e);
        }
    }

    private Span startSpan(final String operation) {
        return tracer.spanBuilder("QuintTransaction." + operation)
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_OPERATION, operation)
            .setAttribute(ATTR_GRAPH, graphLabel)
            .startSpan();
    }
}
