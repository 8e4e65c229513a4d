package com.quintstore.jena;

import com.quintstore.jena.query.SecurityFilters;
import com.quintstore.jena.store.Quint;
import com.quintstore.jena.store.QuintPattern;
import com.quintstore.jena.store.QuintStore;
import com.quintstore.jena.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.TransactionHandler;
import org.apache.jena.graph.Triple;
import org.apache.jena.graph.impl.GraphBase;
import org.apache.jena.shared.AccessDeniedException;
import org.apache.jena.shared.JenaException;
import org.apache.jena.sparql.core.Quad;
import org.apache.jena.util.iterator.ExtendedIterator;
import org.apache.jena.util.iterator.NiceIterator;
import org.apache.jena.util.iterator.WrappedIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jena Graph view of a quint store.
 *
 * <p>A graph is either one named graph of the store or, when created
 * without a graph name, the union of every graph in scope. Writes to the
 * union view go to the store's default graph.</p>
 *
 * <p>Key features:</p>
 * <ul>
 *   <li>Transaction support via {@link QuintTransactionHandler}</li>
 *   <li>Optional tenant scope via {@link SecurityFilters}</li>
 *   <li>OpenTelemetry tracing support</li>
 * </ul>
 */
public final class QuintGraph extends GraphBase {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QuintGraph.class);
    /** The backing store. */
    private final QuintStore store;
    /** Graph name, or null for the union view. */
    private final Node graphNode;
    /** Tenant scope. */
    private final SecurityFilters scope;
    /** Tracer for graph operations. */
    private final Tracer tracer;
    /** Transaction handler for batch operations. */
    private final QuintTransactionHandler transactionHandler;

    /** Attribute key for operation type. */
    private static final AttributeKey<String> ATTR_OPERATION =
        AttributeKey.stringKey("quintstore.operation");

    /** Attribute key for graph name. */
    private static final AttributeKey<String> ATTR_GRAPH =
        AttributeKey.stringKey("quintstore.graph");

    /** Attribute key for triple subject. */
    private static final AttributeKey<String> ATTR_TRIPLE_SUBJECT =
        AttributeKey.stringKey("rdf.triple.subject");

    /** Attribute key for triple predicate. */
    private static final AttributeKey<String> ATTR_TRIPLE_PREDICATE =
        AttributeKey.stringKey("rdf.triple.predicate");

    /** Attribute key for triple object. */
    private static final AttributeKey<String> ATTR_TRIPLE_OBJECT =
        AttributeKey.stringKey("rdf.triple.object");

    /** Attribute key for pattern. */
    private static final AttributeKey<String> ATTR_PATTERN =
        AttributeKey.stringKey("rdf.pattern");

    /** Attribute key for result count. */
    private static final AttributeKey<Long> ATTR_RESULT_COUNT =
        AttributeKey.longKey("rdf.result_count");

    /**
     * Create the unscoped union view of a store.
     *
     * @param store the store, already open
     */
    public QuintGraph(final QuintStore store) {
        this(store, null, SecurityFilters.none());
    }

    /**
     * Create an unscoped view of one graph.
     *
     * @param store the store, already open
     * @param graphNode the graph name, or null for the union view
     */
    public QuintGraph(final QuintStore store, final Node graphNode) {
        this(store, graphNode, SecurityFilters.none());
    }

    /**
     * Create a scoped view.
     *
     * @param store the store, already open
     * @param graphNode the graph name, or null or the default graph for the
     *        union view
     * @param scope the tenant scope
     */
    public QuintGraph(final QuintStore store, final Node graphNode,
            final SecurityFilters scope) {
        this.store = store;
        this.graphNode = graphNode == null || Quad.isDefaultGraph(graphNode)
            ? null : graphNode;
        this.scope = scope == null ? SecurityFilters.none() : scope;
        this.tracer = TracingUtil.getTracer(TracingUtil.SCOPE_QUINT_GRAPH);
        this.transactionHandler = new QuintTransactionHandler(
            store,
            graphLabel(),
            this::performAddDirect,
            this::performDeleteDirect
        );
    }

    /**
     * Get the backing store.
     *
     * @return the store
     */
    public QuintStore getStore() {
        return store;
    }

    /**
     * Get the graph name.
     *
     * @return the graph name, or null for the union view
     */
    public Node getGraphNode() {
        return graphNode;
    }

    /**
     * Get the tenant scope.
     *
     * @return the scope
     */
    public SecurityFilters getScope() {
        return scope;
    }

    /**
     * Check whether this is the union view.
     *
     * @return true when no graph name is set
     */
    public boolean isUnion() {
        return graphNode == null;
    }

    @Override
    public TransactionHandler getTransactionHandler() {
        return transactionHandler;
    }

    /** Delete every triple of this graph within scope. */
    @Override
    public void clear() {
        if (!inScope()) {
            return;
        }
        try {
            store.del(scope.applyTo(graphPattern().build()));
        } catch (SQLException e) {
            throw new JenaException("Failed to clear graph " + graphLabel(), e);
        }
    }

    @Override
    public void performAdd(final Triple triple) {
        Span span = startTripleSpan("performAdd", "add", triple);
        try (Scope spanScope = span.makeCurrent()) {
            transactionHandler.bufferAdd(toQuint(triple));
            span.setStatus(StatusCode.OK);
        } catch (Exception e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public void performDelete(final Triple triple) {
        Span span = startTripleSpan("performDelete", "delete", triple);
        try (Scope spanScope = span.makeCurrent()) {
            transactionHandler.bufferDelete(toQuint(triple));
            span.setStatus(StatusCode.OK);
        } catch (Exception e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Write a quint without transaction buffering.
     *
     * @param quint the quint
     */
    void performAddDirect(final Quint quint) {
        try {
            store.put(quint);
        } catch (SQLException e) {
            throw new JenaException("Failed to add " + quint, e);
        }
    }

    /**
     * Delete a quint without transaction buffering.
     *
     * @param quint the quint
     */
    void performDeleteDirect(final Quint quint) {
        try {
            store.del(QuintPattern.exact(quint));
        } catch (SQLException e) {
            throw new JenaException("Failed to delete " + quint, e);
        }
    }

    @Override
    protected ExtendedIterator<Triple> graphBaseFind(final Triple pattern) {
        Span span = tracer.spanBuilder("QuintGraph.find")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_OPERATION, "find")
            .setAttribute(ATTR_GRAPH, graphLabel())
            .setAttribute(ATTR_PATTERN, pattern.toString())
            .startSpan();

        try (Scope spanScope = span.makeCurrent()) {
            if (!inScope()) {
                span.setAttribute(ATTR_RESULT_COUNT, 0L);
                span.setStatus(StatusCode.OK);
                return NiceIterator.emptyIterator();
            }
            var builder = graphPattern()
                .subject(concrete(pattern.getSubject()))
                .predicate(concrete(pattern.getPredicate()))
                .object(concrete(pattern.getObject()));
            List<Quint> quints = store.get(scope.applyTo(builder.build()));

            // the union view is a set of triples across graphs
            Set<Triple> triples = new LinkedHashSet<>();
            for (Quint quint : quints) {
                triples.add(quint.asTriple());
            }
            span.setAttribute(ATTR_RESULT_COUNT, (long) triples.size());
            span.setStatus(StatusCode.OK);

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("find {} on {} returned {} triples", pattern,
                    graphLabel(), triples.size());
            }
            return WrappedIterator.create(triples.iterator());
        } catch (SQLException e) {
            TracingUtil.recordFailure(span, e);
            throw new JenaException("Failed to find " + pattern + " in "
                + graphLabel(), e);
        } catch (RuntimeException e) {
            TracingUtil.recordFailure(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    protected int graphBaseSize() {
        if (isUnion()) {
            return graphBaseFind(Triple.ANY).toList().size();
        }
        if (!inScope()) {
            return 0;
        }
        try {
            return Math.toIntExact(store.count(scope.applyTo(graphPattern().build())));
        } catch (SQLException e) {
            throw new JenaException("Failed to count graph " + graphLabel(), e);
        }
    }

    private QuintPattern.Builder graphPattern() {
        return QuintPattern.builder().graph(graphNode);
    }

    private Quint toQuint(final Triple triple) {
        Node target = graphNode == null ? Quad.defaultGraphIRI : graphNode;
        if (!scope.allowsGraph(target)) {
            throw new AccessDeniedException("Graph is outside the current scope: " + target);
        }
        return Quint.fromTriple(target, triple);
    }

    private boolean inScope() {
        return graphNode == null || scope.allowsGraph(graphNode);
    }

    private String graphLabel() {
        return graphNode == null ? "union" : graphNode.toString();
    }

    private Span startTripleSpan(final String name, final String operation,
            final Triple triple) {
        return tracer.spanBuilder("QuintGraph." + name)
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_OPERATION, operation)
            .setAttribute(ATTR_GRAPH, graphLabel())
            .setAttribute(ATTR_TRIPLE_SUBJECT, triple.getSubject().toString())
            .setAttribute(ATTR_TRIPLE_PREDICATE, triple.getPredicate().toString())
            .setAttribute(ATTR_TRIPLE_OBJECT, triple.getObject().toString())
            .startSpan();
    }

    private static Node concrete(final Node node) {
        return node != null && node.isConcrete() ? node : null;
    }
}
