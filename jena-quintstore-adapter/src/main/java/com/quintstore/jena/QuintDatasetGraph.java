package com.quintstore.jena;

import com.quintstore.jena.query.SecurityFilters;
import com.quintstore.jena.store.Quint;
import com.quintstore.jena.store.QuintPattern;
import com.quintstore.jena.store.QuintStore;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.shared.AccessDeniedException;
import org.apache.jena.shared.JenaException;
import org.apache.jena.sparql.core.DatasetGraphFactory;
import org.apache.jena.sparql.core.DatasetGraphWrapper;
import org.apache.jena.sparql.core.Quad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jena dataset over a quint store; this is what SPARQL evaluation sees.
 *
 * <p>The default graph is the union of every graph in scope and named
 * graphs are the distinct graphs of the store. Quad reads and writes go
 * straight to the store. Prefixes and the transaction lock come from a
 * wrapped in-memory dataset that holds no data.</p>
 *
 * <p>With a {@link SecurityFilters} scope every read is restricted to the
 * scope, named graphs outside it are hidden and writes to them are
 * refused.</p>
 */
public class QuintDatasetGraph extends DatasetGraphWrapper {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QuintDatasetGraph.class);

    /** The backing store. */
    private final QuintStore store;
    /** Tenant scope. */
    private final SecurityFilters scope;
    /** Union view used as the default graph. */
    private final QuintGraph defaultGraph;

    /**
     * Create an unscoped dataset.
     *
     * @param store the store, already open
     */
    public QuintDatasetGraph(final QuintStore store) {
        this(store, SecurityFilters.none());
    }

    /**
     * Create a scoped dataset.
     *
     * @param store the store, already open
     * @param scope the tenant scope
     */
    public QuintDatasetGraph(final QuintStore store, final SecurityFilters scope) {
        super(DatasetGraphFactory.createGeneral());
        this.store = store;
        this.scope = scope == null ? SecurityFilters.none() : scope;
        this.defaultGraph = new QuintGraph(store, null, this.scope);
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
     * Get the tenant scope.
     *
     * @return the scope
     */
    public SecurityFilters getScope() {
        return scope;
    }

    @Override
    public Graph getDefaultGraph() {
        return defaultGraph;
    }

    @Override
    public Graph getUnionGraph() {
        return defaultGraph;
    }

    @Override
    public Graph getGraph(final Node graphNode) {
        if (graphNode == null || Quad.isDefaultGraph(graphNode)
                || Quad.isUnionGraph(graphNode)) {
            return defaultGraph;
        }
        return new QuintGraph(store, graphNode, scope);
    }

    @Override
    public boolean containsGraph(final Node graphNode) {
        if (Quad.isDefaultGraph(graphNode) || Quad.isUnionGraph(graphNode)) {
            return true;
        }
        return scope.allowsGraph(graphNode) && graphs().contains(graphNode);
    }

    @Override
    public Iterator<Node> listGraphNodes() {
        return graphs().iterator();
    }

    @Override
    public long size() {
        return graphs().size();
    }

    @Override
    public boolean isEmpty() {
        try {
            return store.count(scope.applyTo(QuintPattern.empty())) == 0;
        } catch (SQLException e) {
            throw new JenaException("Failed to count quints", e);
        }
    }

    @Override
    public void addGraph(final Node graphName, final Graph graph) {
        var quints = new ArrayList<Quint>();
        graph.find().forEachRemaining(t -> quints.add(Quint.fromTriple(graphName, t)));
        checkWritable(graphName);
        try {
            store.multiPut(quints);
        } catch (SQLException e) {
            throw new JenaException("Failed to add graph " + graphName, e);
        }
    }

    @Override
    public void removeGraph(final Node graphName) {
        checkWritable(graphName);
        deleteAny(graphName, Node.ANY, Node.ANY, Node.ANY);
    }

    @Override
    public void add(final Quad quad) {
        Quint quint = Quint.fromQuad(quad);
        checkWritable(quint.getGraph());
        try {
            store.put(quint);
        } catch (SQLException e) {
            throw new JenaException("Failed to add " + quad, e);
        }
    }

    @Override
    public void add(final Node g, final Node s, final Node p, final Node o) {
        add(Quad.create(g, s, p, o));
    }

    @Override
    public void delete(final Quad quad) {
        Quint quint = Quint.fromQuad(quad);
        checkWritable(quint.getGraph());
        try {
            store.del(QuintPattern.exact(quint));
        } catch (SQLException e) {
            throw new JenaException("Failed to delete " + quad, e);
        }
    }

    @Override
    public void delete(final Node g, final Node s, final Node p, final Node o) {
        delete(Quad.create(g, s, p, o));
    }

    @Override
    public void deleteAny(final Node g, final Node s, final Node p, final Node o) {
        var builder = QuintPattern.builder()
            .subject(concrete(s))
            .predicate(concrete(p))
            .object(concrete(o));
        if (g != null && g.isConcrete() && !Quad.isUnionGraph(g)) {
            checkWritable(g);
            builder.graph(g);
        }
        try {
            int deleted = store.del(scope.applyTo(builder.build()));
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("deleteAny({}, {}, {}, {}) removed {} quints",
                    g, s, p, o, deleted);
            }
        } catch (SQLException e) {
            throw new JenaException("Failed to delete matching quads", e);
        }
    }

    @Override
    public void clear() {
        deleteAny(Node.ANY, Node.ANY, Node.ANY, Node.ANY);
    }

    @Override
    public Iterator<Quad> find() {
        return find(Node.ANY, Node.ANY, Node.ANY, Node.ANY);
    }

    @Override
    public Iterator<Quad> find(final Quad quad) {
        return find(quad.getGraph(), quad.getSubject(), quad.getPredicate(),
            quad.getObject());
    }

    @Override
    public Iterator<Quad> find(final Node g, final Node s, final Node p,
            final Node o) {
        if (g != null && (Quad.isDefaultGraph(g) || Quad.isUnionGraph(g))) {
            var quads = new ArrayList<Quad>();
            defaultGraph.find(s, p, o).forEachRemaining(
                t -> quads.add(Quad.create(Quad.defaultGraphIRI, t)));
            return quads.iterator();
        }
        return quads(g, s, p, o, false).iterator();
    }

    @Override
    public Iterator<Quad> findNG(final Node g, final Node s, final Node p,
            final Node o) {
        return quads(g, s, p, o, true).iterator();
    }

    @Override
    public boolean contains(final Node g, final Node s, final Node p,
            final Node o) {
        return find(g, s, p, o).hasNext();
    }

    @Override
    public boolean contains(final Quad quad) {
        return find(quad).hasNext();
    }

    private List<Quad> quads(final Node g, final Node s, final Node p,
            final Node o, final boolean namedOnly) {
        var builder = QuintPattern.builder()
            .subject(concrete(s))
            .predicate(concrete(p))
            .object(concrete(o));
        boolean anyGraph = g == null || !g.isConcrete() || Quad.isUnionGraph(g);
        if (!anyGraph) {
            if (!scope.allowsGraph(g)) {
                return List.of();
            }
            builder.graph(g);
        }
        try {
            var quads = new ArrayList<Quad>();
            for (Quint quint : store.get(scope.applyTo(builder.build()))) {
                if (namedOnly && Quad.isDefaultGraph(quint.getGraph())) {
                    continue;
                }
                quads.add(quint.asQuad());
            }
            return quads;
        } catch (SQLException e) {
            throw new JenaException("Failed to find quads", e);
        }
    }

    private List<Node> graphs() {
        try {
            var graphs = new ArrayList<Node>();
            for (Node graph : store.listGraphs()) {
                if (!Quad.isDefaultGraph(graph) && scope.allowsGraph(graph)) {
                    graphs.add(graph);
                }
            }
            return graphs;
        } catch (SQLException e) {
            throw new JenaException("Failed to list graphs", e);
        }
    }

    private void checkWritable(final Node graph) {
        if (!scope.allowsGraph(graph)) {
            throw new AccessDeniedException("Graph is outside the current scope: " + graph);
        }
    }

    private static Node concrete(final Node node) {
        return node != null && node.isConcrete() ? node : null;
    }
}
