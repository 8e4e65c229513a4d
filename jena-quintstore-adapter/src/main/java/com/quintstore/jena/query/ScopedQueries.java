package com.quintstore.jena.query;

import com.quintstore.jena.store.QuintStore;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.jena.graph.Node;
import org.apache.jena.query.ParameterizedSparqlString;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.engine.binding.Binding;

/**
 * Queries confined to one tenant's graphs.
 *
 * <p>Each call runs on an {@link OptimizedQueryEngine} scoped with
 * {@link SecurityFilters#forBasePath(String)}, so a query only ever sees
 * the graphs under the base path plus its metadata graph.</p>
 */
public final class ScopedQueries {

    /** Variable holding graph names in {@link #listGraphs(String)}. */
    private static final Var GRAPH_VAR = Var.alloc("g");

    /** Names every graph with at least one triple under a prefix. */
    private static final String LIST_GRAPHS = "SELECT DISTINCT ?g WHERE { "
        + "GRAPH ?g { ?s ?p ?o } FILTER(STRSTARTS(STR(?g), ?base)) }";

    /** Copies one graph into a model. */
    private static final String CONSTRUCT_GRAPH =
        "CONSTRUCT { ?s ?p ?o } WHERE { GRAPH ?graph { ?s ?p ?o } }";

    /** The backing store. */
    private final QuintStore store;

    /**
     * Create scoped queries over a store.
     *
     * @param store the store, already open
     */
    public ScopedQueries(final QuintStore store) {
        this.store = store;
    }

    /**
     * Create an engine for one tenant.
     *
     * @param basePath the tenant base path
     * @return the scoped engine
     */
    public OptimizedQueryEngine engine(final String basePath) {
        return new OptimizedQueryEngine(store, SecurityFilters.forBasePath(basePath));
    }

    /**
     * Run a SELECT query within a tenant's graphs.
     *
     * @param sparql the query text
     * @param basePath the tenant base path
     * @return the solutions
     */
    public List<Binding> select(final String sparql, final String basePath) {
        return engine(basePath).select(sparql);
    }

    /**
     * Run an ASK query within a tenant's graphs.
     *
     * @param sparql the query text
     * @param basePath the tenant base path
     * @return the answer
     */
    public boolean ask(final String sparql, final String basePath) {
        return engine(basePath).ask(sparql);
    }

    /**
     * Run a CONSTRUCT query within a tenant's graphs.
     *
     * @param sparql the query text
     * @param basePath the tenant base path
     * @return the constructed triples
     */
    public Model construct(final String sparql, final String basePath) {
        return engine(basePath).construct(sparql);
    }

    /**
     * Run an update within a tenant's graphs. Writes to graphs outside the
     * scope are refused.
     *
     * @param sparql the update text
     * @param basePath the tenant base path
     */
    public void update(final String sparql, final String basePath) {
        engine(basePath).update(sparql);
    }

    /**
     * List the named graphs of a tenant that hold at least one triple.
     *
     * @param basePath the tenant base path
     * @return graph IRIs in result order
     */
    public Set<String> listGraphs(final String basePath) {
        var query = new ParameterizedSparqlString(LIST_GRAPHS);
        query.setLiteral("base", basePath);
        var graphs = new LinkedHashSet<String>();
        for (Binding row : select(query.toString(), basePath)) {
            Node graph = row.get(GRAPH_VAR);
            if (graph != null && graph.isURI()) {
                graphs.add(graph.getURI());
            }
        }
        return graphs;
    }

    /**
     * Copy one graph of a tenant into a model. A graph outside the scope
     * yields an empty model.
     *
     * @param graph the graph IRI
     * @param basePath the tenant base path
     * @return the graph's triples
     */
    public Model constructGraph(final String graph, final String basePath) {
        var query = new ParameterizedSparqlString(CONSTRUCT_GRAPH);
        query.setIri("graph", graph);
        return construct(query.toString(), basePath);
    }
}
