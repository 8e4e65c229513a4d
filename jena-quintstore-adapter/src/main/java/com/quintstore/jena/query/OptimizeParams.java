package com.quintstore.jena.query;

import com.quintstore.jena.store.QueryOptions;
import com.quintstore.jena.store.TermName;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.sparql.core.Var;

/**
 * A query the planner found eligible for push-down: one triple pattern
 * plus the solution modifiers around it.
 *
 * @param triple the single triple pattern
 * @param graph the graph IRI or variable of an enclosing GRAPH clause, or
 *        null for the default graph
 * @param projection projected variables, or null when every variable is
 *        projected
 * @param limit the LIMIT, or null
 * @param offset the OFFSET, or null
 * @param order the ordering column, or null
 * @param reverse whether the ordering is descending
 * @param distinct whether solutions must be deduplicated
 */
public record OptimizeParams(Triple triple, Node graph, List<Var> projection,
        Long limit, Long offset, TermName order, boolean reverse,
        boolean distinct) {

    /**
     * Normalise the projection.
     *
     * @param triple the single triple pattern
     * @param graph the graph node, or null
     * @param projection projected variables, or null
     * @param limit the LIMIT, or null
     * @param offset the OFFSET, or null
     * @param order the ordering column, or null
     * @param reverse whether the ordering is descending
     * @param distinct whether solutions must be deduplicated
     */
    public OptimizeParams {
        projection = projection == null ? null : List.copyOf(projection);
    }

    /**
     * The same plan with a different limit, as used by ASK.
     *
     * @param value the new limit
     * @return the adjusted plan
     */
    public OptimizeParams withLimit(final long value) {
        return new OptimizeParams(triple, graph, projection, value, offset,
            order, reverse, distinct);
    }

    /**
     * Variables of the pattern and the position each occupies. The graph
     * variable maps to {@link TermName#GRAPH}.
     *
     * @return variables in pattern order
     */
    public Map<Var, TermName> variables() {
        var variables = new LinkedHashMap<Var, TermName>();
        put(variables, triple.getSubject(), TermName.SUBJECT);
        put(variables, triple.getPredicate(), TermName.PREDICATE);
        put(variables, triple.getObject(), TermName.OBJECT);
        put(variables, graph, TermName.GRAPH);
        return variables;
    }

    /**
     * Whether the pattern reads named graphs through a graph variable.
     *
     * @return true for {@code GRAPH ?g { ... }}
     */
    public boolean hasGraphVariable() {
        return graph != null && graph.isVariable();
    }

    /**
     * Store options for the fetch. The offset is applied after the fetch,
     * so the store is asked for {@code limit + offset} rows, capped at
     * {@link Long#MAX_VALUE}.
     *
     * @return the options
     */
    public QueryOptions queryOptions() {
        Long fetch = null;
        if (limit != null) {
            fetch = addCapped(limit, offset == null ? 0L : offset);
        }
        List<TermName> columns = order == null ? List.of() : List.of(order);
        return new QueryOptions(fetch, null, columns, reverse);
    }

    /**
     * Adds two non-negative row counts, capping at {@link Long#MAX_VALUE}.
     *
     * @param a the first count
     * @param b the second count
     * @return the capped sum
     */
    static long addCapped(final long a, final long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    private static void put(final Map<Var, TermName> variables, final Node node,
            final TermName name) {
        if (node != null && node.isVariable()) {
            variables.putIfAbsent(Var.alloc(node), name);
        }
    }
}
