package com.quintstore.jena.store;

import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Node;

/**
 * One row of a compound query.
 *
 * @param joinValue the shared join term
 * @param bindings projected terms keyed by alias
 * @param quints the matched quints; only filled when the compound query
 *        degenerates to a single pattern
 */
public record CompoundResult(Node joinValue, Map<String, Node> bindings,
        List<Quint> quints) {

    /**
     * Copy the collections.
     *
     * @param joinValue the shared join term
     * @param bindings projected terms
     * @param quints matched quints
     */
    public CompoundResult {
        bindings = Map.copyOf(bindings);
        quints = List.copyOf(quints);
    }

    /**
     * Look up a projected term.
     *
     * @param alias the alias
     * @return the term, or null when not projected
     */
    public Node get(final String alias) {
        return bindings.get(alias);
    }
}
