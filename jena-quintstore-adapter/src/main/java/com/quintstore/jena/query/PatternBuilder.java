package com.quintstore.jena.query;

import com.quintstore.jena.store.QuintPattern;
import com.quintstore.jena.store.TermMatch;
import com.quintstore.jena.store.TermName;
import com.quintstore.jena.store.TermOperators;
import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.sparql.core.Quad;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.engine.binding.Binding;

/**
 * Builds the {@link QuintPattern} sent to the store for one SPARQL triple
 * pattern.
 *
 * <p>Three layers are merged, concrete terms always winning over
 * operators:</p>
 * <ol>
 *   <li>the concrete positions of the triple pattern;</li>
 *   <li>the tenant scope, filling positions the query left open;</li>
 *   <li>pushed-down FILTER conditions on the variables of the pattern.</li>
 * </ol>
 *
 * <p>A concrete graph outside the scope produces a pattern that matches
 * nothing.</p>
 */
public final class PatternBuilder {

    /** Graph constraint that no row satisfies. */
    private static final TermMatch NO_GRAPH = TermMatch.operators(
        TermOperators.builder().in(List.of()).build());

    /** The tenant scope. */
    private final SecurityFilters scope;

    /**
     * Create a builder for a scope.
     *
     * @param scope the tenant scope, or null for none
     */
    public PatternBuilder(final SecurityFilters scope) {
        this.scope = scope == null ? SecurityFilters.none() : scope;
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
     * Pattern from the concrete positions of a triple pattern plus the
     * scope. Variables and the default graph are left open.
     *
     * @param triple the triple pattern
     * @param graph the graph term or variable, or null for the default graph
     * @return the pattern
     */
    public QuintPattern buildBasePattern(final Triple triple, final Node graph) {
        var builder = QuintPattern.builder()
            .subject(concrete(triple.getSubject()))
            .predicate(concrete(triple.getPredicate()))
            .object(concrete(triple.getObject()));
        Node graphTerm = concrete(graph);
        if (graphTerm != null && !Quad.isDefaultGraph(graphTerm)) {
            if (!scope.allowsGraph(graphTerm)) {
                return scope.applyTo(builder.build()).with(TermName.GRAPH, NO_GRAPH);
            }
            builder.graph(graphTerm);
        }
        return scope.applyTo(builder.build());
    }

    /**
     * Pattern with pushed-down FILTER conditions merged into the positions
     * their variables occupy.
     *
     * @param triple the triple pattern
     * @param graph the graph term or variable, or null for the default graph
     * @param filters conditions by variable
     * @return the pattern
     */
    public QuintPattern buildQuintPattern(final Triple triple, final Node graph,
            final Map<Var, TermOperators> filters) {
        QuintPattern pattern = buildBasePattern(triple, graph);
        if (filters == null || filters.isEmpty()) {
            return pattern;
        }
        pattern = mergeAt(pattern, TermName.SUBJECT, triple.getSubject(), filters);
        pattern = mergeAt(pattern, TermName.PREDICATE, triple.getPredicate(), filters);
        pattern = mergeAt(pattern, TermName.OBJECT, triple.getObject(), filters);
        return mergeAt(pattern, TermName.GRAPH, graph, filters);
    }

    /**
     * Pattern for a triple pattern evaluated under a partial solution, as
     * in EXISTS or a join with earlier results. Variables bound by the
     * solution become concrete.
     *
     * @param triple the triple pattern
     * @param graph the graph term or variable, or null for the default graph
     * @param binding the partial solution
     * @return the pattern
     */
    public QuintPattern buildExistsPattern(final Triple triple, final Node graph,
            final Binding binding) {
        Triple resolved = Triple.create(
            resolve(triple.getSubject(), binding),
            resolve(triple.getPredicate(), binding),
            resolve(triple.getObject(), binding));
        return buildBasePattern(resolved, resolve(graph, binding));
    }

    /**
     * Merge a pushed-down condition into a pattern position. A concrete
     * term keeps its place; an operator set, such as the scope's graph
     * test, is conjoined with the condition.
     *
     * @param existing the current match, or null
     * @param filter the condition
     * @return the merged match
     */
    static TermMatch mergeFilters(final TermMatch existing,
            final TermOperators filter) {
        if (existing == null) {
            return TermMatch.operators(filter);
        }
        if (existing instanceof TermMatch.Operators operators) {
            return TermMatch.operators(operators.operators().and(filter));
        }
        return existing;
    }

    private static QuintPattern mergeAt(final QuintPattern pattern,
            final TermName name, final Node node,
            final Map<Var, TermOperators> filters) {
        if (node == null || !node.isVariable()) {
            return pattern;
        }
        TermOperators filter = filters.get(Var.alloc(node));
        if (filter == null || filter.isEmpty()) {
            return pattern;
        }
        return pattern.with(name, mergeFilters(pattern.get(name), filter));
    }

    private static Node resolve(final Node node, final Binding binding) {
        if (node == null || !node.isVariable() || binding == null) {
            return node;
        }
        Node value = binding.get(Var.alloc(node));
        return value == null ? node : value;
    }

    private static Node concrete(final Node node) {
        return node != null && node.isConcrete() ? node : null;
    }
}
