package com.quintstore.jena.query;

import com.quintstore.jena.codec.TermCodec;
import com.quintstore.jena.store.OperatorValue;
import com.quintstore.jena.store.QuintPattern;
import com.quintstore.jena.store.TermMatch;
import com.quintstore.jena.store.TermName;
import com.quintstore.jena.store.TermOperators;
import java.util.List;
import java.util.Objects;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/**
 * A tenant scope: constraints added to every pattern sent to the store.
 *
 * <p>A scope only fills positions a pattern leaves unconstrained; it never
 * replaces a concrete term. Graph scopes are also checked directly with
 * {@link #allowsGraph(Node)} wherever a named graph is addressed
 * explicitly.</p>
 */
public final class SecurityFilters {
    /** Scope that restricts nothing. */
    private static final SecurityFilters NONE = new SecurityFilters(
        QuintPattern.empty());

    /** Suffix of the metadata graph kept beside a resource graph. */
    public static final String METADATA_SUFFIX = ".metadata";

    /** The constraints. */
    private final QuintPattern pattern;

    private SecurityFilters(final QuintPattern pattern) {
        this.pattern = pattern;
    }

    /**
     * The unrestricted scope.
     *
     * @return the empty scope
     */
    public static SecurityFilters none() {
        return NONE;
    }

    /**
     * Scope from explicit constraints.
     *
     * @param pattern the constraints
     * @return the scope
     */
    public static SecurityFilters of(final QuintPattern pattern) {
        return new SecurityFilters(Objects.requireNonNull(pattern, "pattern"));
    }

    /**
     * Scope for a container or resource path. A path ending in {@code /}
     * allows every graph below it; any other path allows the graph itself
     * and its metadata graph.
     *
     * @param basePath the base path
     * @return the scope
     */
    public static SecurityFilters forBasePath(final String basePath) {
        Objects.requireNonNull(basePath, "basePath");
        TermOperators graph;
        if (basePath.endsWith("/")) {
            graph = TermOperators.builder().startsWith(basePath).build();
        } else {
            graph = TermOperators.builder()
                .inTerms(List.of(NodeFactory.createURI(basePath),
                    NodeFactory.createURI(basePath + METADATA_SUFFIX)))
                .build();
        }
        return new SecurityFilters(QuintPattern.builder().graph(graph).build());
    }

    /**
     * Get the constraints.
     *
     * @return the constraint pattern
     */
    public QuintPattern getPattern() {
        return pattern;
    }

    /**
     * Check whether the scope restricts anything.
     *
     * @return true when unrestricted
     */
    public boolean isEmpty() {
        return pattern.isEmpty();
    }

    /**
     * Fill the positions a pattern leaves open with this scope.
     *
     * @param base the pattern
     * @return the scoped pattern
     */
    public QuintPattern applyTo(final QuintPattern base) {
        if (pattern.isEmpty()) {
            return base;
        }
        var builder = base.toBuilder();
        for (TermName name : TermName.values()) {
            if (base.get(name) == null && pattern.get(name) != null) {
                builder.set(name, pattern.get(name));
            }
        }
        return builder.build();
    }

    /**
     * Check a graph against the graph constraint. Equality, membership and
     * prefix tests are evaluated; other operators are left to the store.
     *
     * @param graph the graph
     * @return true when the graph is in scope
     */
    public boolean allowsGraph(final Node graph) {
        TermMatch match = pattern.getGraph();
        if (match == null) {
            return true;
        }
        String encoded = TermCodec.encodeTerm(graph);
        if (match instanceof TermMatch.Concrete concrete) {
            return encoded.equals(TermCodec.encodeTerm(concrete.term()));
        }
        TermOperators ops = ((TermMatch.Operators) match).operators();
        if (ops.getEq() != null && !encoded.equals(encodedGraph(ops.getEq()))) {
            return false;
        }
        if (ops.getIn() != null && ops.getIn().stream()
                .noneMatch(v -> encoded.equals(encodedGraph(v)))) {
            return false;
        }
        return ops.getStartsWith() == null || encoded.startsWith(ops.getStartsWith());
    }

    private static String encodedGraph(final OperatorValue value) {
        if (value instanceof OperatorValue.TermValue term) {
            return TermCodec.encodeTerm(term.term());
        }
        if (value instanceof OperatorValue.RawValue raw) {
            return raw.value();
        }
        return String.valueOf(((OperatorValue.NumberValue) value).number());
    }

    @Override
    public String toString() {
        return "SecurityFilters" + pattern;
    }
}
