package com.quintstore.jena.store;

import java.util.Arrays;
import java.util.Objects;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.sparql.core.Quad;

/**
 * A stored five-element tuple: graph, subject, predicate, object and an
 * optional embedding vector.
 *
 * <p>Identity is the four terms only; the vector is a payload that can be
 * replaced without changing which row a quint denotes.</p>
 */
public final class Quint {
    /** Graph term. */
    private final Node graph;
    /** Subject term. */
    private final Node subject;
    /** Predicate term. */
    private final Node predicate;
    /** Object term. */
    private final Node object;
    /** Optional vector, null when absent. */
    private final float[] vector;

    /**
     * Create a quint without a vector.
     *
     * @param graph the graph, {@link Quad#defaultGraphIRI} for the default graph
     * @param subject the subject
     * @param predicate the predicate
     * @param object the object
     */
    public Quint(final Node graph, final Node subject, final Node predicate,
            final Node object) {
        this(graph, subject, predicate, object, null);
    }

    /**
     * Create a quint.
     *
     * @param graph the graph, {@link Quad#defaultGraphIRI} for the default graph
     * @param subject the subject
     * @param predicate the predicate
     * @param object the object
     * @param vector the vector, or null
     */
    public Quint(final Node graph, final Node subject, final Node predicate,
            final Node object, final float[] vector) {
        this.graph = graph == null ? Quad.defaultGraphIRI : graph;
        this.subject = Objects.requireNonNull(subject, "subject");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.object = Objects.requireNonNull(object, "object");
        this.vector = vector == null ? null : vector.clone();
    }

    /**
     * Create a quint from a Jena quad.
     *
     * @param quad the quad
     * @return the quint
     */
    public static Quint fromQuad(final Quad quad) {
        return new Quint(quad.getGraph(), quad.getSubject(),
            quad.getPredicate(), quad.getObject());
    }

    /**
     * Create a quint from a triple in the given graph.
     *
     * @param graph the graph
     * @param triple the triple
     * @return the quint
     */
    public static Quint fromTriple(final Node graph, final Triple triple) {
        return new Quint(graph, triple.getSubject(), triple.getPredicate(),
            triple.getObject());
    }

    public Node getGraph() {
        return graph;
    }

    public Node getSubject() {
        return subject;
    }

    public Node getPredicate() {
        return predicate;
    }

    public Node getObject() {
        return object;
    }

    /**
     * Get the term at a position.
     *
     * @param name the position
     * @return the term
     */
    public Node get(final TermName name) {
        return switch (name) {
            case SUBJECT -> subject;
            case PREDICATE -> predicate;
            case OBJECT -> object;
            case GRAPH -> graph;
        };
    }

    /**
     * Get a copy of the vector.
     *
     * @return the vector, or null when absent
     */
    public float[] getVector() {
        return vector == null ? null : vector.clone();
    }

    /**
     * Check whether a vector is attached.
     *
     * @return true if the quint carries a vector
     */
    public boolean hasVector() {
        return vector != null;
    }

    /**
     * Return a copy of this quint with another vector.
     *
     * @param newVector the vector, or null to drop it
     * @return the new quint
     */
    public Quint withVector(final float[] newVector) {
        return new Quint(graph, subject, predicate, object, newVector);
    }

    /**
     * View this quint as a Jena triple.
     *
     * @return the triple
     */
    public Triple asTriple() {
        return Triple.create(subject, predicate, object);
    }

    /**
     * View this quint as a Jena quad.
     *
     * @return the quad
     */
    public Quad asQuad() {
        return Quad.create(graph, subject, predicate, object);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Quint that)) {
            return false;
        }
        return graph.equals(that.graph) && subject.equals(that.subject)
            && predicate.equals(that.predicate) && object.equals(that.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(graph, subject, predicate, object);
    }

    @Override
    public String toString() {
        return "Quint(" + graph + ", " + subject + ", " + predicate + ", "
            + object + (vector == null ? "" : ", " + Arrays.toString(vector))
            + ")";
    }
}
