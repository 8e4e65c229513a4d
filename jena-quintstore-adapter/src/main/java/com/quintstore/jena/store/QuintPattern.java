package com.quintstore.jena.store;

import java.util.EnumMap;
import java.util.Map;
import java.util.StringJoiner;
import org.apache.jena.graph.Node;

/**
 * A partial description of a quint. Each position is unconstrained, an
 * exact term or an operator set. Instances are immutable.
 */
public final class QuintPattern {
    /** Pattern matching every quint. */
    private static final QuintPattern EMPTY = new QuintPattern(
        new EnumMap<>(TermName.class));

    /** Constraints by position. */
    private final Map<TermName, TermMatch> matches;

    private QuintPattern(final EnumMap<TermName, TermMatch> matches) {
        this.matches = matches;
    }

    /**
     * The pattern that matches everything.
     *
     * @return the empty pattern
     */
    public static QuintPattern empty() {
        return EMPTY;
    }

    /**
     * Start building a pattern.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder(new EnumMap<>(TermName.class));
    }

    /**
     * Pattern matching exactly one stored tuple.
     *
     * @param quint the quint
     * @return the exact pattern
     */
    public static QuintPattern exact(final Quint quint) {
        return builder()
            .graph(quint.getGraph())
            .subject(quint.getSubject())
            .predicate(quint.getPredicate())
            .object(quint.getObject())
            .build();
    }

    /**
     * Start a builder pre-filled with this pattern.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder(copy());
    }

    /**
     * Get the constraint at a position.
     *
     * @param name the position
     * @return the constraint, or null when unconstrained
     */
    public TermMatch get(final TermName name) {
        return matches.get(name);
    }

    public TermMatch getSubject() {
        return matches.get(TermName.SUBJECT);
    }

    public TermMatch getPredicate() {
        return matches.get(TermName.PREDICATE);
    }

    public TermMatch getObject() {
        return matches.get(TermName.OBJECT);
    }

    public TermMatch getGraph() {
        return matches.get(TermName.GRAPH);
    }

    /**
     * Return a copy with one position replaced.
     *
     * @param name the position
     * @param match the constraint, or null to clear it
     * @return the new pattern
     */
    public QuintPattern with(final TermName name, final TermMatch match) {
        return toBuilder().set(name, match).build();
    }

    /**
     * Check whether no position is constrained.
     *
     * @return true when empty
     */
    public boolean isEmpty() {
        return matches.isEmpty();
    }

    private EnumMap<TermName, TermMatch> copy() {
        var copy = new EnumMap<TermName, TermMatch>(TermName.class);
        copy.putAll(matches);
        return copy;
    }

    @Override
    public boolean equals(final Object other) {
        return this == other
            || other instanceof QuintPattern that && matches.equals(that.matches);
    }

    @Override
    public int hashCode() {
        return matches.hashCode();
    }

    @Override
    public String toString() {
        var joiner = new StringJoiner(", ", "{", "}");
        matches.forEach((name, match) -> joiner.add(name.column() + ": " + match));
        return joiner.toString();
    }

    /**
     * Builder for {@link QuintPattern}.
     */
    public static final class Builder {
        /** Constraints collected so far. */
        private final EnumMap<TermName, TermMatch> matches;

        private Builder(final EnumMap<TermName, TermMatch> initial) {
            this.matches = initial;
        }

        /**
         * Set or clear a position.
         *
         * @param name the position
         * @param match the constraint, or null to clear it
         * @return this builder
         */
        public Builder set(final TermName name, final TermMatch match) {
            if (match == null) {
                matches.remove(name);
            } else {
                matches.put(name, match);
            }
            return this;
        }

        public Builder subject(final Node term) {
            return set(TermName.SUBJECT, term == null ? null : TermMatch.term(term));
        }

        public Builder subject(final TermOperators operators) {
            return set(TermName.SUBJECT, TermMatch.operators(operators));
        }

        public Builder predicate(final Node term) {
            return set(TermName.PREDICATE, term == null ? null : TermMatch.term(term));
        }

        public Builder predicate(final TermOperators operators) {
            return set(TermName.PREDICATE, TermMatch.operators(operators));
        }

        public Builder object(final Node term) {
            return set(TermName.OBJECT, term == null ? null : TermMatch.term(term));
        }

        public Builder object(final TermOperators operators) {
            return set(TermName.OBJECT, TermMatch.operators(operators));
        }

        public Builder graph(final Node term) {
            return set(TermName.GRAPH, term == null ? null : TermMatch.term(term));
        }

        public Builder graph(final TermOperators operators) {
            return set(TermName.GRAPH, TermMatch.operators(operators));
        }

        /**
         * Build the pattern.
         *
         * @return the immutable pattern
         */
        public QuintPattern build() {
            var copy = new EnumMap<TermName, TermMatch>(TermName.class);
            copy.putAll(matches);
            return new QuintPattern(copy);
        }
    }
}
