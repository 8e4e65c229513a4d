package com.quintstore.jena.store;

import java.util.Objects;
import org.apache.jena.graph.Node;

/**
 * Constraint on one position of a {@link QuintPattern}: either an exact
 * term or a set of operators.
 */
public sealed interface TermMatch permits TermMatch.Concrete, TermMatch.Operators {

    /**
     * Exact match against a term.
     *
     * @param term the term
     */
    record Concrete(Node term) implements TermMatch {
        /**
         * Validate the term.
         *
         * @param term the term
         */
        public Concrete {
            Objects.requireNonNull(term, "term");
        }

        @Override
        public String toString() {
            return term.toString();
        }
    }

    /**
     * Operator based match.
     *
     * @param operators the operators
     */
    record Operators(TermOperators operators) implements TermMatch {
        /**
         * Validate the operators.
         *
         * @param operators the operators
         */
        public Operators {
            Objects.requireNonNull(operators, "operators");
        }

        @Override
        public String toString() {
            return operators.toString();
        }
    }

    /**
     * Exact match.
     *
     * @param term the term
     * @return the match
     */
    static TermMatch term(final Node term) {
        return new Concrete(term);
    }

    /**
     * Operator match.
     *
     * @param operators the operators
     * @return the match
     */
    static TermMatch operators(final TermOperators operators) {
        return new Operators(operators);
    }
}
