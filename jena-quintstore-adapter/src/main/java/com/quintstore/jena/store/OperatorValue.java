package com.quintstore.jena.store;

import java.util.Objects;
import org.apache.jena.graph.Node;

/**
 * Operand of a comparison or set operator in {@link TermOperators}.
 *
 * <p>An operand is an RDF term, a plain number, or a string that is already
 * in stored form (or is a bare lexical value that the translator quotes when
 * comparing against the object column).</p>
 */
public sealed interface OperatorValue
        permits OperatorValue.TermValue, OperatorValue.NumberValue,
            OperatorValue.RawValue {

    /**
     * An RDF term operand.
     *
     * @param term the term
     */
    record TermValue(Node term) implements OperatorValue {
        /**
         * Validate the term.
         *
         * @param term the term
         */
        public TermValue {
            Objects.requireNonNull(term, "term");
        }
    }

    /**
     * A numeric operand.
     *
     * @param number the number
     */
    record NumberValue(Number number) implements OperatorValue {
        /**
         * Validate the number.
         *
         * @param number the number
         */
        public NumberValue {
            Objects.requireNonNull(number, "number");
        }
    }

    /**
     * A pre-encoded or bare string operand.
     *
     * @param value the string
     */
    record RawValue(String value) implements OperatorValue {
        /**
         * Validate the string.
         *
         * @param value the string
         */
        public RawValue {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Wrap a term.
     *
     * @param term the term
     * @return the operand
     */
    static OperatorValue of(final Node term) {
        return new TermValue(term);
    }

    /**
     * Wrap a number.
     *
     * @param number the number
     * @return the operand
     */
    static OperatorValue of(final Number number) {
        return new NumberValue(number);
    }

    /**
     * Wrap a string.
     *
     * @param value the string
     * @return the operand
     */
    static OperatorValue raw(final String value) {
        return new RawValue(value);
    }
}
