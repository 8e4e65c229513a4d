package com.quintstore.jena.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import org.apache.jena.graph.Node;

/**
 * A conjunctive set of tests applied to one column of the quint table.
 *
 * <p>All operators are optional; every operator that is set must hold for a
 * row to match. Instances are immutable and built with {@link #builder()}.</p>
 *
 * <ul>
 *   <li>{@code $eq, $ne, $gt, $gte, $lt, $lte}: comparison with one operand</li>
 *   <li>{@code $in, $notIn}: membership in a set of operands</li>
 *   <li>{@code $startsWith, $endsWith, $contains}: substring tests on the
 *       stored string. {@code $startsWith} is an index range ending at the
 *       prefix plus U+FFFF, which misses values continuing with a
 *       supplementary-plane character.</li>
 *   <li>{@code $regex}: regular expression test on the stored string</li>
 *   <li>{@code $isNull}: column null test</li>
 * </ul>
 */
public final class TermOperators {
    /** Equality operand. */
    private final OperatorValue eq;
    /** Inequality operand. */
    private final OperatorValue ne;
    /** Strictly-greater operand. */
    private final OperatorValue gt;
    /** Greater-or-equal operand. */
    private final OperatorValue gte;
    /** Strictly-less operand. */
    private final OperatorValue lt;
    /** Less-or-equal operand. */
    private final OperatorValue lte;
    /** Membership operands. */
    private final List<OperatorValue> in;
    /** Exclusion operands. */
    private final List<OperatorValue> notIn;
    /** Stored-string prefix. */
    private final String startsWith;
    /** Stored-string suffix. */
    private final String endsWith;
    /** Stored-string infix. */
    private final String contains;
    /** Regular expression over the stored string. */
    private final String regex;
    /** Null test; null when not set. */
    private final Boolean isNull;

    private TermOperators(final Builder builder) {
        this.eq = builder.eq;
        this.ne = builder.ne;
        this.gt = builder.gt;
        this.gte = builder.gte;
        this.lt = builder.lt;
        this.lte = builder.lte;
        this.in = builder.in == null ? null
            : Collections.unmodifiableList(new ArrayList<>(builder.in));
        this.notIn = builder.notIn == null ? null
            : Collections.unmodifiableList(new ArrayList<>(builder.notIn));
        this.startsWith = builder.startsWith;
        this.endsWith = builder.endsWith;
        this.contains = builder.contains;
        this.regex = builder.regex;
        this.isNull = builder.isNull;
    }

    /**
     * Start building an operator set.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder pre-filled with this operator set.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        var builder = new Builder();
        builder.eq = eq;
        builder.ne = ne;
        builder.gt = gt;
        builder.gte = gte;
        builder.lt = lt;
        builder.lte = lte;
        builder.in = in;
        builder.notIn = notIn;
        builder.startsWith = startsWith;
        builder.endsWith = endsWith;
        builder.contains = contains;
        builder.regex = regex;
        builder.isNull = isNull;
        return builder;
    }

    /**
     * Union of two operator sets. Operators set in {@code other} replace the
     * same operators in this set.
     *
     * @param other the operators to merge in
     * @return the merged set
     */
    public TermOperators merge(final TermOperators other) {
        var builder = toBuilder();
        if (other.eq != null) {
            builder.eq = other.eq;
        }
        if (other.ne != null) {
            builder.ne = other.ne;
        }
        if (other.gt != null) {
            builder.gt = other.gt;
        }
        if (other.gte != null) {
            builder.gte = other.gte;
        }
        if (other.lt != null) {
            builder.lt = other.lt;
        }
        if (other.lte != null) {
            builder.lte = other.lte;
        }
        if (other.in != null) {
            builder.in = other.in;
        }
        if (other.notIn != null) {
            builder.notIn = other.notIn;
        }
        if (other.startsWith != null) {
            builder.startsWith = other.startsWith;
        }
        if (other.endsWith != null) {
            builder.endsWith = other.endsWith;
        }
        if (other.contains != null) {
            builder.contains = other.contains;
        }
        if (other.regex != null) {
            builder.regex = other.regex;
        }
        if (other.isNull != null) {
            builder.isNull = other.isNull;
        }
        return builder.build();
    }

    /**
     * Conjunction of two operator sets: a row must pass both. Operators set
     * on one side only are copied. Equality, membership, exclusion, prefix
     * and null tests set on both sides are combined; a combination no value
     * can satisfy becomes an empty {@code $in}.
     *
     * @param other the operators to add
     * @return the combined set
     * @throws IllegalArgumentException if both sides set different ordering,
     *         suffix, infix or regex operands
     */
    public TermOperators and(final TermOperators other) {
        requireSame("$gt", gt, other.gt);
        requireSame("$gte", gte, other.gte);
        requireSame("$lt", lt, other.lt);
        requireSame("$lte", lte, other.lte);
        requireSame("$endsWith", endsWith, other.endsWith);
        requireSame("$contains", contains, other.contains);
        requireSame("$regex", regex, other.regex);

        var builder = merge(other).toBuilder();
        boolean unsatisfiable = eq != null && other.eq != null && !eq.equals(other.eq)
            || isNull != null && other.isNull != null && !isNull.equals(other.isNull);
        if (in != null && other.in != null) {
            var common = new ArrayList<>(in);
            common.retainAll(other.in);
            builder.in = common;
        }
        if (startsWith != null && other.startsWith != null) {
            if (other.startsWith.startsWith(startsWith)) {
                builder.startsWith = other.startsWith;
            } else if (startsWith.startsWith(other.startsWith)) {
                builder.startsWith = startsWith;
            } else {
                unsatisfiable = true;
            }
        }
        if (notIn != null && other.notIn != null) {
            var excluded = new ArrayList<>(notIn);
            excluded.addAll(other.notIn);
            builder.notIn = excluded;
        }
        if (ne != null && other.ne != null && !ne.equals(other.ne)) {
            var excluded = builder.notIn == null
                ? new ArrayList<OperatorValue>() : new ArrayList<>(builder.notIn);
            excluded.add(other.ne);
            builder.ne = ne;
            builder.notIn = excluded;
        }
        if (unsatisfiable) {
            builder.in = List.of();
        }
        return builder.build();
    }

    /**
     * Check whether both sets use at least one operator in common.
     *
     * @param other the other set
     * @return true when some operator is set on both sides
     */
    public boolean overlaps(final TermOperators other) {
        return eq != null && other.eq != null
            || ne != null && other.ne != null
            || gt != null && other.gt != null
            || gte != null && other.gte != null
            || lt != null && other.lt != null
            || lte != null && other.lte != null
            || in != null && other.in != null
            || notIn != null && other.notIn != null
            || startsWith != null && other.startsWith != null
            || endsWith != null && other.endsWith != null
            || contains != null && other.contains != null
            || regex != null && other.regex != null
            || isNull != null && other.isNull != null;
    }

    private static void requireSame(final String operator, final Object left,
            final Object right) {
        if (left != null && right != null && !left.equals(right)) {
            throw new IllegalArgumentException("Cannot combine two " + operator
                + " conditions: " + left + " and " + right);
        }
    }

    /**
     * Check whether no operator is set.
     *
     * @return true when empty
     */
    public boolean isEmpty() {
        return eq == null && ne == null && gt == null && gte == null
            && lt == null && lte == null && in == null && notIn == null
            && startsWith == null && endsWith == null && contains == null
            && regex == null && isNull == null;
    }

    public OperatorValue getEq() {
        return eq;
    }

    public OperatorValue getNe() {
        return ne;
    }

    public OperatorValue getGt() {
        return gt;
    }

    public OperatorValue getGte() {
        return gte;
    }

    public OperatorValue getLt() {
        return lt;
    }

    public OperatorValue getLte() {
        return lte;
    }

    public List<OperatorValue> getIn() {
        return in;
    }

    public List<OperatorValue> getNotIn() {
        return notIn;
    }

    public String getStartsWith() {
        return startsWith;
    }

    public String getEndsWith() {
        return endsWith;
    }

    public String getContains() {
        return contains;
    }

    public String getRegex() {
        return regex;
    }

    public Boolean getIsNull() {
        return isNull;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TermOperators that)) {
            return false;
        }
        return Objects.equals(eq, that.eq) && Objects.equals(ne, that.ne)
            && Objects.equals(gt, that.gt) && Objects.equals(gte, that.gte)
            && Objects.equals(lt, that.lt) && Objects.equals(lte, that.lte)
            && Objects.equals(in, that.in) && Objects.equals(notIn, that.notIn)
            && Objects.equals(startsWith, that.startsWith)
            && Objects.equals(endsWith, that.endsWith)
            && Objects.equals(contains, that.contains)
            && Objects.equals(regex, that.regex)
            && Objects.equals(isNull, that.isNull);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eq, ne, gt, gte, lt, lte, in, notIn, startsWith,
            endsWith, contains, regex, isNull);
    }

    @Override
    public String toString() {
        var joiner = new StringJoiner(", ", "{", "}");
        append(joiner, "$eq", eq);
        append(joiner, "$ne", ne);
        append(joiner, "$gt", gt);
        append(joiner, "$gte", gte);
        append(joiner, "$lt", lt);
        append(joiner, "$lte", lte);
        append(joiner, "$in", in);
        append(joiner, "$notIn", notIn);
        append(joiner, "$startsWith", startsWith);
        append(joiner, "$endsWith", endsWith);
        append(joiner, "$contains", contains);
        append(joiner, "$regex", regex);
        append(joiner, "$isNull", isNull);
        return joiner.toString();
    }

    private static void append(final StringJoiner joiner, final String key,
            final Object value) {
        if (value != null) {
            joiner.add(key + ": " + value);
        }
    }

    /**
     * Builder for {@link TermOperators}.
     */
    public static final class Builder {
        private OperatorValue eq;
        private OperatorValue ne;
        private OperatorValue gt;
        private OperatorValue gte;
        private OperatorValue lt;
        private OperatorValue lte;
        private List<OperatorValue> in;
        private List<OperatorValue> notIn;
        private String startsWith;
        private String endsWith;
        private String contains;
        private String regex;
        private Boolean isNull;

        private Builder() {
        }

        public Builder eq(final OperatorValue value) {
            this.eq = value;
            return this;
        }

        public Builder eq(final Node term) {
            return eq(OperatorValue.of(term));
        }

        public Builder eq(final Number number) {
            return eq(OperatorValue.of(number));
        }

        public Builder ne(final OperatorValue value) {
            this.ne = value;
            return this;
        }

        public Builder ne(final Node term) {
            return ne(OperatorValue.of(term));
        }

        public Builder ne(final Number number) {
            return ne(OperatorValue.of(number));
        }

        public Builder gt(final OperatorValue value) {
            this.gt = value;
            return this;
        }

        public Builder gt(final Node term) {
            return gt(OperatorValue.of(term));
        }

        public Builder gt(final Number number) {
            return gt(OperatorValue.of(number));
        }

        public Builder gte(final OperatorValue value) {
            this.gte = value;
            return this;
        }

        public Builder gte(final Node term) {
            return gte(OperatorValue.of(term));
        }

        public Builder gte(final Number number) {
            return gte(OperatorValue.of(number));
        }

        public Builder lt(final OperatorValue value) {
            this.lt = value;
            return this;
        }

        public Builder lt(final Node term) {
            return lt(OperatorValue.of(term));
        }

        public Builder lt(final Number number) {
            return lt(OperatorValue.of(number));
        }

        public Builder lte(final OperatorValue value) {
            this.lte = value;
            return this;
        }

        public Builder lte(final Node term) {
            return lte(OperatorValue.of(term));
        }

        public Builder lte(final Number number) {
            return lte(OperatorValue.of(number));
        }

        public Builder in(final List<OperatorValue> values) {
            this.in = values;
            return this;
        }

        /**
         * Set {@code $in} from terms.
         *
         * @param terms the terms
         * @return this builder
         */
        public Builder inTerms(final List<Node> terms) {
            this.in = terms.stream().map(OperatorValue::of).toList();
            return this;
        }

        public Builder notIn(final List<OperatorValue> values) {
            this.notIn = values;
            return this;
        }

        /**
         * Set {@code $notIn} from terms.
         *
         * @param terms the terms
         * @return this builder
         */
        public Builder notInTerms(final List<Node> terms) {
            this.notIn = terms.stream().map(OperatorValue::of).toList();
            return this;
        }

        public Builder startsWith(final String prefix) {
            this.startsWith = prefix;
            return this;
        }

        public Builder endsWith(final String suffix) {
            this.endsWith = suffix;
            return this;
        }

        public Builder contains(final String infix) {
            this.contains = infix;
            return this;
        }

        public Builder regex(final String pattern) {
            this.regex = pattern;
            return this;
        }

        public Builder isNull(final Boolean value) {
            this.isNull = value;
            return this;
        }

        /**
         * Build the operator set.
         *
         * @return the immutable operator set
         */
        public TermOperators build() {
            return new TermOperators(this);
        }
    }
}
