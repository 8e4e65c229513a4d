package com.quintstore.jena.store;

import java.util.List;
import java.util.Objects;

/**
 * Several patterns that must share the value of one column within the same
 * graph. Executed as a single self-join over the quint table.
 *
 * @param patterns the patterns, in join order
 * @param joinOn the shared column
 * @param select explicit projections; empty for the default
 *        object/predicate projection of every pattern
 */
public record CompoundPattern(List<QuintPattern> patterns, TermName joinOn,
        List<CompoundSelect> select) {

    /**
     * Validate the compound pattern.
     *
     * @param patterns the patterns
     * @param joinOn the shared column
     * @param select explicit projections
     */
    public CompoundPattern {
        Objects.requireNonNull(joinOn, "joinOn");
        patterns = List.copyOf(patterns);
        select = select == null ? List.of() : List.copyOf(select);
        for (CompoundSelect s : select) {
            if (s.pattern() >= patterns.size()) {
                throw new IllegalArgumentException("Select refers to pattern "
                    + s.pattern() + " but only " + patterns.size() + " patterns are given");
            }
        }
    }

    /**
     * Compound pattern with the default projection.
     *
     * @param patterns the patterns
     * @param joinOn the shared column
     */
    public CompoundPattern(final List<QuintPattern> patterns, final TermName joinOn) {
        this(patterns, joinOn, List.of());
    }
}
