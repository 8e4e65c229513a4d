package com.quintstore.jena.query;

import com.quintstore.jena.store.TermOperators;
import java.util.List;
import java.util.Map;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.expr.Expr;

/**
 * Outcome of extracting store conditions from FILTER expressions.
 *
 * <p>{@code filters} narrow what the store returns. {@code remainder}
 * holds every expression that still has to be evaluated over the results:
 * those that could not be pushed at all and those whose pushed form only
 * prefilters.</p>
 *
 * @param filters store conditions by variable
 * @param remainder expressions left for the evaluator
 */
public record PushdownResult(Map<Var, TermOperators> filters, List<Expr> remainder) {

    /** Nothing pushed, nothing left. */
    public static final PushdownResult EMPTY = new PushdownResult(Map.of(), List.of());

    /**
     * Copy the parts.
     *
     * @param filters store conditions by variable
     * @param remainder expressions left for the evaluator
     */
    public PushdownResult {
        filters = Map.copyOf(filters);
        remainder = List.copyOf(remainder);
    }

    /**
     * Check whether any condition reaches the store.
     *
     * @return true when at least one variable has conditions
     */
    public boolean hasFilters() {
        return !filters.isEmpty();
    }
}
