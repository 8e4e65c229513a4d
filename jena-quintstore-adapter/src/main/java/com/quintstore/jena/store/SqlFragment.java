package com.quintstore.jena.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A boolean SQL condition and the parameters it binds.
 *
 * <p>An empty fragment has no condition and matches every row.</p>
 *
 * @param sql the condition, without the {@code WHERE} keyword
 * @param params parameter values in placeholder order
 */
public record SqlFragment(String sql, List<Object> params) {

    /** Fragment that matches everything. */
    public static final SqlFragment EMPTY = new SqlFragment("", List.of());

    /**
     * Copy the parameters.
     *
     * @param sql the condition
     * @param params parameter values
     */
    public SqlFragment {
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    /**
     * Check whether the fragment carries no condition.
     *
     * @return true when empty
     */
    public boolean isEmpty() {
        return sql.isEmpty();
    }

    /**
     * Render as a {@code WHERE} clause.
     *
     * @return {@code " WHERE ..."}, or an empty string
     */
    public String toWhereClause() {
        return isEmpty() ? "" : " WHERE " + sql;
    }

    /**
     * Join with another condition using {@code AND}.
     *
     * @param other the other fragment
     * @return the combined fragment
     */
    public SqlFragment and(final SqlFragment other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<Object> merged = new ArrayList<>(params);
        merged.addAll(other.params);
        return new SqlFragment(sql + " AND " + other.sql, merged);
    }
}
