package com.quintstore.jena.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A SQL statement with its positional parameters.
 *
 * @param sql statement text with {@code ?} placeholders
 * @param params parameter values in placeholder order
 */
public record SqlStatement(String sql, List<Object> params) {

    /**
     * Validate the statement.
     *
     * @param sql statement text
     * @param params parameter values
     */
    public SqlStatement {
        Objects.requireNonNull(sql, "sql");
        // null elements are allowed; a missing vector binds SQL NULL
        params = params == null ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(params));
    }

    /**
     * Build a statement from varargs parameters.
     *
     * @param sql statement text
     * @param params parameter values
     * @return the statement
     */
    public static SqlStatement of(final String sql, final Object... params) {
        return new SqlStatement(sql, Arrays.asList(params));
    }
}
