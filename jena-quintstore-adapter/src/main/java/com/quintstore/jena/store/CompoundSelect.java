package com.quintstore.jena.store;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One projected column of a compound query.
 *
 * @param pattern index of the pattern the column comes from
 * @param field the column
 * @param alias result alias; a plain SQL identifier
 */
public record CompoundSelect(int pattern, TermName field, String alias) {

    /** Legal alias shape. */
    private static final Pattern ALIAS = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** Alias reserved for the join column. */
    public static final String JOIN_VALUE = "join_value";

    /**
     * Validate the projection.
     *
     * @param pattern index of the pattern
     * @param field the column
     * @param alias result alias
     */
    public CompoundSelect {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(alias, "alias");
        if (pattern < 0) {
            throw new IllegalArgumentException("Pattern index must not be negative: " + pattern);
        }
        if (!ALIAS.matcher(alias).matches() || JOIN_VALUE.equalsIgnoreCase(alias)) {
            throw new IllegalArgumentException("Invalid select alias: " + alias);
        }
    }
}
