package com.quintstore.jena.store;

import java.util.Locale;
import java.util.Optional;

/**
 * The four term positions of a quint, each bound to its fixed column name.
 *
 * <p>Column identifiers that end up in generated SQL are always taken from
 * this enum, never from caller input.</p>
 */
public enum TermName {
    /** Subject position. */
    SUBJECT("subject"),
    /** Predicate position. */
    PREDICATE("predicate"),
    /** Object position. */
    OBJECT("object"),
    /** Graph position. */
    GRAPH("graph");

    /** Column name in the quints table. */
    private final String column;

    TermName(final String column) {
        this.column = column;
    }

    /**
     * Get the column name.
     *
     * @return the column name
     */
    public String column() {
        return column;
    }

    /**
     * Resolve a short ({@code s}, {@code p}, {@code o}, {@code g}) or long
     * name, case-insensitively.
     *
     * @param name the name to resolve
     * @return the matching position, or empty
     */
    public static Optional<TermName> fromName(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        switch (name.toLowerCase(Locale.ROOT)) {
            case "s", "subject":
                return Optional.of(SUBJECT);
            case "p", "predicate":
                return Optional.of(PREDICATE);
            case "o", "object":
                return Optional.of(OBJECT);
            case "g", "graph":
                return Optional.of(GRAPH);
            default:
                return Optional.empty();
        }
    }
}
