package com.quintstore.jena.store;

import java.util.List;

/**
 * The SQL engines a quint store can run on, with the statement forms that
 * differ between them.
 */
public enum SqlDialect {
    /** SQLite through the xerial driver. */
    SQLITE("sqlite", "REGEXP", "", "-1"),
    /** PostgreSQL through the pgjdbc driver. */
    POSTGRES("postgresql", "~", " COLLATE \"C\"", "ALL");

    /** Value of the {@code db.system} tracing attribute. */
    private final String system;
    /** Infix operator for a regular expression match. */
    private final String regexOperator;
    /** Collation clause for the term columns. */
    private final String collation;
    /** LIMIT argument meaning no limit. */
    private final String noLimit;

    SqlDialect(final String system, final String regexOperator,
            final String collation, final String noLimit) {
        this.system = system;
        this.regexOperator = regexOperator;
        this.collation = collation;
        this.noLimit = noLimit;
    }

    /**
     * Get the database system name.
     *
     * @return the name used in tracing
     */
    public String system() {
        return system;
    }

    /**
     * Render a regular expression test.
     *
     * @param column the qualified column
     * @return the condition with one placeholder
     */
    public String regexCondition(final String column) {
        return column + " " + regexOperator + " ?";
    }

    /**
     * Upsert statement for one quint. Only the vector is replaced when the
     * key already exists.
     *
     * @return the statement text
     */
    public String upsertSql() {
        return "INSERT INTO " + QuintSchema.TABLE
            + " (graph, subject, predicate, object, vector) VALUES (?, ?, ?, ?, ?)"
            + " ON CONFLICT (graph, subject, predicate, object)"
            + " DO UPDATE SET vector = excluded.vector";
    }

    /**
     * Collation applied to term columns so that ordering is by code point.
     *
     * @return the collation clause, possibly empty
     */
    public String collation() {
        return collation;
    }

    /**
     * Render a paging clause, adding its parameters.
     *
     * @param options the paging options
     * @param params receives the limit and offset values
     * @return the clause with a leading space, or an empty string
     */
    public String pagingClause(final QueryOptions options, final List<Object> params) {
        var clause = new StringBuilder();
        if (options.limit() != null) {
            clause.append(" LIMIT ?");
            params.add(options.limit());
        } else if (options.offset() != null) {
            // OFFSET requires a LIMIT in SQLite
            clause.append(" LIMIT ").append(noLimit);
        }
        if (options.offset() != null) {
            clause.append(" OFFSET ?");
            params.add(options.offset());
        }
        return clause.toString();
    }
}
