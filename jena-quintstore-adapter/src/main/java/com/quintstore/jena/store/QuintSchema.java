package com.quintstore.jena.store;

import java.util.ArrayList;
import java.util.List;

/**
 * DDL for the quint table and its covering indexes.
 *
 * <p>The six indexes put every combination of bound columns at the front
 * of some index, so no pattern with at least one concrete term needs a
 * full scan.</p>
 */
public final class QuintSchema {
    /** Table name. */
    public static final String TABLE = "quints";

    /** Index definitions as name followed by column order. */
    public static final List<Index> INDEXES = List.of(
        new Index("idx_spog", List.of(TermName.SUBJECT, TermName.PREDICATE,
            TermName.OBJECT, TermName.GRAPH)),
        new Index("idx_ogsp", List.of(TermName.OBJECT, TermName.GRAPH,
            TermName.SUBJECT, TermName.PREDICATE)),
        new Index("idx_gspo", List.of(TermName.GRAPH, TermName.SUBJECT,
            TermName.PREDICATE, TermName.OBJECT)),
        new Index("idx_sopg", List.of(TermName.SUBJECT, TermName.OBJECT,
            TermName.PREDICATE, TermName.GRAPH)),
        new Index("idx_pogs", List.of(TermName.PREDICATE, TermName.OBJECT,
            TermName.GRAPH, TermName.SUBJECT)),
        new Index("idx_gpos", List.of(TermName.GRAPH, TermName.PREDICATE,
            TermName.OBJECT, TermName.SUBJECT)));

    /** Private constructor to prevent instantiation. */
    private QuintSchema() {
        // Utility class
    }

    /**
     * A covering index.
     *
     * @param name index name
     * @param columns column order
     */
    public record Index(String name, List<TermName> columns) {
        /**
         * Render the idempotent create statement.
         *
         * @return the DDL
         */
        public String createSql() {
            var cols = new ArrayList<String>();
            for (TermName column : columns) {
                cols.add(column.column());
            }
            return "CREATE INDEX IF NOT EXISTS " + name + " ON " + TABLE
                + " (" + String.join(", ", cols) + ")";
        }
    }

    /**
     * Render the idempotent create statement for the table.
     *
     * @param dialect the target engine
     * @return the DDL
     */
    public static String createTableSql(final SqlDialect dialect) {
        String text = "TEXT" + dialect.collation() + " NOT NULL";
        return "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
            + "graph " + text + ", "
            + "subject " + text + ", "
            + "predicate " + text + ", "
            + "object " + text + ", "
            + "vector TEXT, "
            + "PRIMARY KEY (graph, subject, predicate, object))";
    }

    /**
     * All statements needed to create the schema, table first.
     *
     * @param dialect the target engine
     * @return the DDL statements in order
     */
    public static List<String> statements(final SqlDialect dialect) {
        var statements = new ArrayList<String>();
        statements.add(createTableSql(dialect));
        for (Index index : INDEXES) {
            statements.add(index.createSql());
        }
        return statements;
    }
}
