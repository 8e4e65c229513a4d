package com.quintstore.jena.store;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Runs SQL against one database. Implementations own their connections;
 * the quint store only ever talks to the database through this interface.
 *
 * <p>Every statement uses {@code ?} placeholders bound in order from the
 * parameter list.</p>
 */
public interface SqlExecutor extends AutoCloseable {

    /**
     * Run a query.
     *
     * @param sql the statement
     * @param params parameter values
     * @return the rows, each keyed by column label
     * @throws SQLException if the database reports an error
     */
    List<Map<String, Object>> query(String sql, List<Object> params)
        throws SQLException;

    /**
     * Run an insert, update or delete.
     *
     * @param sql the statement
     * @param params parameter values
     * @return the number of affected rows
     * @throws SQLException if the database reports an error
     */
    int execute(String sql, List<Object> params) throws SQLException;

    /**
     * Run several statements in one transaction. Either all of them take
     * effect or, on the first failure, none do.
     *
     * @param statements the statements in order
     * @return the total number of affected rows
     * @throws SQLException if any statement fails; rollback failures are
     *         attached as suppressed exceptions
     */
    int executeInTransaction(List<SqlStatement> statements) throws SQLException;

    /**
     * Run a statement without parameters, such as DDL.
     *
     * @param sql the statement
     * @throws SQLException if the database reports an error
     */
    void exec(String sql) throws SQLException;

    /**
     * The engine this executor talks to.
     *
     * @return the dialect
     */
    SqlDialect dialect();

    /**
     * Release connections.
     *
     * @throws SQLException if closing fails
     */
    @Override
    void close() throws SQLException;
}
