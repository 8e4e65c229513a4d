package com.quintstore.jena.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * JDBC plumbing shared by the executors.
 */
final class JdbcSupport {

    /** Private constructor to prevent instantiation. */
    private JdbcSupport() {
        // Utility class
    }

    static List<Map<String, Object>> query(final Connection connection,
            final String sql, final List<Object> params,
            final UnaryOperator<Object> readValue) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, params);
            try (ResultSet rs = statement.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                int columns = meta.getColumnCount();
                var rows = new ArrayList<Map<String, Object>>();
                while (rs.next()) {
                    var row = new LinkedHashMap<String, Object>(columns * 2);
                    for (int i = 1; i <= columns; i++) {
                        row.put(meta.getColumnLabel(i), readValue.apply(rs.getObject(i)));
                    }
                    rows.add(row);
                }
                return rows;
            }
        }
    }

    static int execute(final Connection connection, final String sql,
            final List<Object> params) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, params);
            return statement.executeUpdate();
        }
    }

    static void exec(final Connection connection, final String sql)
            throws SQLException {
        try (var statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    /**
     * Run statements in one transaction on the given connection and
     * restore auto-commit afterwards.
     */
    static int executeInTransaction(final Connection connection,
            final List<SqlStatement> statements) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            int affected = 0;
            for (SqlStatement statement : statements) {
                affected += execute(connection, statement.sql(), statement.params());
            }
            connection.commit();
            return affected;
        } catch (SQLException | RuntimeException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    static void bind(final PreparedStatement statement,
            final List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object value = params.get(i);
            if (value == null) {
                statement.setNull(i + 1, Types.VARCHAR);
            } else {
                statement.setObject(i + 1, value);
            }
        }
    }
}
