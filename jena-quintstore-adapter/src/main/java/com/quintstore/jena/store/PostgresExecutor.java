package com.quintstore.jena.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PostgreSQL executor over a HikariCP pool.
 *
 * <p>Each call borrows a pooled connection; a transactional batch keeps
 * one connection for its whole duration. PostgreSQL text cannot hold
 * {@code U+0000}, which the term encoding uses as its separator, so it is
 * swapped for {@code U+001F} in every string parameter and swapped back in
 * every string result.</p>
 */
public final class PostgresExecutor implements SqlExecutor {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        PostgresExecutor.class);

    /** Separator as used by the term encoding. */
    static final char INTERNAL_SEPARATOR = '\u0000';

    /** Separator as stored in PostgreSQL. */
    static final char STORED_SEPARATOR = '\u001F';

    /** Connection source. */
    private final DataSource dataSource;

    /**
     * Create an executor over an existing data source.
     *
     * @param dataSource the data source; closed with the executor when it
     *        is a {@link HikariDataSource}
     */
    public PostgresExecutor(final DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create an executor with its own connection pool.
     *
     * @param jdbcUrl the {@code jdbc:postgresql:} URL
     * @param user the user, or null
     * @param password the password, or null
     * @param maximumPoolSize maximum pooled connections
     * @param connectionTimeoutMillis connection checkout timeout
     * @return the executor
     */
    public static PostgresExecutor create(final String jdbcUrl,
            final String user, final String password,
            final int maximumPoolSize, final long connectionTimeoutMillis) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        if (user != null) {
            config.setUsername(user);
        }
        if (password != null) {
            config.setPassword(password);
        }
        config.setMaximumPoolSize(maximumPoolSize);
        config.setConnectionTimeout(connectionTimeoutMillis);
        config.setPoolName("quintstore");
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Creating PostgreSQL pool for {} (max {} connections)",
                jdbcUrl, maximumPoolSize);
        }
        return new PostgresExecutor(new HikariDataSource(config));
    }

    @Override
    public List<Map<String, Object>> query(final String sql,
            final List<Object> params) throws SQLException {
        logStatement(sql, params);
        try (Connection connection = dataSource.getConnection()) {
            return JdbcSupport.query(connection, sql, toStored(params),
                PostgresExecutor::fromStored);
        }
    }

    @Override
    public int execute(final String sql, final List<Object> params)
            throws SQLException {
        logStatement(sql, params);
        try (Connection connection = dataSource.getConnection()) {
            return JdbcSupport.execute(connection, sql, toStored(params));
        }
    }

    @Override
    public int executeInTransaction(final List<SqlStatement> statements)
            throws SQLException {
        var stored = new ArrayList<SqlStatement>(statements.size());
        for (SqlStatement statement : statements) {
            stored.add(new SqlStatement(statement.sql(), toStored(statement.params())));
        }
        try (Connection connection = dataSource.getConnection()) {
            return JdbcSupport.executeInTransaction(connection, stored);
        }
    }

    @Override
    public void exec(final String sql) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            JdbcSupport.exec(connection, sql);
        }
    }

    @Override
    public SqlDialect dialect() {
        return SqlDialect.POSTGRES;
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
            hikari.close();
        }
    }

    /**
     * Rewrite {@code ?} placeholders as {@code $1, $2, ...}, leaving
     * quoted literals alone. Used for diagnostic output in the server's
     * native placeholder syntax.
     *
     * @param sql the statement
     * @return the rewritten statement
     */
    public static String toNumberedPlaceholders(final String sql) {
        var out = new StringBuilder(sql.length() + 16);
        int index = 0;
        boolean quoted = false;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
                out.append(c);
            } else if (c == '?' && !quoted) {
                out.append('$').append(++index);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    static List<Object> toStored(final List<Object> params) {
        var stored = new ArrayList<Object>(params.size());
        for (Object value : params) {
            stored.add(value instanceof String s
                ? s.replace(INTERNAL_SEPARATOR, STORED_SEPARATOR) : value);
        }
        return stored;
    }

    static Object fromStored(final Object value) {
        return value instanceof String s
            ? s.replace(STORED_SEPARATOR, INTERNAL_SEPARATOR) : value;
    }

    private static void logStatement(final String sql, final List<Object> params) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("SQL: {} ({} params)", toNumberedPlaceholders(sql),
                params.size());
        }
    }
}
