package com.quintstore.jena.store;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.Function;

/**
 * SQLite executor over a single connection.
 *
 * <p>All statements are serialised on this instance. The connection has a
 * {@code REGEXP} function backed by {@link java.util.regex.Pattern} and
 * case sensitive {@code LIKE}.</p>
 */
public final class SqliteExecutor implements SqlExecutor {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SqliteExecutor.class);

    /** JDBC URL prefix of the xerial driver. */
    public static final String JDBC_PREFIX = "jdbc:sqlite:";

    /** Path of the in-memory database. */
    public static final String MEMORY = ":memory:";

    /** The connection. */
    private final Connection connection;

    private SqliteExecutor(final Connection connection) {
        this.connection = connection;
    }

    /**
     * Open a database file, or an in-memory database for {@code :memory:}.
     * Missing parent directories of a file are created.
     *
     * @param path the file path or {@code :memory:}
     * @return the executor
     * @throws SQLException if the database cannot be opened
     */
    public static SqliteExecutor open(final String path) throws SQLException {
        if (!MEMORY.equals(path)) {
            File parent = new File(path).getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists() && !parent.mkdirs()) {
                throw new SQLException("Cannot create directory " + parent);
            }
        }
        Connection connection = DriverManager.getConnection(JDBC_PREFIX + path);
        try {
            JdbcSupport.exec(connection, "PRAGMA case_sensitive_like = ON");
            Function.create(connection, "REGEXP", new RegexpFunction());
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Opened SQLite database {}", path);
        }
        return new SqliteExecutor(connection);
    }

    @Override
    public synchronized List<Map<String, Object>> query(final String sql,
            final List<Object> params) throws SQLException {
        return JdbcSupport.query(connection, sql, params, UnaryOperator.identity());
    }

    @Override
    public synchronized int execute(final String sql, final List<Object> params)
            throws SQLException {
        return JdbcSupport.execute(connection, sql, params);
    }

    @Override
    public synchronized int executeInTransaction(
            final List<SqlStatement> statements) throws SQLException {
        return JdbcSupport.executeInTransaction(connection, statements);
    }

    @Override
    public synchronized void exec(final String sql) throws SQLException {
        JdbcSupport.exec(connection, sql);
    }

    @Override
    public SqlDialect dialect() {
        return SqlDialect.SQLITE;
    }

    @Override
    public synchronized void close() throws SQLException {
        if (!connection.isClosed()) {
            connection.close();
        }
    }

    /**
     * {@code regexp(pattern, value)}: 1 when the pattern is found in the
     * value, 0 otherwise or when either argument is NULL.
     */
    private static final class RegexpFunction extends Function {
        /** Upper bound on cached patterns. */
        private static final int CACHE_LIMIT = 256;

        /** Compiled patterns by source. */
        private final Map<String, Pattern> cache = new ConcurrentHashMap<>();

        @Override
        protected void xFunc() throws SQLException {
            String regex = value_text(0);
            String value = value_text(1);
            if (regex == null || value == null) {
                result(0);
                return;
            }
            result(compile(regex).matcher(value).find() ? 1 : 0);
        }

        private Pattern compile(final String regex) throws SQLException {
            Pattern pattern = cache.get(regex);
            if (pattern == null) {
                try {
                    pattern = Pattern.compile(regex);
                } catch (PatternSyntaxException e) {
                    throw new SQLException("Invalid regular expression: " + regex, e);
                }
                if (cache.size() >= CACHE_LIMIT) {
                    cache.clear();
                }
                cache.put(regex, pattern);
            }
            return pattern;
        }
    }
}
