package com.quintstore.jena.tracing;

import com.quintstore.jena.store.SqlDialect;
import com.quintstore.jena.store.SqlExecutor;
import com.quintstore.jena.store.SqlStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TracedSqlExecutor class.
 */
public class TracedSqlExecutorTest {

    private SqlExecutor mockExecutor;
    private TracedSqlExecutor tracedExecutor;

    @BeforeEach
    public void setUp() {
        mockExecutor = mock(SqlExecutor.class);
        when(mockExecutor.dialect()).thenReturn(SqlDialect.SQLITE);
        tracedExecutor = new TracedSqlExecutor(mockExecutor);
    }

    @Test
    @DisplayName("Test TracedSqlExecutor wraps delegate executor")
    public void testGetDelegate() {
        assertSame(mockExecutor, tracedExecutor.getDelegate());
        assertEquals(SqlDialect.SQLITE, tracedExecutor.dialect());
    }

    @Test
    @DisplayName("Test query delegates to wrapped executor")
    public void testQuery() throws SQLException {
        String sql = "SELECT * FROM quints WHERE subject = ?";
        List<Object> params = List.of("http://example.org/a");
        List<Map<String, Object>> rows = List.of(Map.of("subject", "http://example.org/a"));
        when(mockExecutor.query(sql, params)).thenReturn(rows);

        List<Map<String, Object>> result = tracedExecutor.query(sql, params);

        verify(mockExecutor).query(sql, params);
        assertSame(rows, result);
    }

    @Test
    @DisplayName("Test execute delegates to wrapped executor")
    public void testExecute() throws SQLException {
        String sql = "DELETE FROM quints";
        when(mockExecutor.execute(sql, List.of())).thenReturn(3);

        assertEquals(3, tracedExecutor.execute(sql, List.of()));
        verify(mockExecutor).execute(sql, List.of());
    }

    @Test
    @DisplayName("Test batch delegates to wrapped executor")
    public void testExecuteInTransaction() throws SQLException {
        List<SqlStatement> statements = List.of(
            new SqlStatement("DELETE FROM quints WHERE subject = ?", List.of("a")),
            new SqlStatement("DELETE FROM quints WHERE subject = ?", List.of("b")));
        when(mockExecutor.executeInTransaction(statements)).thenReturn(2);

        assertEquals(2, tracedExecutor.executeInTransaction(statements));
        verify(mockExecutor).executeInTransaction(statements);
    }

    @Test
    @DisplayName("Test exec and close delegate to wrapped executor")
    public void testExecAndClose() throws SQLException {
        tracedExecutor.exec("CREATE TABLE t (x TEXT)");
        tracedExecutor.close();

        verify(mockExecutor).exec("CREATE TABLE t (x TEXT)");
        verify(mockExecutor).close();
    }

    @Test
    @DisplayName("Test failures from the delegate propagate")
    public void testFailurePropagates() throws SQLException {
        SQLException failure = new SQLException("boom");
        when(mockExecutor.query(anyString(), anyList())).thenThrow(failure);

        SQLException thrown = assertThrows(SQLException.class,
            () -> tracedExecutor.query("SELECT 1", List.of()));
        assertSame(failure, thrown);
    }
}
