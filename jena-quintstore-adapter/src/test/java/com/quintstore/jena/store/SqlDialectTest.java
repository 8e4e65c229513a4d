package com.quintstore.jena.store;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SqlDialect paging and QueryOptions validation.
 */
public class SqlDialectTest {

    @Test
    @DisplayName("Test paging with limit and offset")
    public void testLimitOffset() {
        List<Object> params = new ArrayList<>();
        String clause = SqlDialect.SQLITE.pagingClause(
            new QueryOptions(10L, 20L, List.of(), false), params);
        assertEquals(" LIMIT ? OFFSET ?", clause);
        assertEquals(List.of(10L, 20L), params);
    }

    @Test
    @DisplayName("Test offset without limit")
    public void testOffsetOnly() {
        List<Object> sqliteParams = new ArrayList<>();
        assertEquals(" LIMIT -1 OFFSET ?", SqlDialect.SQLITE.pagingClause(
            new QueryOptions(null, 5L, List.of(), false), sqliteParams));
        List<Object> postgresParams = new ArrayList<>();
        assertEquals(" LIMIT ALL OFFSET ?", SqlDialect.POSTGRES.pagingClause(
            new QueryOptions(null, 5L, List.of(), false), postgresParams));
        assertEquals(List.of(5L), postgresParams);
    }

    @Test
    @DisplayName("Test no paging")
    public void testNoPaging() {
        List<Object> params = new ArrayList<>();
        assertEquals("", SqlDialect.SQLITE.pagingClause(QueryOptions.NONE, params));
        assertTrue(params.isEmpty());
    }

    @Test
    @DisplayName("Test negative limits are rejected")
    public void testNegativeLimit() {
        assertThrows(IllegalArgumentException.class,
            () -> new QueryOptions(-1L, null, List.of(), false));
        assertThrows(IllegalArgumentException.class,
            () -> new QueryOptions(null, -1L, List.of(), false));
    }

    @Test
    @DisplayName("Test dialect names")
    public void testSystemNames() {
        assertEquals("sqlite", SqlDialect.SQLITE.system());
        assertEquals("postgresql", SqlDialect.POSTGRES.system());
        assertTrue(SqlDialect.SQLITE.upsertSql().contains("ON CONFLICT"));
        assertTrue(SqlDialect.POSTGRES.upsertSql().contains("ON CONFLICT"));
    }
}
