package com.quintstore.jena.store;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the PostgreSQL executor helpers that need no server.
 */
public class PostgresExecutorTest {

    @Test
    @DisplayName("Test placeholders are numbered in order")
    public void testNumberedPlaceholders() {
        assertEquals("SELECT * FROM quints WHERE subject = $1 AND object > $2",
            PostgresExecutor.toNumberedPlaceholders(
                "SELECT * FROM quints WHERE subject = ? AND object > ?"));
    }

    @Test
    @DisplayName("Test question marks in quoted literals are kept")
    public void testQuotedQuestionMark() {
        assertEquals("SELECT '?' AS q WHERE a = $1",
            PostgresExecutor.toNumberedPlaceholders("SELECT '?' AS q WHERE a = ?"));
    }

    @Test
    @DisplayName("Test separators are swapped for storage and restored on read")
    public void testSeparatorSwap() {
        String encoded = "N\u00005000\u0000x";
        List<Object> stored = PostgresExecutor.toStored(Arrays.asList(encoded, 5L, null));
        assertEquals("N\u001F5000\u001Fx", stored.get(0),
            "NUL separators should be replaced");
        assertEquals(5L, stored.get(1), "Non-string values should pass through");
        assertNull(stored.get(2));
        assertEquals(encoded, PostgresExecutor.fromStored(stored.get(0)));
        assertEquals(7, PostgresExecutor.fromStored(7));
    }

    @Test
    @DisplayName("Test dialect of the executor")
    public void testDialect() {
        assertEquals(SqlDialect.POSTGRES, new PostgresExecutor(null).dialect());
    }
}
