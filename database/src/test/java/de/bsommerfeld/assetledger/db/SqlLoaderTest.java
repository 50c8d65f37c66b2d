package de.bsommerfeld.assetledger.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlLoaderTest {

    @Test
    void load_shouldReturnInsertAuditEntry() {
        String sql = SqlLoader.load("insert-audit-entry");
        assertNotNull(sql);
        assertTrue(sql.toLowerCase().contains("insert into audit_log"));
    }

    @Test
    void load_shouldReturnLoginQuery() {
        String sql = SqlLoader.load("select-principal-for-login");
        assertTrue(sql.toLowerCase().contains("is_active = 1"));
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        String first = SqlLoader.load("count-audit");
        String second = SqlLoader.load("count-audit");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void load_shouldThrowForNonexistentFile() {
        assertThrows(IllegalStateException.class,
                () -> SqlLoader.load("nonexistent-sql-file"));
    }

    @Test
    void split_shouldDropCommentLinesAndKeepOrder() {
        String script = "-- header\nCREATE TABLE a (x INTEGER);\n\n  -- note\nCREATE TABLE b (y TEXT);\n";
        List<String> statements = SqlLoader.split(script);
        assertEquals(List.of("CREATE TABLE a (x INTEGER)", "CREATE TABLE b (y TEXT)"), statements);
    }

    @Test
    void split_shouldKeepSemicolonsInsideLine() {
        String script = "INSERT INTO t (v) VALUES ('a;b');\nSELECT 1";
        List<String> statements = SqlLoader.split(script);
        assertEquals(2, statements.size());
        assertEquals("INSERT INTO t (v) VALUES ('a;b')", statements.get(0));
        assertEquals("SELECT 1", statements.get(1));
    }

    @Test
    void statements_shouldSplitInitialSchema() {
        List<String> statements = SqlLoader.statements("migration/001-initial_schema");
        assertEquals(8, statements.size());
        assertTrue(statements.get(0).startsWith("CREATE TABLE roles"));
    }
}
