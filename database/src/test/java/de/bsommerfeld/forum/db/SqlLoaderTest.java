package de.bsommerfeld.forum.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests SqlLoader against the statement and schema resources shipped with the
 * module.
 */
class SqlLoaderTest {

    @Test
    void load_shouldReturnInsertUser() {
        String sql = SqlLoader.load("insert-user");
        assertTrue(sql.toLowerCase().startsWith("insert into users"));
        assertFalse(sql.endsWith("\n"), "Statements are trimmed");
    }

    @Test
    void load_shouldReturnConditionalPostTagInsert() {
        String sql = SqlLoader.load("insert-post-tag");
        assertTrue(sql.contains("NOT EXISTS"));
    }

    @Test
    void schema_shouldReturnDdlForEveryRequiredTable() {
        for (String table : SchemaManager.TABLES) {
            String ddl = SqlLoader.schema(table);
            assertTrue(ddl.startsWith("CREATE TABLE IF NOT EXISTS " + table + " "), table);
        }
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        String first = SqlLoader.load("select-all-posts");
        String second = SqlLoader.load("select-all-posts");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void load_shouldThrowForNonexistentFile() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.load("nonexistent-sql-file"));
        assertThrows(IllegalStateException.class, () -> SqlLoader.schema("Nonexistent"));
    }
}
