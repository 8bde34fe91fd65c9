package de.bsommerfeld.canvas.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlLoaderTest {

    @Test
    void load_shouldReturnStatementContent() {
        String sql = SqlLoader.load("insert-media-file");
        assertFalse(sql.isBlank());
        assertTrue(sql.toUpperCase().contains("INSERT"));
    }

    @Test
    void load_shouldCacheRepeatedCalls() {
        String first = SqlLoader.load("select-all-folders");
        String second = SqlLoader.load("select-all-folders");
        assertSame(first, second);
    }

    @Test
    void load_shouldThrowForMissingFile() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.load("nonexistent-query"));
    }

    @Test
    void loadScript_shouldSplitIntoStatements() {
        List<String> statements = SqlLoader.loadScript("library");

        assertEquals(3, statements.size());
        assertTrue(statements.get(0).startsWith("CREATE TABLE IF NOT EXISTS folders"));
        assertTrue(statements.stream().noneMatch(s -> s.endsWith(";")));
    }

    @Test
    void loadScript_shouldThrowForMissingSchema() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.loadScript("missing"));
    }
}
