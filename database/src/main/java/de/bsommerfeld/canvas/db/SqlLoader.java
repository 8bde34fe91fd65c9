package de.bsommerfeld.canvas.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL from classpath resources.
 *
 * <p>
 * Single statements live in {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code insert-media-file.sql}. Schema scripts live in
 * {@code schema/<database>.sql} and may hold several statements separated by
 * semicolons at line ends.
 *
 * <p>
 * Each file is read once and cached for the lifetime of the JVM.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement from {@code sql/<name>.sql}, trimmed.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent("sql/" + name + ".sql", SqlLoader::readResource);
    }

    /**
     * Returns the statements of {@code schema/<name>.sql} in file order.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> loadScript(String name) {
        String script = CACHE.computeIfAbsent("schema/" + name + ".sql", SqlLoader::readResource);
        List<String> statements = new ArrayList<>();
        for (String sql : script.split(";\\s*(\\r?\\n|$)")) {
            String trimmed = sql.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        return statements;
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
