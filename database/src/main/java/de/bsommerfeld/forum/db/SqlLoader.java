package de.bsommerfeld.forum.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL from classpath resources.
 *
 * <p>
 * Two resource families exist:
 * <ul>
 * <li>{@code sql/<operation>-<entity>.sql}: one DML or query statement each,
 * e.g. {@code insert-user.sql}, {@code select-post-tags.sql}</li>
 * <li>{@code schema/<Table>.sql}: the {@code CREATE TABLE} statement of one
 * table, e.g. {@code schema/Users.sql}</li>
 * </ul>
 *
 * <p>
 * Each file is read once and kept for the lifetime of the JVM.
 *
 * @see SqlForumDatabase
 * @see SchemaManager
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement from {@code sql/<name>.sql}, trimmed.
     *
     * @param name the file stem without path prefix or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent("sql/" + name + ".sql", SqlLoader::readResource);
    }

    /**
     * Returns the DDL from {@code schema/<table>.sql}, trimmed.
     *
     * @param table table name exactly as it appears in the database
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String schema(String table) {
        return CACHE.computeIfAbsent("schema/" + table + ".sql", SqlLoader::readResource);
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
