package de.bsommerfeld.storygraph.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads SQL from classpath resources and caches it for the lifetime of the
 * JVM. Statements live in {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code update-snippet-parent.sql}; the DDL lives in {@code schema.sql} at
 * the classpath root.
 *
 * @see SqlDatabaseService
 */
public final class SqlLoader {

    static final String SCHEMA_RESOURCE = "schema.sql";

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the trimmed statement from {@code sql/<name>.sql}.
     *
     * @param name the file stem without directory or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent("sql/" + name + ".sql", SqlLoader::readResource);
    }

    /**
     * Returns the individual DDL statements of {@code schema.sql}, split on
     * statement-terminating semicolons. Blank fragments are dropped.
     */
    public static List<String> loadSchema() {
        String schema = CACHE.computeIfAbsent(SCHEMA_RESOURCE, SqlLoader::readResource);
        List<String> statements = new ArrayList<>();
        for (String sql : schema.split(";\\s*(\\r?\\n|$)")) {
            if (!sql.isBlank()) {
                statements.add(sql.trim());
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
