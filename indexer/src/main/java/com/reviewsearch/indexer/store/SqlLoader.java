package com.reviewsearch.indexer.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resource files under {@code sql/}.
 *
 * <p>Each file is read once and cached for the lifetime of the JVM. Files are named
 * {@code <operation>-<entity>.sql}, e.g. {@code select-reviews-for-request.sql}.
 * Some statements carry {@code {placeholder}} tokens for parts that cannot be bound
 * as parameters (IN-list arity, ORDER BY columns); {@link JdbcReviewStore} expands them.</p>
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath.
     *
     * @param name the file stem without path prefix or extension
     * @return the trimmed SQL string
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Loads {@code sql/<name>.sql} and replaces each {@code {key}} token with its value.
     * Values are spliced verbatim, so they must never carry user input.
     *
     * @throws IllegalStateException if a token in the statement has no value
     */
    public static String render(String name, Map<String, String> tokens) {
        String sql = load(name);
        for (Map.Entry<String, String> token : tokens.entrySet()) {
            sql = sql.replace("{" + token.getKey() + "}", token.getValue());
        }
        if (sql.indexOf('{') >= 0) {
            throw new IllegalStateException("Unresolved token in SQL resource: " + name);
        }
        return sql;
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
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
