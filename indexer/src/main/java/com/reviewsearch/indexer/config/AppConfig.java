package com.reviewsearch.indexer.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration read from environment variables, falling back to a {@code .env} file
 * via dotenv-java. Validates required variables on startup.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    public static final String BACKEND_LUCENE = "lucene";
    public static final String BACKEND_SOLR = "solr";

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");

    private final boolean searchEnabled;
    private final String searchIndexDir;
    private final String databaseUrl;
    private final String databaseUser;
    private final String databasePassword;
    private final String searchBackend;
    private final String solrUrl;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        this.searchEnabled = parseFlag(resolveOptional(dotenv, "SEARCH_ENABLE"));
        this.searchIndexDir = resolve(dotenv, "SEARCH_INDEX_DIR");
        this.databaseUrl = resolve(dotenv, "DATABASE_URL");
        this.databaseUser = resolveOptional(dotenv, "DATABASE_USER");
        this.databasePassword = resolveOptional(dotenv, "DATABASE_PASSWORD");
        this.searchBackend = normalizeBackend(resolveOptional(dotenv, "SEARCH_BACKEND"));
        this.solrUrl = resolveOptional(dotenv, "SOLR_URL");

        validate();

        logger.info("Configuration loaded: searchEnabled={}, backend={}, indexDir={}, database={}",
                searchEnabled, searchBackend, searchIndexDir, databaseUrl);
    }

    /**
     * Constructor for testing: accepts values directly.
     */
    public AppConfig(boolean searchEnabled, String searchIndexDir, String databaseUrl,
                     String databaseUser, String databasePassword,
                     String searchBackend, String solrUrl) {
        this.searchEnabled = searchEnabled;
        this.searchIndexDir = searchIndexDir;
        this.databaseUrl = databaseUrl;
        this.databaseUser = databaseUser;
        this.databasePassword = databasePassword;
        this.searchBackend = normalizeBackend(searchBackend);
        this.solrUrl = solrUrl;

        validate();
    }

    private void validate() {
        StringBuilder missing = new StringBuilder();
        if (isBlank(searchIndexDir)) missing.append("SEARCH_INDEX_DIR ");
        if (isBlank(databaseUrl)) missing.append("DATABASE_URL ");
        if (BACKEND_SOLR.equals(searchBackend) && isBlank(solrUrl)) missing.append("SOLR_URL ");

        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required environment variables: " + missing.toString().trim());
        }

        if (!BACKEND_LUCENE.equals(searchBackend) && !BACKEND_SOLR.equals(searchBackend)) {
            throw new IllegalStateException("Unsupported SEARCH_BACKEND: " + searchBackend
                    + " (expected " + BACKEND_LUCENE + " or " + BACKEND_SOLR + ")");
        }
    }

    private static String resolve(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        String dotenvValue = dotenv.get(key);
        return dotenvValue != null ? dotenvValue : "";
    }

    private static String resolveOptional(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return dotenv.get(key);
    }

    static boolean parseFlag(String value) {
        return value != null && TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private static String normalizeBackend(String value) {
        return isBlank(value) ? BACKEND_LUCENE : value.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public boolean isSearchEnabled() {
        return searchEnabled;
    }

    public Path getSearchIndexDir() {
        return Path.of(searchIndexDir);
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public String getDatabaseUser() {
        return databaseUser;
    }

    public String getDatabasePassword() {
        return databasePassword;
    }

    public String getSearchBackend() {
        return searchBackend;
    }

    public String getSolrUrl() {
        return solrUrl;
    }
}
