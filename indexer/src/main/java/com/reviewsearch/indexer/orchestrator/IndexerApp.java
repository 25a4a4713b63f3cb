package com.reviewsearch.indexer.orchestrator;

import com.reviewsearch.indexer.backend.LuceneSearchBackend;
import com.reviewsearch.indexer.backend.SearchBackend;
import com.reviewsearch.indexer.backend.SolrSearchBackend;
import com.reviewsearch.indexer.config.AppConfig;
import com.reviewsearch.indexer.store.JdbcReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the review search indexer.
 * Parses CLI arguments, wires the store and search backend from configuration,
 * runs one index pass and exits with an appropriate status code.
 *
 * <p>Usage:
 * <pre>
 *   java -jar indexer.jar            # default: incremental, since the last run
 *   java -jar indexer.jar --full     # rebuild the index from scratch
 * </pre>
 */
public class IndexerApp {

    private static final Logger logger = LoggerFactory.getLogger(IndexerApp.class);

    public static void main(String[] args) {
        boolean fullMode = parseFullMode(args);
        logger.info("Starting review search indexer (mode: {})", fullMode ? "FULL" : "INCREMENTAL");

        try {
            AppConfig config = new AppConfig();
            if (!config.isSearchEnabled()) {
                System.err.println("Search is currently disabled. Set SEARCH_ENABLE=true to build the index.");
                logger.error("Search is disabled; nothing indexed");
                System.exit(1);
            }

            JdbcReviewStore store = new JdbcReviewStore(
                    config.getDatabaseUrl(), config.getDatabaseUser(), config.getDatabasePassword());
            SearchBackend backend = createBackend(config);
            WatermarkFile watermark = WatermarkFile.in(config.getSearchIndexDir());

            IndexOrchestrator orchestrator = new IndexOrchestrator(store, backend, watermark);
            IndexSummary summary = orchestrator.run(fullMode);

            printSummary(summary);

            if (summary.hasFailures()) {
                logger.warn("Index run completed with failures");
                System.exit(1);
            }

            logger.info("Review search indexer finished successfully.");
            System.exit(0);

        } catch (Exception e) {
            logger.error("Fatal error during indexing", e);
            System.exit(1);
        }
    }

    static boolean parseFullMode(String[] args) {
        for (String arg : args) {
            if ("--full".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static SearchBackend createBackend(AppConfig config) {
        if (AppConfig.BACKEND_SOLR.equals(config.getSearchBackend())) {
            return new SolrSearchBackend(config.getSolrUrl());
        }
        return new LuceneSearchBackend(config.getSearchIndexDir());
    }

    private static void printSummary(IndexSummary summary) {
        System.out.println();
        System.out.println("=== Review Search Index Summary ===");
        System.out.println("Mode:      " + (summary.incremental() ? "incremental since " + summary.since() : "full"));
        System.out.println("Duration:  " + summary.totalDurationMs() + "ms");
        System.out.printf("Documents: %d indexed, %d failed%n",
                summary.indexedDocuments(), summary.failedDocuments());

        if (summary.hasFailures()) {
            System.out.println();
            System.out.println("Failures:");
            summary.failures().forEach(r -> System.out.println("  - " + r.stage()
                    + (r.reviewRequestId() != null ? " [#" + r.reviewRequestId() + "]" : "")
                    + ": " + r.errorMessage()));
        }
        System.out.println();
    }
}
