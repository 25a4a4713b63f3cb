package com.reviewsearch.indexer.orchestrator;

import com.reviewsearch.indexer.backend.IndexWriterSession;
import com.reviewsearch.indexer.backend.SearchBackend;
import com.reviewsearch.indexer.document.IndexDocument;
import com.reviewsearch.indexer.document.IndexFields;
import com.reviewsearch.indexer.document.ReviewRequestDocumentBuilder;
import com.reviewsearch.indexer.model.DiffSet;
import com.reviewsearch.indexer.model.ReviewRequest;
import com.reviewsearch.indexer.model.ReviewRequestStatus;
import com.reviewsearch.indexer.store.ReviewStore;
import com.reviewsearch.indexer.thread.Entry;
import com.reviewsearch.indexer.thread.ReplyCycleException;
import com.reviewsearch.indexer.thread.ThreadReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one indexing pass: reads the watermark, opens the search backend, then reconstructs,
 * flattens and writes one document per eligible review request.
 *
 * <p>A failure on one review request is recorded and logged; the batch continues. Failures that
 * make the whole run meaningless (backend unavailable, request list unreadable) end the run early
 * with a single failure result.</p>
 */
public class IndexOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(IndexOrchestrator.class);

    static final String STAGE_INFRASTRUCTURE = "infrastructure";
    static final String STAGE_REVIEW_REQUESTS = "review_requests";
    static final String STAGE_DOCUMENT = "documents";
    static final String STAGE_COMMIT = "commit";

    static final Set<ReviewRequestStatus> ELIGIBLE_STATUSES =
            EnumSet.of(ReviewRequestStatus.PENDING, ReviewRequestStatus.SUBMITTED);

    private final ReviewStore store;
    private final SearchBackend backend;
    private final WatermarkFile watermark;
    private final ThreadReconstructor reconstructor;
    private final ReviewRequestDocumentBuilder documentBuilder;
    private final Clock clock;

    public IndexOrchestrator(ReviewStore store, SearchBackend backend, WatermarkFile watermark) {
        this(store, backend, watermark, new ThreadReconstructor(store),
                new ReviewRequestDocumentBuilder(), Clock.systemUTC());
    }

    // Visible for testing
    IndexOrchestrator(ReviewStore store, SearchBackend backend, WatermarkFile watermark,
                      ThreadReconstructor reconstructor, ReviewRequestDocumentBuilder documentBuilder,
                      Clock clock) {
        this.store = store;
        this.backend = backend;
        this.watermark = watermark;
        this.reconstructor = reconstructor;
        this.documentBuilder = documentBuilder;
        this.clock = clock;
    }

    /**
     * Runs the indexer.
     *
     * @param fullMode if true, rebuilds the index from scratch; otherwise only review requests
     *                 updated since the last run are re-indexed
     * @return summary of all results
     */
    public IndexSummary run(boolean fullMode) {
        Instant runStart = clock.instant();

        Instant since = null;
        if (!fullMode) {
            Optional<Instant> last = watermark.read();
            if (last.isPresent()) {
                since = last.get();
            } else {
                logger.warn("No usable watermark at {}; falling back to a full rebuild", watermark.path());
            }
        }
        boolean incremental = since != null;
        logger.info("Starting {} index run on {} backend{}", incremental ? "INCREMENTAL" : "FULL",
                backend.name(), incremental ? " (since " + since + ")" : "");

        List<IndexResult> results = new ArrayList<>();

        IndexWriterSession session;
        try {
            session = backend.open(!incremental);
        } catch (Exception e) {
            logger.error("Failed to open {} search backend", backend.name(), e);
            results.add(IndexResult.failure(STAGE_INFRASTRUCTURE, null, e.getMessage(), elapsed(runStart)));
            return new IndexSummary(results, incremental, since, elapsed(runStart));
        }

        try (IndexWriterSession writer = session) {
            List<ReviewRequest> requests;
            long stepStart = System.currentTimeMillis();
            try {
                requests = store.fetchEligibleReviewRequests(ELIGIBLE_STATUSES, since);
                results.add(IndexResult.success(STAGE_REVIEW_REQUESTS, null,
                        System.currentTimeMillis() - stepStart));
            } catch (Exception e) {
                logger.error("Failed to fetch eligible review requests", e);
                results.add(IndexResult.failure(STAGE_REVIEW_REQUESTS, null,
                        e.getMessage(), System.currentTimeMillis() - stepStart));
                return finish(results, incremental, since, runStart);
            }
            logger.info("{} review requests to index", requests.size());

            // Written before processing: requests updated while this run is in progress are picked up
            // by the next one, at the cost of re-indexing some twice.
            try {
                watermark.write(runStart);
            } catch (Exception e) {
                logger.error("Failed to write watermark {}", watermark.path(), e);
            }

            for (ReviewRequest request : requests) {
                results.add(indexOne(writer, request, incremental));
            }

            stepStart = System.currentTimeMillis();
            try {
                writer.optimize();
                writer.commit();
                results.add(IndexResult.success(STAGE_COMMIT, null, System.currentTimeMillis() - stepStart));
            } catch (Exception e) {
                logger.error("Failed to commit {} index", backend.name(), e);
                results.add(IndexResult.failure(STAGE_COMMIT, null,
                        e.getMessage(), System.currentTimeMillis() - stepStart));
            }
        } catch (Exception e) {
            logger.error("Failed to close {} index writer", backend.name(), e);
            results.add(IndexResult.failure(STAGE_COMMIT, null, e.getMessage(), 0));
        }

        return finish(results, incremental, since, runStart);
    }

    private IndexResult indexOne(IndexWriterSession writer, ReviewRequest request, boolean incremental) {
        long start = System.currentTimeMillis();
        try {
            List<Entry> entries = reconstructor.reconstruct(request);
            List<DiffSet> diffSets = store.fetchDiffSets(request.id());
            IndexDocument document = documentBuilder.build(request, entries, diffSets);

            if (incremental) {
                writer.deleteDocument(IndexFields.ID, document.id());
            }
            writer.addDocument(document);

            logger.debug("Indexed review request #{} ({} entries, {} diff sets)",
                    request.id(), entries.size(), diffSets.size());
            return IndexResult.success(STAGE_DOCUMENT, request.id(), System.currentTimeMillis() - start);
        } catch (ReplyCycleException e) {
            logger.error("Error indexing ReviewRequest #{}: reply cycle at comment {}",
                    request.id(), e.getCommentId());
            return IndexResult.failure(STAGE_DOCUMENT, request.id(), e.getMessage(),
                    System.currentTimeMillis() - start);
        } catch (Exception e) {
            logger.error("Error indexing ReviewRequest #{}: {}", request.id(), e.getMessage(), e);
            return IndexResult.failure(STAGE_DOCUMENT, request.id(), e.getMessage(),
                    System.currentTimeMillis() - start);
        }
    }

    private IndexSummary finish(List<IndexResult> results, boolean incremental, Instant since, Instant runStart) {
        IndexSummary summary = new IndexSummary(results, incremental, since, elapsed(runStart));
        logSummary(summary);
        return summary;
    }

    private void logSummary(IndexSummary summary) {
        logger.info("=== Index Summary ===");
        logger.info("Mode: {}", summary.incremental() ? "incremental since " + summary.since() : "full");
        logger.info("Total duration: {}ms", summary.totalDurationMs());
        logger.info("Documents: {} indexed, {} failed",
                summary.indexedDocuments(), summary.failedDocuments());

        if (summary.hasFailures()) {
            logger.warn("Index run completed with {} failures", summary.failureCount());
            summary.failures().forEach(r -> logger.warn("  FAILED: {} [{}]: {}",
                    r.stage(), r.reviewRequestId() != null ? "#" + r.reviewRequestId() : "all",
                    r.errorMessage()));
        }
    }

    private long elapsed(Instant start) {
        return clock.instant().toEpochMilli() - start.toEpochMilli();
    }
}
