package com.reviewsearch.indexer.orchestrator;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated summary of an index run.
 *
 * @param incremental whether the run only touched requests updated after {@code since}
 * @param since       the watermark the run started from, or null for a full rebuild
 */
public record IndexSummary(
        List<IndexResult> results,
        boolean incremental,
        Instant since,
        long totalDurationMs
) {

    public int successCount() {
        return (int) results.stream().filter(IndexResult::success).count();
    }

    public int failureCount() {
        return (int) results.stream().filter(r -> !r.success()).count();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(r -> !r.success());
    }

    public int indexedDocuments() {
        return (int) results.stream()
                .filter(r -> r.stage().equals(IndexOrchestrator.STAGE_DOCUMENT) && r.success())
                .count();
    }

    public int failedDocuments() {
        return (int) results.stream()
                .filter(r -> r.stage().equals(IndexOrchestrator.STAGE_DOCUMENT) && !r.success())
                .count();
    }

    public List<IndexResult> failures() {
        return results.stream().filter(r -> !r.success()).toList();
    }
}
