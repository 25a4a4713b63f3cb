package com.reviewsearch.indexer.orchestrator;

/**
 * Outcome of one step of an index run: opening the backend, listing review requests,
 * indexing a single review request, or finalizing the index.
 * {@code reviewRequestId} is null for steps that are not about one request.
 */
public record IndexResult(
        String stage,
        Long reviewRequestId,
        boolean success,
        String errorMessage,
        long durationMs
) {

    public static IndexResult success(String stage, Long reviewRequestId, long durationMs) {
        return new IndexResult(stage, reviewRequestId, true, null, durationMs);
    }

    public static IndexResult failure(String stage, Long reviewRequestId,
                                      String error, long durationMs) {
        return new IndexResult(stage, reviewRequestId, false, error, durationMs);
    }
}
