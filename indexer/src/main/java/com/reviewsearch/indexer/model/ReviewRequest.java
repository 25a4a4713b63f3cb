package com.reviewsearch.indexer.model;

import java.time.Instant;

/**
 * A review request row joined with its submitter.
 * Maps from: reviews_reviewrequest + auth_user
 *
 * <p>{@code bugsClosed} is the raw comma-separated bug list as entered by the
 * submitter. {@code changeNumber} and {@code diffsetHistoryId} are nullable.</p>
 */
public record ReviewRequest(
        long id,
        Submitter submitter,
        ReviewRequestStatus status,
        Instant lastUpdated,
        String summary,
        String description,
        String testingDone,
        String bugsClosed,
        Long changeNumber,
        Long diffsetHistoryId
) {

    public boolean hasChangeNumber() {
        return changeNumber != null && changeNumber != 0;
    }
}
