package com.reviewsearch.indexer.model;

import java.time.Instant;

/**
 * A review (or a reply to a review) on a review request.
 * Maps from: reviews_review
 *
 * <p>A non-null {@code baseReplyToId} makes this review a reply to another review.
 * {@code bodyTopReplyToId} / {@code bodyBottomReplyToId} point at the review whose
 * top or bottom body text this review answers. Non-public reviews are drafts.</p>
 */
public record Review(
        long id,
        long reviewRequestId,
        String username,
        boolean isPublic,
        Instant timestamp,
        Long baseReplyToId,
        Long bodyTopReplyToId,
        Long bodyBottomReplyToId,
        String bodyTop,
        String bodyBottom
) {

    public boolean isReply() {
        return baseReplyToId != null;
    }
}
