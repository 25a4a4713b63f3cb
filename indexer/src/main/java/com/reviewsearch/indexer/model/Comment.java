package com.reviewsearch.indexer.model;

import java.time.Instant;

/**
 * An inline comment. A non-null {@code replyToId} makes it a reply to another comment.
 * Maps from: reviews_comment
 */
public record Comment(
        long id,
        Long fileDiffId,
        Integer firstLine,
        Instant timestamp,
        String text,
        Long replyToId
) {

    public boolean isReply() {
        return replyToId != null;
    }
}
