package com.reviewsearch.indexer.model;

/**
 * One row of the many-to-many relation between reviews and comments, with the
 * comment already loaded.
 */
public record CommentJoinRow(
        long id,
        long reviewId,
        Comment comment
) {}
