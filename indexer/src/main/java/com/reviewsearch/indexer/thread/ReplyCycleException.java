package com.reviewsearch.indexer.thread;

/**
 * Thrown when a comment's reply chain leads back to a comment already visited.
 * This is a data-integrity fault in the review database.
 */
public class ReplyCycleException extends RuntimeException {

    private final long commentId;

    public ReplyCycleException(long commentId) {
        super("Reply cycle detected at comment " + commentId);
        this.commentId = commentId;
    }

    public long getCommentId() {
        return commentId;
    }
}
