package com.reviewsearch.indexer.thread;

import com.reviewsearch.indexer.model.Comment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A comment in a reconstructed thread, with its direct replies in fetch order.
 *
 * <p>The owning review and review request id are attached while reconstructing, as
 * context within one reconstruction pass. They are never persisted.</p>
 */
public final class CommentNode {

    private final Comment comment;
    private final List<CommentNode> replies = new ArrayList<>();
    private ReviewNode review;
    private long reviewRequestId;

    CommentNode(Comment comment) {
        this.comment = comment;
    }

    public Comment comment() {
        return comment;
    }

    public long id() {
        return comment.id();
    }

    public String text() {
        return comment.text();
    }

    public List<CommentNode> replies() {
        return Collections.unmodifiableList(replies);
    }

    public ReviewNode review() {
        return review;
    }

    public long reviewRequestId() {
        return reviewRequestId;
    }

    void attach(ReviewNode review, long reviewRequestId) {
        this.review = review;
        this.reviewRequestId = reviewRequestId;
    }

    /**
     * Adds a direct reply. A comment linked to several reviews shows up in several
     * join rows; it is only added once.
     */
    void addReply(CommentNode reply) {
        for (CommentNode existing : replies) {
            if (existing.id() == reply.id()) {
                return;
            }
        }
        replies.add(reply);
    }
}
