package com.reviewsearch.indexer.thread;

import com.reviewsearch.indexer.model.Review;

import java.util.List;

/**
 * A public review together with the reviews that reply to its top and bottom body text.
 * Every public review of a request gets a node, top-level or not, so the reply lists
 * are always present (possibly empty).
 */
public final class ReviewNode {

    private final Review review;
    private List<Review> bodyTopReplies = List.of();
    private List<Review> bodyBottomReplies = List.of();

    ReviewNode(Review review) {
        this.review = review;
    }

    public Review review() {
        return review;
    }

    public long id() {
        return review.id();
    }

    public List<Review> bodyTopReplies() {
        return bodyTopReplies;
    }

    public List<Review> bodyBottomReplies() {
        return bodyBottomReplies;
    }

    void setBodyTopReplies(List<Review> replies) {
        this.bodyTopReplies = List.copyOf(replies);
    }

    void setBodyBottomReplies(List<Review> replies) {
        this.bodyBottomReplies = List.copyOf(replies);
    }
}
