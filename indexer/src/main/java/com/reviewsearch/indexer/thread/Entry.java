package com.reviewsearch.indexer.thread;

import com.reviewsearch.indexer.model.CommentKind;
import com.reviewsearch.indexer.model.Review;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One top-level public review with everything hanging off it: the reviews replying
 * to it, and its top-level comments grouped by {@link CommentKind}.
 *
 * <p>Entries are rebuilt on every index run and have no identity of their own.</p>
 */
public final class Entry {

    private final ReviewNode review;
    private final List<Review> replies;
    private final Instant lastReplyTimestamp;
    private final Map<CommentKind, List<CommentNode>> comments = new LinkedHashMap<>();

    Entry(ReviewNode review, List<CommentKind> kinds, List<Review> replies, Instant lastReplyTimestamp) {
        this.review = review;
        this.replies = List.copyOf(replies);
        this.lastReplyTimestamp = lastReplyTimestamp;
        for (CommentKind kind : kinds) {
            comments.put(kind, new ArrayList<>());
        }
    }

    public ReviewNode review() {
        return review;
    }

    public Instant timestamp() {
        return review.review().timestamp();
    }

    /**
     * Public reviews whose base reply target is this entry's review, in fetch order.
     */
    public List<Review> replies() {
        return replies;
    }

    /**
     * Latest timestamp among {@link #replies()}, or null when there are none.
     */
    public Instant lastReplyTimestamp() {
        return lastReplyTimestamp;
    }

    /**
     * Top-level comments of the given kind, in fetch order. Empty for an unregistered kind.
     */
    public List<CommentNode> comments(CommentKind kind) {
        List<CommentNode> bucket = comments.get(kind);
        return bucket != null ? Collections.unmodifiableList(bucket) : List.of();
    }

    /**
     * All comment buckets in kind registration order.
     */
    public Map<CommentKind, List<CommentNode>> commentsByKind() {
        Map<CommentKind, List<CommentNode>> view = new LinkedHashMap<>();
        comments.forEach((kind, bucket) -> view.put(kind, Collections.unmodifiableList(bucket)));
        return Collections.unmodifiableMap(view);
    }

    void addComment(CommentKind kind, CommentNode comment) {
        comments.get(kind).add(comment);
    }
}
