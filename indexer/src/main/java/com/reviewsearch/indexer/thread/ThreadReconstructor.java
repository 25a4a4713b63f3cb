package com.reviewsearch.indexer.thread;

import com.reviewsearch.indexer.model.CommentJoinRow;
import com.reviewsearch.indexer.model.CommentKind;
import com.reviewsearch.indexer.model.Review;
import com.reviewsearch.indexer.model.ReviewRequest;
import com.reviewsearch.indexer.store.ReviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Rebuilds the discussion tree of a review request from flat rows.
 *
 * <p>Issues one query for the request's reviews and one join-row query per registered
 * {@link CommentKind}, then links everything in memory through id maps. The number of
 * queries does not depend on how many reviews or comments the request has.</p>
 *
 * <p>Linking rules:
 * <ul>
 *   <li>Draft (non-public) reviews are ignored entirely.</li>
 *   <li>A public review without a base reply target becomes an {@link Entry}, in fetch order.</li>
 *   <li>A comment with a reply target is nested under that target. If the target was not
 *       fetched, the comment is dropped.</li>
 *   <li>A comment without a reply target is listed on its review's entry, unless that review
 *       is itself a reply, in which case the comment is an orphan and is dropped.</li>
 * </ul>
 */
public class ThreadReconstructor {

    private static final Logger logger = LoggerFactory.getLogger(ThreadReconstructor.class);

    private final ReviewStore store;
    private final List<CommentKind> commentKinds;

    public ThreadReconstructor(ReviewStore store) {
        this(store, List.of(CommentKind.DIFF_COMMENTS));
    }

    public ThreadReconstructor(ReviewStore store, List<CommentKind> commentKinds) {
        this.store = store;
        this.commentKinds = List.copyOf(commentKinds);
    }

    /**
     * Reconstructs the entries of a review request.
     *
     * @param request the review request
     * @return one entry per top-level public review, in fetch order; empty if there are none
     */
    public List<Entry> reconstruct(ReviewRequest request) {
        List<Review> allReviews = store.fetchReviews(request.id());

        Map<Long, ReviewNode> reviewsById = new LinkedHashMap<>();
        Map<Long, List<Review>> repliesByParentId = new HashMap<>();
        Map<Long, Instant> replyTimestamps = new HashMap<>();
        Map<Long, List<Review>> bodyTopReplies = new HashMap<>();
        Map<Long, List<Review>> bodyBottomReplies = new HashMap<>();

        for (Review review : allReviews) {
            if (!review.isPublic()) {
                continue;
            }
            reviewsById.put(review.id(), new ReviewNode(review));

            if (review.isReply()) {
                repliesByParentId.computeIfAbsent(review.baseReplyToId(), id -> new ArrayList<>()).add(review);
                if (review.timestamp() != null) {
                    replyTimestamps.merge(review.baseReplyToId(), review.timestamp(), ThreadReconstructor::latest);
                }
            }
            if (review.bodyTopReplyToId() != null) {
                bodyTopReplies.computeIfAbsent(review.bodyTopReplyToId(), id -> new ArrayList<>()).add(review);
            }
            if (review.bodyBottomReplyToId() != null) {
                bodyBottomReplies.computeIfAbsent(review.bodyBottomReplyToId(), id -> new ArrayList<>()).add(review);
            }
        }

        Map<Long, Entry> entriesByReviewId = new LinkedHashMap<>();
        for (ReviewNode node : reviewsById.values()) {
            if (!node.review().isReply()) {
                entriesByReviewId.put(node.id(), new Entry(node, commentKinds,
                        repliesByParentId.getOrDefault(node.id(), List.of()),
                        replyTimestamps.get(node.id())));
            }
        }

        linkBodyReplies(reviewsById, bodyTopReplies, ReviewNode::setBodyTopReplies);
        linkBodyReplies(reviewsById, bodyBottomReplies, ReviewNode::setBodyBottomReplies);

        if (reviewsById.isEmpty()) {
            logger.debug("Review request #{} has no public reviews", request.id());
            return List.of();
        }

        for (CommentKind kind : commentKinds) {
            attachComments(request, kind, reviewsById, entriesByReviewId);
        }

        logger.debug("Reconstructed {} entries from {} public reviews for review request #{}",
                entriesByReviewId.size(), reviewsById.size(), request.id());
        return List.copyOf(entriesByReviewId.values());
    }

    private static void linkBodyReplies(Map<Long, ReviewNode> reviewsById,
                                        Map<Long, List<Review>> repliesByTargetId,
                                        BiConsumer<ReviewNode, List<Review>> setter) {
        for (Map.Entry<Long, List<Review>> replies : repliesByTargetId.entrySet()) {
            ReviewNode target = reviewsById.get(replies.getKey());
            if (target != null) {
                setter.accept(target, replies.getValue());
            }
        }
    }

    private void attachComments(ReviewRequest request, CommentKind kind,
                                Map<Long, ReviewNode> reviewsById,
                                Map<Long, Entry> entriesByReviewId) {
        List<CommentJoinRow> rows = store.fetchCommentJoinRows(reviewsById.keySet(), kind);

        // First pass: one node per comment, so replies can find their targets
        // regardless of row order.
        Map<Long, CommentNode> commentsById = new HashMap<>();
        for (CommentJoinRow row : rows) {
            commentsById.putIfAbsent(row.comment().id(), new CommentNode(row.comment()));
        }

        int dropped = 0;
        for (CommentJoinRow row : rows) {
            CommentNode comment = commentsById.get(row.comment().id());
            ReviewNode parentReview = reviewsById.get(row.reviewId());
            if (parentReview == null) {
                dropped++;
                continue;
            }
            comment.attach(parentReview, request.id());

            if (comment.comment().isReply()) {
                CommentNode target = commentsById.get(comment.comment().replyToId());
                if (target == null) {
                    logger.debug("Dropping comment {} on review {}: reply target {} not found",
                            comment.id(), row.reviewId(), comment.comment().replyToId());
                    dropped++;
                    continue;
                }
                target.addReply(comment);
            } else if (parentReview.review().isReply()) {
                logger.debug("Dropping orphaned comment {} on reply review {}", comment.id(), row.reviewId());
                dropped++;
            } else {
                entriesByReviewId.get(row.reviewId()).addComment(kind, comment);
            }
        }

        if (dropped > 0) {
            logger.debug("Dropped {} of {} {} rows for review request #{}",
                    dropped, rows.size(), kind.key(), request.id());
        }
    }

    private static Instant latest(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
