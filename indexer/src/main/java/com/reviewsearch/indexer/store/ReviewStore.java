package com.reviewsearch.indexer.store;

import com.reviewsearch.indexer.model.CommentJoinRow;
import com.reviewsearch.indexer.model.CommentKind;
import com.reviewsearch.indexer.model.DiffSet;
import com.reviewsearch.indexer.model.Review;
import com.reviewsearch.indexer.model.ReviewRequest;
import com.reviewsearch.indexer.model.ReviewRequestStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Bulk read access to the review database. Every method is a single query;
 * callers never walk relations row by row.
 *
 * @see JdbcReviewStore
 */
public interface ReviewStore {

    /**
     * Review requests in one of the given statuses, ordered by id.
     *
     * @param statusIn      statuses to include
     * @param modifiedAfter if non-null, only requests updated strictly after this instant
     */
    List<ReviewRequest> fetchEligibleReviewRequests(Set<ReviewRequestStatus> statusIn, Instant modifiedAfter);

    /**
     * All reviews of a review request, drafts included, ordered by timestamp then id.
     */
    List<Review> fetchReviews(long reviewRequestId);

    /**
     * Join rows linking the given reviews to comments of one kind, sorted by the
     * kind's ordering columns. Returns an empty list for an empty id set.
     */
    List<CommentJoinRow> fetchCommentJoinRows(Collection<Long> reviewIds, CommentKind kind);

    /**
     * The diff history of a review request, ordered by revision, with file diffs in id order.
     */
    List<DiffSet> fetchDiffSets(long reviewRequestId);
}
