package com.reviewsearch.indexer.model;

import java.util.List;

/**
 * A kind of comment that can be attached to a review, e.g. inline diff comments.
 *
 * <p>{@code joinQuery} names the SQL resource that selects the kind's join rows,
 * and {@code ordering} lists the columns those rows are sorted by. The ordering
 * fixes the order comments appear in the indexed text.</p>
 */
public record CommentKind(
        String key,
        String joinQuery,
        List<String> ordering
) {

    public static final CommentKind DIFF_COMMENTS = new CommentKind(
            "diff_comments",
            "select-diff-comment-joins",
            List.of("c.filediff_id", "c.first_line", "c.timestamp"));

    public CommentKind {
        ordering = List.copyOf(ordering);
    }
}
