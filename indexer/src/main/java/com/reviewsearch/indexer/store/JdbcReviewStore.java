package com.reviewsearch.indexer.store;

import com.reviewsearch.indexer.model.Comment;
import com.reviewsearch.indexer.model.CommentJoinRow;
import com.reviewsearch.indexer.model.CommentKind;
import com.reviewsearch.indexer.model.DiffSet;
import com.reviewsearch.indexer.model.FileDiff;
import com.reviewsearch.indexer.model.Review;
import com.reviewsearch.indexer.model.ReviewRequest;
import com.reviewsearch.indexer.model.ReviewRequestStatus;
import com.reviewsearch.indexer.model.Submitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JDBC-backed {@link ReviewStore}.
 *
 * <p>All SQL lives in {@code .sql} files loaded via {@link SqlLoader}. A new
 * {@link Connection} is opened per operation and closed immediately after; the
 * indexer is a single-threaded batch job and issues a handful of queries per
 * review request.</p>
 *
 * <p>Timestamps are stored as epoch milliseconds.</p>
 */
public class JdbcReviewStore implements ReviewStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcReviewStore.class);

    private final String url;
    private final String user;
    private final String password;

    public JdbcReviewStore(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
        logger.info("JdbcReviewStore initialized for {}", url);
    }

    Connection getConnection() throws SQLException {
        if (user == null || user.isBlank()) {
            return DriverManager.getConnection(url);
        }
        return DriverManager.getConnection(url, user, password);
    }

    /**
     * Applies {@code schema.sql}. Every statement is {@code CREATE ... IF NOT EXISTS},
     * so this is safe to run against an existing database.
     */
    public void applySchema() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (in == null) {
                throw new IllegalStateException("schema.sql not found on classpath");
            }
            String schemaSql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            try (Connection conn = getConnection(); Statement stmt = conn.createStatement()) {
                conn.setAutoCommit(false);
                try {
                    for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                        String statement = stripComments(sql);
                        if (!statement.isEmpty()) {
                            stmt.execute(statement);
                        }
                    }
                    conn.commit();
                } catch (SQLException e) {
                    conn.rollback();
                    throw e;
                }
            }
            logger.info("Review schema applied to {}", url);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema.sql", e);
        } catch (SQLException e) {
            throw new ReviewStoreException("Schema application failed", e);
        }
    }

    private static String stripComments(String sql) {
        StringBuilder sb = new StringBuilder();
        for (String line : sql.split("\\r?\\n")) {
            if (!line.trim().startsWith("--")) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString().trim();
    }

    // =========================================================================
    // Review requests
    // =========================================================================

    @Override
    public List<ReviewRequest> fetchEligibleReviewRequests(Set<ReviewRequestStatus> statusIn,
                                                           Instant modifiedAfter) {
        if (statusIn.isEmpty()) {
            return List.of();
        }
        List<ReviewRequestStatus> statuses = new ArrayList<>(statusIn);
        String sql = SqlLoader.render("select-eligible-review-requests",
                Map.of("statuses", placeholders(statuses.size())));

        List<ReviewRequest> requests = new ArrayList<>();
        try (Connection conn = getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            int index = 1;
            for (ReviewRequestStatus status : statuses) {
                ps.setString(index++, status.code());
            }
            if (modifiedAfter != null) {
                ps.setLong(index++, modifiedAfter.toEpochMilli());
                ps.setLong(index, modifiedAfter.toEpochMilli());
            } else {
                ps.setNull(index++, Types.BIGINT);
                ps.setNull(index, Types.BIGINT);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    requests.add(mapReviewRequest(rs));
                }
            }
        } catch (SQLException e) {
            throw new ReviewStoreException("Failed to fetch eligible review requests", e);
        }
        logger.debug("Fetched {} review requests (statuses: {}, modified after: {})",
                requests.size(), statuses, modifiedAfter != null ? modifiedAfter : "any");
        return requests;
    }

    private ReviewRequest mapReviewRequest(ResultSet rs) throws SQLException {
        Submitter submitter = new Submitter(
                rs.getLong("user_id"),
                rs.getString("username"),
                rs.getString("first_name"),
                rs.getString("last_name"));
        return new ReviewRequest(
                rs.getLong("id"),
                submitter,
                ReviewRequestStatus.fromCode(rs.getString("status")),
                Instant.ofEpochMilli(rs.getLong("last_updated")),
                rs.getString("summary"),
                rs.getString("description"),
                rs.getString("testing_done"),
                rs.getString("bugs_closed"),
                nullableLong(rs, "changenum"),
                nullableLong(rs, "diffset_history_id"));
    }

    // =========================================================================
    // Reviews
    // =========================================================================

    @Override
    public List<Review> fetchReviews(long reviewRequestId) {
        List<Review> reviews = new ArrayList<>();
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-reviews-for-request"))) {
            ps.setLong(1, reviewRequestId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    reviews.add(new Review(
                            rs.getLong("id"),
                            rs.getLong("review_request_id"),
                            rs.getString("username"),
                            rs.getBoolean("public"),
                            Instant.ofEpochMilli(rs.getLong("timestamp")),
                            nullableLong(rs, "base_reply_to_id"),
                            nullableLong(rs, "body_top_reply_to_id"),
                            nullableLong(rs, "body_bottom_reply_to_id"),
                            rs.getString("body_top"),
                            rs.getString("body_bottom")));
                }
            }
        } catch (SQLException e) {
            throw new ReviewStoreException("Failed to fetch reviews for review request " + reviewRequestId, e);
        }
        return reviews;
    }

    // =========================================================================
    // Comments
    // =========================================================================

    @Override
    public List<CommentJoinRow> fetchCommentJoinRows(Collection<Long> reviewIds, CommentKind kind) {
        if (reviewIds.isEmpty()) {
            return List.of();
        }
        String sql = SqlLoader.render(kind.joinQuery(), Map.of(
                "review_ids", placeholders(reviewIds.size()),
                "order_by", String.join(", ", kind.ordering())));

        List<CommentJoinRow> rows = new ArrayList<>();
        try (Connection conn = getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            int index = 1;
            for (Long reviewId : reviewIds) {
                ps.setLong(index++, reviewId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Comment comment = new Comment(
                            rs.getLong("comment_id"),
                            nullableLong(rs, "filediff_id"),
                            nullableInt(rs, "first_line"),
                            Instant.ofEpochMilli(rs.getLong("timestamp")),
                            rs.getString("text"),
                            nullableLong(rs, "reply_to_id"));
                    rows.add(new CommentJoinRow(rs.getLong("join_id"), rs.getLong("review_id"), comment));
                }
            }
        } catch (SQLException e) {
            throw new ReviewStoreException("Failed to fetch " + kind.key() + " for "
                    + reviewIds.size() + " reviews", e);
        }
        return rows;
    }

    // =========================================================================
    // Diff history
    // =========================================================================

    @Override
    public List<DiffSet> fetchDiffSets(long reviewRequestId) {
        List<DiffSet> diffSets = new ArrayList<>();
        try (Connection conn = getConnection();
             PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-diffsets-for-request"))) {
            ps.setLong(1, reviewRequestId);
            try (ResultSet rs = ps.executeQuery()) {
                long currentId = -1;
                int currentRevision = 0;
                List<FileDiff> files = new ArrayList<>();
                while (rs.next()) {
                    long diffSetId = rs.getLong("diffset_id");
                    if (diffSetId != currentId) {
                        if (currentId != -1) {
                            diffSets.add(new DiffSet(currentId, currentRevision, Collections.unmodifiableList(files)));
                        }
                        currentId = diffSetId;
                        currentRevision = rs.getInt("revision");
                        files = new ArrayList<>();
                    }
                    Long fileDiffId = nullableLong(rs, "filediff_id");
                    if (fileDiffId != null) {
                        files.add(new FileDiff(fileDiffId, rs.getString("source_file"), rs.getString("dest_file")));
                    }
                }
                if (currentId != -1) {
                    diffSets.add(new DiffSet(currentId, currentRevision, Collections.unmodifiableList(files)));
                }
            }
        } catch (SQLException e) {
            throw new ReviewStoreException("Failed to fetch diff sets for review request " + reviewRequestId, e);
        }
        return diffSets;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
