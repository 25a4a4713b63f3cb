package com.reviewsearch.indexer.thread;

import com.reviewsearch.indexer.model.*;
import com.reviewsearch.indexer.store.ReviewStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ThreadReconstructor}: linking of reviews, body replies and
 * comment reply chains from flat rows, with the store mocked.
 */
@ExtendWith(MockitoExtension.class)
class ThreadReconstructorTest {

    private static final long REQUEST_ID = 42L;
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ReviewStore store;

    private ThreadReconstructor reconstructor;
    private ReviewRequest request;

    @BeforeEach
    void setUp() {
        reconstructor = new ThreadReconstructor(store);
        request = new ReviewRequest(REQUEST_ID, new Submitter(1, "alice", "Alice", "Smith"),
                ReviewRequestStatus.PENDING, T0, "Fix parser", "", "", "", null, null);
    }

    // =========================================================================
    // Review linking
    // =========================================================================

    @Test
    @DisplayName("One top-level review with N public replies yields one entry with N replies in fetch order")
    void topLevelWithReplies() {
        Review top = review(1, null, true, 0);
        Review r1 = reply(2, 1, 10);
        Review r2 = reply(3, 1, 20);
        Review r3 = reply(4, 1, 5);
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(top, r1, r2, r3));
        when(store.fetchCommentJoinRows(anyCollection(), eq(CommentKind.DIFF_COMMENTS))).thenReturn(List.of());

        List<Entry> entries = reconstructor.reconstruct(request);

        assertEquals(1, entries.size());
        Entry entry = entries.get(0);
        assertEquals(1L, entry.review().id());
        assertEquals(List.of(r1, r2, r3), entry.replies());
        assertEquals(T0.plusSeconds(20), entry.lastReplyTimestamp());
    }

    @Test
    @DisplayName("Entries follow fetch order and replies never become entries")
    void entriesInFetchOrder() {
        Review a = review(7, null, true, 0);
        Review replyToA = reply(8, 7, 1);
        Review b = review(3, null, true, 2);
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(a, replyToA, b));
        when(store.fetchCommentJoinRows(anyCollection(), any())).thenReturn(List.of());

        List<Entry> entries = reconstructor.reconstruct(request);

        assertEquals(List.of(7L, 3L), entries.stream().map(e -> e.review().id()).toList());
        assertNull(entries.get(1).lastReplyTimestamp());
        assertTrue(entries.get(1).replies().isEmpty());
    }

    @Test
    @DisplayName("Body-top and body-bottom replies are attached to their target review")
    void bodyRepliesAttached() {
        Review top = review(1, null, true, 0);
        Review topReply = new Review(2, REQUEST_ID, "bob", true, T0.plusSeconds(1),
                1L, 1L, null, "re: top", "");
        Review bottomReply = new Review(3, REQUEST_ID, "carol", true, T0.plusSeconds(2),
                1L, null, 1L, "", "re: bottom");
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(top, topReply, bottomReply));
        when(store.fetchCommentJoinRows(anyCollection(), any())).thenReturn(List.of());

        ReviewNode node = reconstructor.reconstruct(request).get(0).review();

        assertEquals(List.of(topReply), node.bodyTopReplies());
        assertEquals(List.of(bottomReply), node.bodyBottomReplies());
    }

    @Test
    @DisplayName("Draft reviews are ignored as entries, as replies and in the comment fetch")
    void draftsExcluded() {
        Review top = review(1, null, true, 0);
        Review draftTop = review(2, null, false, 1);
        Review draftReply = new Review(3, REQUEST_ID, "bob", false, T0.plusSeconds(2),
                1L, 1L, null, "draft", "");
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(top, draftTop, draftReply));
        when(store.fetchCommentJoinRows(anyCollection(), any())).thenReturn(List.of());

        List<Entry> entries = reconstructor.reconstruct(request);

        assertEquals(1, entries.size());
        assertTrue(entries.get(0).replies().isEmpty());
        assertTrue(entries.get(0).review().bodyTopReplies().isEmpty());
        assertNull(entries.get(0).lastReplyTimestamp());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<Long>> ids = ArgumentCaptor.forClass(Collection.class);
        verify(store).fetchCommentJoinRows(ids.capture(), eq(CommentKind.DIFF_COMMENTS));
        assertEquals(List.of(1L), new ArrayList<>(ids.getValue()));
    }

    @Test
    @DisplayName("A request without public reviews yields no entries and no comment query")
    void noPublicReviews() {
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(review(1, null, false, 0)));

        assertTrue(reconstructor.reconstruct(request).isEmpty());
        verify(store, never()).fetchCommentJoinRows(anyCollection(), any());
    }

    @Test
    @DisplayName("A request without any reviews yields an empty list")
    void noReviews() {
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of());

        assertTrue(reconstructor.reconstruct(request).isEmpty());
    }

    // =========================================================================
    // Comment linking
    // =========================================================================

    @Test
    @DisplayName("Reconstruction issues exactly two queries regardless of size")
    void exactlyTwoQueries() {
        List<Review> reviews = new ArrayList<>();
        List<CommentJoinRow> rows = new ArrayList<>();
        for (long i = 1; i <= 20; i++) {
            reviews.add(review(i, null, true, i));
            rows.add(row(i, i, comment(100 + i, null, "c" + i)));
        }
        when(store.fetchReviews(REQUEST_ID)).thenReturn(reviews);
        when(store.fetchCommentJoinRows(anyCollection(), any())).thenReturn(rows);

        List<Entry> entries = reconstructor.reconstruct(request);

        assertEquals(20, entries.size());
        entries.forEach(e -> assertEquals(1, e.comments(CommentKind.DIFF_COMMENTS).size()));
        verify(store, times(1)).fetchReviews(REQUEST_ID);
        verify(store, times(1)).fetchCommentJoinRows(anyCollection(), eq(CommentKind.DIFF_COMMENTS));
        verifyNoMoreInteractions(store);
    }

    @Test
    @DisplayName("Comment replies nest under their target and are never top-level")
    void commentRepliesNested() {
        Review top = review(1, null, true, 0);
        Review replyReview = reply(2, 1, 10);
        Comment root = comment(100, null, "Why not use a map?");
        Comment answer = comment(101, 100L, "Fixed.");
        Comment followUp = comment(102, 100L, "Thanks");
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(top, replyReview));
        // reply rows first: linking must not depend on row order
        when(store.fetchCommentJoinRows(anyCollection(), any())).thenReturn(List.of(
                row(1, 2, answer), row(2, 1, root), row(3, 2, followUp)));

        List<Entry> entries = reconstructor.reconstruct(request);

        List<CommentNode> topLevel = entries.get(0).comments(CommentKind.DIFF_COMMENTS);
        assertEquals(1, topLevel.size());
        CommentNode rootNode = topLevel.get(0);
        assertEquals(100L, rootNode.id());
        assertEquals(List.of(101L, 102L), rootNode.replies().stream().map(CommentNode::id).toList());
        assertEquals(2L, rootNode.replies().get(0).review().id());
        assertEquals(REQUEST_ID, rootNode.reviewRequestId());
    }

    @Test
    @DisplayName("A reply whose target was not fetched is dropped, not errored")
    void replyToMissingTargetDropped() {
        Review top = review(1, null, true, 0);
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(top));
        when(store.fetchCommentJoinRows(anyCollection(), any())).thenReturn(List.of(
                row(1, 1, comment(100, null, "kept")),
                row(2, 1, comment(101, 999L, "orphan"))));

        List<CommentNode> comments = reconstructor.reconstruct(request).get(0)
                .comments(CommentKind.DIFF_COMMENTS);

        assertEquals(List.of(100L), comments.stream().map(CommentNode::id).toList());
        assertTrue(comments.get(0).replies().isEmpty());
    }

    @Test
    @DisplayName("A non-reply comment on a reply review is dropped as an orphan")
    void plainCommentOnReplyReviewDropped() {
        Review top = review(1, null, true, 0);
        Review replyReview = reply(2, 1, 10);
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(top, replyReview));
        when(store.fetchCommentJoinRows(anyCollection(), any())).thenReturn(List.of(
                row(1, 2, comment(100, null, "stray"))));

        List<Entry> entries = reconstructor.reconstruct(request);

        assertEquals(1, entries.size());
        assertTrue(entries.get(0).comments(CommentKind.DIFF_COMMENTS).isEmpty());
    }

    @Test
    @DisplayName("Join rows for reviews that are not public are ignored")
    void rowsForUnknownReviewIgnored() {
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(review(1, null, true, 0)));
        when(store.fetchCommentJoinRows(anyCollection(), any())).thenReturn(List.of(
                row(1, 55, comment(100, null, "from elsewhere"))));

        assertTrue(reconstructor.reconstruct(request).get(0)
                .comments(CommentKind.DIFF_COMMENTS).isEmpty());
    }

    @Test
    @DisplayName("A comment linked to two reviews is nested only once under its target")
    void commentOnTwoReviewsNotDuplicated() {
        Review top = review(1, null, true, 0);
        Review replyA = reply(2, 1, 1);
        Review replyB = reply(3, 1, 2);
        Comment root = comment(100, null, "root");
        Comment shared = comment(101, 100L, "shared");
        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(top, replyA, replyB));
        when(store.fetchCommentJoinRows(anyCollection(), any())).thenReturn(List.of(
                row(1, 1, root), row(2, 2, shared), row(3, 3, shared)));

        CommentNode rootNode = reconstructor.reconstruct(request).get(0)
                .comments(CommentKind.DIFF_COMMENTS).get(0);

        assertEquals(1, rootNode.replies().size());
        assertDoesNotThrow(() -> ThreadFlattener.flattenCommentChain(rootNode));
    }

    // =========================================================================
    // Comment kinds
    // =========================================================================

    @Test
    @DisplayName("Each registered comment kind gets its own bucket and one query")
    void multipleCommentKinds() {
        CommentKind fileComments = new CommentKind("file_attachment_comments",
                "select-file-attachment-comment-joins", List.of("c.timestamp"));
        reconstructor = new ThreadReconstructor(store, List.of(CommentKind.DIFF_COMMENTS, fileComments));

        when(store.fetchReviews(REQUEST_ID)).thenReturn(List.of(review(1, null, true, 0)));
        when(store.fetchCommentJoinRows(anyCollection(), eq(CommentKind.DIFF_COMMENTS)))
                .thenReturn(List.of(row(1, 1, comment(100, null, "diff"))));
        when(store.fetchCommentJoinRows(anyCollection(), eq(fileComments)))
                .thenReturn(List.of(row(1, 1, comment(200, null, "attachment"))));

        Entry entry = reconstructor.reconstruct(request).get(0);

        assertEquals(List.of(CommentKind.DIFF_COMMENTS, fileComments),
                new ArrayList<>(entry.commentsByKind().keySet()));
        assertEquals(100L, entry.comments(CommentKind.DIFF_COMMENTS).get(0).id());
        assertEquals(200L, entry.comments(fileComments).get(0).id());
        assertEquals("top 1\nbottom 1\ndiff\nattachment", ThreadFlattener.flattenEntry(entry));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static Review review(long id, Long baseReplyTo, boolean isPublic, long offsetSeconds) {
        return new Review(id, REQUEST_ID, "user" + id, isPublic, T0.plusSeconds(offsetSeconds),
                baseReplyTo, null, null, "top " + id, "bottom " + id);
    }

    private static Review reply(long id, long parentId, long offsetSeconds) {
        return review(id, parentId, true, offsetSeconds);
    }

    private static Comment comment(long id, Long replyTo, String text) {
        return new Comment(id, 1L, 10, T0, text, replyTo);
    }

    private static CommentJoinRow row(long id, long reviewId, Comment comment) {
        return new CommentJoinRow(id, reviewId, comment);
    }
}
