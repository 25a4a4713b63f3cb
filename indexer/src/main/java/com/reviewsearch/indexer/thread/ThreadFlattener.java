package com.reviewsearch.indexer.thread;

import com.reviewsearch.indexer.model.Review;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns reconstructed entries into plain text for the aggregate comment field.
 * Parts are joined with newlines; null text counts as empty.
 */
public final class ThreadFlattener {

    private ThreadFlattener() {
    }

    /**
     * Flattens all entries of a review request, in order.
     */
    public static String flattenEntries(List<Entry> entries) {
        List<String> parts = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            parts.add(flattenEntry(entry));
        }
        return String.join("\n", parts);
    }

    /**
     * Flattens one entry: the review's top and bottom body, then the top and bottom body of
     * every body-top reply, then of every body-bottom reply, then each top-level comment chain
     * of every comment kind.
     *
     * @throws ReplyCycleException if a comment chain loops back on itself
     */
    public static String flattenEntry(Entry entry) {
        ReviewNode node = entry.review();
        List<String> parts = new ArrayList<>();
        parts.add(orEmpty(node.review().bodyTop()));
        parts.add(orEmpty(node.review().bodyBottom()));
        for (Review reply : node.bodyTopReplies()) {
            parts.add(orEmpty(reply.bodyTop()));
            parts.add(orEmpty(reply.bodyBottom()));
        }
        for (Review reply : node.bodyBottomReplies()) {
            parts.add(orEmpty(reply.bodyTop()));
            parts.add(orEmpty(reply.bodyBottom()));
        }
        for (List<CommentNode> bucket : entry.commentsByKind().values()) {
            for (CommentNode comment : bucket) {
                parts.add(flattenCommentChain(comment));
            }
        }
        return String.join("\n", parts);
    }

    /**
     * Pre-order walk of a comment and its replies: the comment's text, then each direct reply's
     * flattened chain, separated by newlines.
     *
     * @throws ReplyCycleException if a comment is reached twice
     */
    public static String flattenCommentChain(CommentNode comment) {
        StringBuilder text = new StringBuilder();
        appendChain(comment, new HashSet<>(), text);
        return text.toString();
    }

    private static void appendChain(CommentNode comment, Set<Long> visited, StringBuilder text) {
        if (!visited.add(comment.id())) {
            throw new ReplyCycleException(comment.id());
        }
        text.append(orEmpty(comment.text()));
        for (CommentNode reply : comment.replies()) {
            text.append('\n');
            appendChain(reply, visited, text);
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
