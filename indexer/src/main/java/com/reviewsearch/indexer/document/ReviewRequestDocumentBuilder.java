package com.reviewsearch.indexer.document;

import com.reviewsearch.indexer.model.DiffSet;
import com.reviewsearch.indexer.model.FileDiff;
import com.reviewsearch.indexer.model.ReviewRequest;
import com.reviewsearch.indexer.model.Submitter;
import com.reviewsearch.indexer.thread.Entry;
import com.reviewsearch.indexer.thread.ThreadFlattener;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the search document for one review request.
 *
 * <p>Each searchable property gets its own field, and everything is also concatenated
 * into {@link IndexFields#TEXT} so a plain query without a field prefix finds it.</p>
 */
public class ReviewRequestDocumentBuilder {

    /**
     * @param request  the review request
     * @param entries  its reconstructed discussion
     * @param diffSets its diff history, possibly empty
     * @throws com.reviewsearch.indexer.thread.ReplyCycleException if a comment chain loops
     */
    public IndexDocument build(ReviewRequest request, List<Entry> entries, List<DiffSet> diffSets) {
        String id = String.valueOf(request.id());
        String summary = orEmpty(request.summary());
        String changeNumber = request.hasChangeNumber() ? String.valueOf(request.changeNumber()) : "";
        String bugs = bugTerms(request.bugsClosed());
        String author = authorName(request.submitter());
        String comments = ThreadFlattener.flattenEntries(entries);
        String files = aggregateFiles(diffSets);

        List<IndexField> fields = new ArrayList<>();
        fields.add(IndexField.storedKeyword(IndexFields.ID, id));
        fields.add(IndexField.text(IndexFields.SUMMARY, summary));
        if (request.hasChangeNumber()) {
            fields.add(IndexField.text(IndexFields.CHANGENUM, changeNumber));
        }
        fields.add(IndexField.text(IndexFields.BUG, bugs));
        fields.add(IndexField.text(IndexFields.AUTHOR, author));
        if (request.submitter() != null) {
            fields.add(IndexField.keyword(IndexFields.USERNAME, orEmpty(request.submitter().username())));
        }
        fields.add(IndexField.text(IndexFields.COMMENT, comments));
        fields.add(IndexField.text(IndexFields.FILE, files));
        fields.add(IndexField.text(IndexFields.TEXT, String.join("\n",
                summary,
                orEmpty(request.description()),
                changeNumber,
                orEmpty(request.testingDone()),
                bugs,
                author,
                comments,
                files)));

        return new IndexDocument(id, fields);
    }

    /**
     * Replaces the commas of a bug list with spaces; the analyzer does not split on commas.
     */
    static String bugTerms(String bugsClosed) {
        return bugsClosed == null ? "" : bugsClosed.replace(',', ' ');
    }

    /**
     * Username followed by the display name.
     */
    static String authorName(Submitter submitter) {
        if (submitter == null) {
            return "";
        }
        return (orEmpty(submitter.username()) + " " + submitter.fullName()).trim();
    }

    /**
     * Every source and destination path across the diff history, each once, in first-seen
     * order, one per line.
     */
    static String aggregateFiles(List<DiffSet> diffSets) {
        Set<String> files = new LinkedHashSet<>();
        for (DiffSet diffSet : diffSets) {
            for (FileDiff fileDiff : diffSet.files()) {
                if (fileDiff.sourceFile() != null && !fileDiff.sourceFile().isEmpty()) {
                    files.add(fileDiff.sourceFile());
                }
                if (fileDiff.destFile() != null && !fileDiff.destFile().isEmpty()) {
                    files.add(fileDiff.destFile());
                }
            }
        }
        return String.join("\n", files);
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
