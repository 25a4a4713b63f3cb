package com.reviewsearch.indexer.document;

/**
 * Field names of a review request document. {@link #TEXT} is the default search field.
 */
public final class IndexFields {

    public static final String ID = "id";
    public static final String SUMMARY = "summary";
    public static final String CHANGENUM = "changenum";
    public static final String BUG = "bug";
    public static final String AUTHOR = "author";
    public static final String USERNAME = "username";
    public static final String COMMENT = "comment";
    public static final String FILE = "file";
    public static final String TEXT = "text";

    private IndexFields() {
    }
}
