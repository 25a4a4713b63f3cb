package com.reviewsearch.indexer.document;

/**
 * A single field of an index document.
 *
 * @param stored    whether the backend keeps the original value for retrieval
 * @param tokenized whether the value is analyzed into terms, or indexed as one exact term
 */
public record IndexField(
        String name,
        String value,
        boolean stored,
        boolean tokenized
) {

    public static IndexField text(String name, String value) {
        return new IndexField(name, value, false, true);
    }

    public static IndexField keyword(String name, String value) {
        return new IndexField(name, value, false, false);
    }

    public static IndexField storedKeyword(String name, String value) {
        return new IndexField(name, value, true, false);
    }
}
