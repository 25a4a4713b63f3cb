package com.reviewsearch.indexer.backend;

import com.reviewsearch.indexer.document.IndexDocument;

import java.io.Closeable;
import java.io.IOException;

/**
 * An open write session against a {@link SearchBackend}. Changes become visible on
 * {@link #commit()}; closing a session that was not committed leaves the previously committed
 * index in place where the backend buffers changes. There is no upsert: replacing a document is
 * a delete followed by an add.
 */
public interface IndexWriterSession extends Closeable {

    /**
     * Deletes every document whose (untokenized) field equals the value.
     */
    void deleteDocument(String field, String value) throws IOException;

    void addDocument(IndexDocument document) throws IOException;

    void commit() throws IOException;

    /**
     * Compacts the index. May be a no-op on backends that manage this themselves.
     */
    void optimize() throws IOException;
}
