package com.reviewsearch.indexer.backend;

/**
 * A full-text search engine that review request documents are written to.
 * Each implementation owns its target location (index directory, server URL).
 */
public interface SearchBackend {

    /**
     * Opens a writer session for one index run.
     *
     * @param truncate if true, all existing documents are removed before anything is added
     * @throws SearchBackendException if the backend cannot be reached or opened
     */
    IndexWriterSession open(boolean truncate) throws SearchBackendException;

    /**
     * Short name for logs, e.g. "lucene".
     */
    String name();
}
