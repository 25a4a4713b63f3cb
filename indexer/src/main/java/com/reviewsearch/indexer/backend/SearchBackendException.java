package com.reviewsearch.indexer.backend;

import java.io.IOException;

/**
 * Thrown when a search backend is unavailable or rejects an operation.
 */
public class SearchBackendException extends IOException {

    public SearchBackendException(String message) {
        super(message);
    }

    public SearchBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
