package com.reviewsearch.indexer.store;

/**
 * Thrown when the review database cannot be read.
 */
public class ReviewStoreException extends RuntimeException {

    public ReviewStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
