package com.reviewsearch.indexer.model;

/**
 * Lifecycle status of a review request, stored as a single-character code.
 * Only {@link #PENDING} and {@link #SUBMITTED} requests are searchable.
 */
public enum ReviewRequestStatus {
    PENDING("P"),
    SUBMITTED("S"),
    DISCARDED("D");

    private final String code;

    ReviewRequestStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ReviewRequestStatus fromCode(String code) {
        for (ReviewRequestStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown review request status: " + code);
    }
}
