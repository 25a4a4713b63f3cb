package com.reviewsearch.indexer.model;

/**
 * The user who submitted a review request.
 */
public record Submitter(
        long id,
        String username,
        String firstName,
        String lastName
) {

    /**
     * First and last name joined by a space. Blank when the user has no name on record.
     */
    public String fullName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        return (first + " " + last).trim();
    }
}
