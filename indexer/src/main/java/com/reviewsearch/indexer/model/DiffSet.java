package com.reviewsearch.indexer.model;

import java.util.List;

/**
 * One revision in a review request's diff history, with the files it touches.
 * Maps from: diffviewer_diffset
 */
public record DiffSet(
        long id,
        int revision,
        List<FileDiff> files
) {}
