package com.reviewsearch.indexer.model;

/**
 * A single file touched by a diff set. Either path may be null.
 * Maps from: diffviewer_filediff
 */
public record FileDiff(
        long id,
        String sourceFile,
        String destFile
) {}
