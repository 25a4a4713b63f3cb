package com.reviewsearch.indexer.document;

import java.util.List;
import java.util.Optional;

/**
 * A backend-neutral search document: an id plus an ordered list of fields.
 */
public record IndexDocument(
        String id,
        List<IndexField> fields
) {

    public IndexDocument {
        fields = List.copyOf(fields);
    }

    public Optional<IndexField> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public Optional<String> value(String name) {
        return field(name).map(IndexField::value);
    }
}
