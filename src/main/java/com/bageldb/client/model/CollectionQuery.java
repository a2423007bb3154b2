package com.bageldb.client.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one retrieval request against a collection.
 *
 * <p>Example usage:
 * <pre>{@code
 * CollectionQuery query = CollectionQuery.builder("articles")
 *     .pageSize(50)
 *     .projectOn("title", "author.name")
 *     .where("author.itemRefID", "=", "5e89a0a573c14625b8850a05")
 *     .rawParam("sort=createdAt")
 *     .build();
 * }</pre>
 *
 * @param collectionName the remote collection, non-blank
 * @param pageSize items per page, positive
 * @param projection field paths to return, empty for full documents
 * @param predicates filter conditions, ANDed by the backend
 * @param rawParams {@code key=value} strings appended verbatim
 * @param paginate when false, exactly one unpaginated request is issued
 */
public record CollectionQuery(
        String collectionName,
        int pageSize,
        List<String> projection,
        List<Predicate> predicates,
        List<String> rawParams,
        boolean paginate
) {
    public static final int DEFAULT_PAGE_SIZE = 100;

    public CollectionQuery {
        Objects.requireNonNull(collectionName, "collectionName must not be null");
        if (collectionName.isBlank()) {
            throw new IllegalArgumentException("collectionName must not be blank");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive, was " + pageSize);
        }
        projection = projection != null ? List.copyOf(projection) : List.of();
        predicates = predicates != null ? List.copyOf(predicates) : List.of();
        rawParams = rawParams != null ? List.copyOf(rawParams) : List.of();
    }

    /**
     * A query for every document of a collection with default paging.
     */
    public static CollectionQuery of(String collectionName) {
        return builder(collectionName).build();
    }

    public static Builder builder(String collectionName) {
        return new Builder(collectionName);
    }

    public static final class Builder {
        private final String collectionName;
        private int pageSize = DEFAULT_PAGE_SIZE;
        private final List<String> projection = new ArrayList<>();
        private final List<Predicate> predicates = new ArrayList<>();
        private final List<String> rawParams = new ArrayList<>();
        private boolean paginate = true;

        private Builder(String collectionName) {
            this.collectionName = collectionName;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder projectOn(String... fieldPaths) {
            projection.addAll(List.of(fieldPaths));
            return this;
        }

        public Builder where(Predicate predicate) {
            predicates.add(Objects.requireNonNull(predicate, "predicate must not be null"));
            return this;
        }

        public Builder where(String field, String operator, String value) {
            return where(Predicate.of(field, operator, value));
        }

        public Builder where(String field, String value) {
            return where(Predicate.of(field, value));
        }

        public Builder rawParam(String keyValue) {
            rawParams.add(Objects.requireNonNull(keyValue, "raw parameter must not be null"));
            return this;
        }

        public Builder paginate(boolean paginate) {
            this.paginate = paginate;
            return this;
        }

        public CollectionQuery build() {
            return new CollectionQuery(collectionName, pageSize, projection, predicates, rawParams, paginate);
        }
    }
}
