package com.bageldb.client.model;

import com.bageldb.client.error.CollectionClientException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * The merged documents of a bulk retrieval.
 *
 * <p>A result is either complete, or partial with the {@link #failure()} that
 * stopped the retrieval. Only the sequential strategy produces partial results;
 * total failures are thrown, never returned.
 *
 * @param items documents in page order
 * @param totalPages pages the backend reported for the query
 * @param pagesFetched pages whose documents are included in {@code items}
 * @param error what stopped the retrieval early, null when complete
 */
public record RetrievalResult(
        List<JsonNode> items,
        int totalPages,
        int pagesFetched,
        CollectionClientException error
) {
    public RetrievalResult {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static RetrievalResult complete(List<JsonNode> items, int totalPages) {
        return new RetrievalResult(items, totalPages, totalPages, null);
    }

    public static RetrievalResult partial(List<JsonNode> items, int totalPages, int pagesFetched,
                                          CollectionClientException error) {
        return new RetrievalResult(items, totalPages, pagesFetched, error);
    }

    public boolean isComplete() {
        return error == null;
    }

    public boolean isPartial() {
        return error != null;
    }

    public Optional<CollectionClientException> failure() {
        return Optional.ofNullable(error);
    }

    public int size() {
        return items.size();
    }
}
