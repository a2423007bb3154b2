package com.bageldb.client.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Outcome of fetching page 1: its documents plus the pagination totals the
 * backend reported alongside it.
 *
 * @param firstPageItems documents of page 1, never re-fetched
 * @param itemCount total matching documents as reported by {@code item-count}
 * @param totalPages {@code ceil(itemCount / pageSize)}
 */
public record ProbeResult(
        List<JsonNode> firstPageItems,
        long itemCount,
        int totalPages
) {
    public ProbeResult {
        firstPageItems = firstPageItems != null ? List.copyOf(firstPageItems) : List.of();
    }

    /**
     * {@code ceil(itemCount / pageSize)} without overflowing for any non-negative count.
     */
    public static long pageCount(long itemCount, int pageSize) {
        return itemCount / pageSize + (itemCount % pageSize == 0 ? 0 : 1);
    }
}
