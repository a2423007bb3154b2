package com.bageldb.client.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * The documents of one settled page.
 */
public record PageResult(
        int pageNumber,
        List<JsonNode> items
) {
    public PageResult {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public int size() {
        return items.size();
    }
}
