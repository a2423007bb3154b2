package com.bageldb.client.fetch;

import com.bageldb.client.model.PageRequest;
import com.bageldb.client.model.PageResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A successfully fetched and decoded page.
 *
 * @param request the request that produced it
 * @param items decoded documents
 * @param response the raw response, kept for header inspection
 * @param attempts transport attempts it took, at least 1
 */
public record FetchedPage(
        PageRequest request,
        List<JsonNode> items,
        TransportResponse response,
        int attempts
) {
    public FetchedPage {
        items = List.copyOf(items);
    }

    public int pageNumber() {
        return request.pageNumber();
    }

    public PageResult toResult() {
        return new PageResult(request.pageNumber(), items);
    }
}
