package com.bageldb.client.query;

import com.bageldb.client.model.PageRequest;

/**
 * A query string computed once per retrieval. Page requests built from it
 * differ only in their {@code pageNumber} parameter.
 *
 * @param collectionName the collection the query targets
 * @param resourceUrl {@code {baseUrl}/collection/{name}/items}
 * @param fragment encoded filter parameters with their leading {@code ?}, or empty
 * @param pageSize value sent as {@code perPage}
 */
public record EncodedQuery(
        String collectionName,
        String resourceUrl,
        String fragment,
        int pageSize
) {
    static final String PAGE_NUMBER = "pageNumber";
    static final String PER_PAGE = "perPage";

    /**
     * The URL of the single request issued when pagination is disabled.
     */
    public String unpaginatedUrl() {
        return resourceUrl + fragment;
    }

    public PageRequest pageRequest(int pageNumber) {
        String symbol = fragment.isEmpty() ? "?" : "&";
        String url = resourceUrl + fragment + symbol
                + PAGE_NUMBER + "=" + pageNumber + "&" + PER_PAGE + "=" + pageSize;
        return new PageRequest(url, pageNumber);
    }
}
