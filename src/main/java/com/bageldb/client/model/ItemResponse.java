package com.bageldb.client.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw outcome of a single-item request. The status is reported as received.
 *
 * @param statusCode HTTP status
 * @param body decoded JSON body, or null when the body was empty or not JSON
 * @param rawBody the body as text
 */
public record ItemResponse(
        int statusCode,
        JsonNode body,
        String rawBody
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
