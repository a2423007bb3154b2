package com.bageldb.client.fetch;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status, headers and body of one HTTP exchange.
 *
 * @param statusCode HTTP status
 * @param headers response headers; lookups through {@link #firstHeader} ignore case
 * @param body response body decoded as UTF-8
 */
public record TransportResponse(
        int statusCode,
        Map<String, List<String>> headers,
        String body
) {
    public TransportResponse {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        body = body != null ? body : "";
    }

    public static TransportResponse ok(String body, Map<String, List<String>> headers) {
        return new TransportResponse(200, headers, body);
    }

    public Optional<String> firstHeader(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return Optional.of(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }
}
