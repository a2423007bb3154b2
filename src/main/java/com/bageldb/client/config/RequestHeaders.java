package com.bageldb.client.config;

import java.net.http.HttpRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The headers sent with every request. Built once from the API token when the
 * client is constructed and shared by all requests afterwards.
 */
public final class RequestHeaders {

    public static final String AUTHORIZATION = "Authorization";
    public static final String ACCEPT_VERSION = "Accept-Version";
    public static final String API_VERSION = "v1";

    private final Map<String, String> values;

    private RequestHeaders(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    /**
     * Creates the bearer-token header set for the given API token.
     *
     * @param apiToken the API token, must not be blank
     */
    public static RequestHeaders forToken(String apiToken) {
        Objects.requireNonNull(apiToken, "apiToken must not be null");
        if (apiToken.isBlank()) {
            throw new IllegalArgumentException("apiToken must not be blank");
        }
        Map<String, String> values = new LinkedHashMap<>();
        values.put(AUTHORIZATION, "Bearer " + apiToken);
        values.put(ACCEPT_VERSION, API_VERSION);
        return new RequestHeaders(values);
    }

    public Map<String, String> asMap() {
        return values;
    }

    /**
     * Copies every header onto the given request builder.
     */
    public HttpRequest.Builder applyTo(HttpRequest.Builder builder) {
        values.forEach(builder::header);
        return builder;
    }

    @Override
    public String toString() {
        // keep the token out of logs
        return "RequestHeaders{" + ACCEPT_VERSION + "=" + API_VERSION + ", " + AUTHORIZATION + "=Bearer ***}";
    }
}
