package com.bageldb.client.fetch;

import com.bageldb.client.config.RequestHeaders;
import com.bageldb.client.model.PageRequest;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link PageTransport} backed by the JDK {@link HttpClient}.
 */
public class HttpClientPageTransport implements PageTransport {

    private final HttpClient httpClient;
    private final RequestHeaders headers;
    private final Duration requestTimeout;

    public HttpClientPageTransport(HttpClient httpClient, RequestHeaders headers, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.headers = headers;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public TransportResponse get(PageRequest request) throws IOException, InterruptedException {
        HttpRequest httpRequest = headers.applyTo(HttpRequest.newBuilder())
                .uri(request.uri())
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        return new TransportResponse(response.statusCode(), response.headers().map(), response.body());
    }
}
