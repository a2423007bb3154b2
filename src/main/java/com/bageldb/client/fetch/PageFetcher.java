package com.bageldb.client.fetch;

import com.bageldb.client.config.RetryPolicy;
import com.bageldb.client.error.DocumentDecodeException;
import com.bageldb.client.error.PageFetchException;
import com.bageldb.client.error.RetrievalCancelledException;
import com.bageldb.client.model.PageRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches one page and decodes its JSON array of documents.
 *
 * <p>Transport failures are retried with a fixed backoff until the
 * {@link RetryPolicy} budget is spent. An HTTP status other than 200 and a body
 * that is not a JSON array are reported immediately.
 *
 * <p>Instances hold no per-request state and can be shared between threads.
 */
public class PageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(PageFetcher.class);

    static final int HTTP_OK = 200;

    private final PageTransport transport;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;

    public PageFetcher(PageTransport transport, ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
    }

    public PageFetcher(PageTransport transport, RetryPolicy retryPolicy) {
        this(transport, new ObjectMapper(), retryPolicy);
    }

    /**
     * Fetches the page and returns its documents.
     *
     * @throws PageFetchException on a non-200 status or when retries run out
     * @throws DocumentDecodeException when the body is not a JSON array
     * @throws RetrievalCancelledException when the thread is interrupted
     */
    public List<JsonNode> fetchPage(PageRequest request) {
        return fetch(request).items();
    }

    /**
     * Fetches the page and returns its documents together with the raw response.
     */
    public FetchedPage fetch(PageRequest request) {
        int attempts = 0;
        IOException lastFailure = null;

        while (attempts < retryPolicy.maxAttempts()) {
            attempts++;
            TransportResponse response;
            try {
                response = transport.get(request);
            } catch (IOException e) {
                lastFailure = e;
                if (attempts < retryPolicy.maxAttempts()) {
                    logger.warn("Page {} attempt {}/{} failed: {}; retrying in {} ms",
                            request.pageNumber(), attempts, retryPolicy.maxAttempts(),
                            e.toString(), retryPolicy.backoff().toMillis());
                    sleep(request, retryPolicy.backoff().toMillis());
                }
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetrievalCancelledException("Interrupted while fetching page " + request.pageNumber(), e);
            }

            if (response.statusCode() != HTTP_OK) {
                throw PageFetchException.forStatus(request.pageNumber(), response.statusCode(), response.body());
            }
            return new FetchedPage(request, decode(request, response.body()), response, attempts);
        }

        logger.warn("Page {} gave up after {} attempts", request.pageNumber(), attempts);
        throw PageFetchException.retriesExhausted(request.pageNumber(), attempts, lastFailure);
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private List<JsonNode> decode(PageRequest request, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DocumentDecodeException(request.pageNumber(),
                    "Page " + request.pageNumber() + " is not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new DocumentDecodeException(request.pageNumber(),
                    "Page " + request.pageNumber() + " is not a JSON array of documents");
        }
        List<JsonNode> items = new ArrayList<>(root.size());
        root.forEach(items::add);
        return items;
    }

    private void sleep(PageRequest request, long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetrievalCancelledException("Interrupted during backoff for page " + request.pageNumber(), e);
        }
    }
}
