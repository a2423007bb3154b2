package com.bageldb.client.items;

import com.bageldb.client.config.RequestHeaders;
import com.bageldb.client.error.CollectionClientException;
import com.bageldb.client.model.ItemResponse;
import com.bageldb.client.query.QueryEncoder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Single-request operations on individual items and their nested collections.
 *
 * <p>Every call issues exactly one request and returns the status and body as
 * received; no retry, no status interpretation.
 *
 * <pre>{@code
 * ItemClient items = client.items();
 * ItemResponse created = items.createItem("articles", Map.of("title", "Hello"));
 * ItemResponse chapter = items.createNestedItem("articles", articleId, "chapters", Map.of("n", 1));
 * }</pre>
 */
public class ItemClient {

    private static final Logger logger = LoggerFactory.getLogger(ItemClient.class);

    private static final String JSON = "application/json";
    private static final String FORM = "application/x-www-form-urlencoded";
    private static final String MULTIPART = "multipart/form-data";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final QueryEncoder encoder;
    private final RequestHeaders headers;
    private final Duration requestTimeout;

    public ItemClient(HttpClient httpClient, ObjectMapper objectMapper, QueryEncoder encoder,
                      RequestHeaders headers, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.encoder = encoder;
        this.headers = headers;
        this.requestTimeout = requestTimeout;
    }

    public ItemResponse getItem(String collectionName, String itemId) {
        return send("GET", itemUrl(collectionName, itemId), null, null);
    }

    /**
     * Creates an item. Dates inside the document should be ISO-8601 strings.
     */
    public ItemResponse createItem(String collectionName, Object document) {
        return send("POST", encoder.resourceUrl(collectionName), toJson(document), JSON);
    }

    public ItemResponse updateItem(String collectionName, String itemId, Object document) {
        return send("PUT", itemUrl(collectionName, itemId), toJson(document), JSON);
    }

    public ItemResponse deleteItem(String collectionName, String itemId) {
        return send("DELETE", itemUrl(collectionName, itemId), null, null);
    }

    /**
     * Adds a document to the nested collection {@code nestedCollection} of an item.
     */
    public ItemResponse createNestedItem(String collectionName, String itemId, String nestedCollection,
                                         Object document) {
        String url = itemUrl(collectionName, itemId) + "?nestedID=" + encode(nestedCollection);
        return send("POST", url, toJson(document), JSON);
    }

    public ItemResponse updateNestedItem(String collectionName, String itemId, String nestedCollection,
                                         String nestedItemId, Object document) {
        return send("PUT", nestedItemUrl(collectionName, itemId, nestedCollection, nestedItemId),
                toJson(document), JSON);
    }

    public ItemResponse deleteNestedItem(String collectionName, String itemId, String nestedCollection,
                                         String nestedItemId) {
        return send("DELETE", nestedItemUrl(collectionName, itemId, nestedCollection, nestedItemId), null, null);
    }

    /**
     * Attaches the image at {@code imageUrl} to the item under the given slug.
     */
    public ItemResponse addImageFromUrl(String collectionName, String itemId, String imageSlug, String imageUrl) {
        String url = itemUrl(collectionName, itemId) + "/image?imageSlug=" + encode(imageSlug);
        return send("PUT", url, "imageLink=" + encode(imageUrl), FORM);
    }

    /**
     * Uploads a local image file to the item under the given slug, as the
     * {@code imageFile} part of a multipart form.
     *
     * @throws CollectionClientException if the file cannot be read
     */
    public ItemResponse addImageFromFile(String collectionName, String itemId, String imageSlug, Path imageFile) {
        Objects.requireNonNull(imageFile, "imageFile must not be null");
        String url = itemUrl(collectionName, itemId) + "/image?imageSlug=" + encode(imageSlug);

        byte[] content;
        try {
            content = Files.readAllBytes(imageFile);
        } catch (IOException e) {
            throw new CollectionClientException("Cannot read image " + imageFile, e);
        }

        String boundary = "bageldb-" + UUID.randomUUID();
        Path fileName = imageFile.getFileName();
        String partHeader = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"imageFile\"; filename=\""
                + (fileName != null ? fileName : "imageFile") + "\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n";
        String closing = "\r\n--" + boundary + "--\r\n";
        HttpRequest.BodyPublisher body = HttpRequest.BodyPublishers.ofByteArrays(List.of(
                partHeader.getBytes(StandardCharsets.UTF_8),
                content,
                closing.getBytes(StandardCharsets.UTF_8)));
        return exchange("PUT", url, body, MULTIPART + "; boundary=" + boundary);
    }

    private String itemUrl(String collectionName, String itemId) {
        Objects.requireNonNull(itemId, "itemId must not be null");
        if (itemId.isBlank()) {
            throw new IllegalArgumentException("itemId must not be blank");
        }
        return encoder.resourceUrl(collectionName) + "/" + QueryEncoder.encodePathSegment(itemId);
    }

    private String nestedItemUrl(String collectionName, String itemId, String nestedCollection,
                                 String nestedItemId) {
        Objects.requireNonNull(nestedItemId, "nestedItemId must not be null");
        return itemUrl(collectionName, itemId) + "?nestedID=" + encode(nestedCollection) + "." + encode(nestedItemId);
    }

    private String toJson(Object document) {
        Objects.requireNonNull(document, "document must not be null");
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document cannot be serialized to JSON", e);
        }
    }

    private ItemResponse send(String method, String url, String body, String contentType) {
        HttpRequest.BodyPublisher publisher = body == null
                ? null
                : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);
        return exchange(method, url, publisher, contentType);
    }

    private ItemResponse exchange(String method, String url, HttpRequest.BodyPublisher body, String contentType) {
        HttpRequest.Builder builder = headers.applyTo(HttpRequest.newBuilder())
                .uri(URI.create(url))
                .header("Accept", JSON)
                .timeout(requestTimeout);
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", contentType)
                    .method(method, body);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CollectionClientException(method + " " + url + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectionClientException("Interrupted during " + method + " " + url, e);
        }

        logger.debug("{} {} -> {}", method, url, response.statusCode());
        return new ItemResponse(response.statusCode(), parseBody(response.body()), response.body());
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.debug("Response body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String encode(String value) {
        Objects.requireNonNull(value, "value must not be null");
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
