package com.bageldb.client;

import com.bageldb.client.config.ClientConfig;
import com.bageldb.client.error.PageFailureException;
import com.bageldb.client.fetch.HttpClientPageTransport;
import com.bageldb.client.fetch.PageFetcher;
import com.bageldb.client.fetch.PageTransport;
import com.bageldb.client.items.ItemClient;
import com.bageldb.client.model.CollectionQuery;
import com.bageldb.client.model.PageRequest;
import com.bageldb.client.model.RetrievalResult;
import com.bageldb.client.query.EncodedQuery;
import com.bageldb.client.query.QueryEncoder;
import com.bageldb.client.retrieval.ConcurrentRetrieval;
import com.bageldb.client.retrieval.RetrievalMode;
import com.bageldb.client.retrieval.SequentialRetrieval;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Main entry point for reading BagelDB collections.
 *
 * <p>It ties together query encoding, page-count discovery and the two
 * bulk-retrieval strategies:
 * <ul>
 *   <li>{@link #getCollection} fetches pages one by one and returns a partial
 *       result if a page fails</li>
 *   <li>{@link #getCollectionParallel} fetches pages concurrently (bounded by
 *       {@link ClientConfig#maxConcurrency()}) and fails the call if a page fails</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * CollectionClient client = new CollectionClient("my-api-token");
 *
 * CollectionQuery query = CollectionQuery.builder("articles")
 *     .projectOn("title", "author")
 *     .where("author.itemRefID", "=", "5e89a0a573c14625b8850a05")
 *     .build();
 *
 * RetrievalResult all = client.getCollectionParallel(query);
 * all.items().forEach(article -> System.out.println(article.get("title")));
 * }</pre>
 *
 * <h2>Outcomes</h2>
 * <table>
 *   <tr><th>Outcome</th><th>Sequential</th><th>Concurrent</th></tr>
 *   <tr><td>All pages fetched</td><td>complete result</td><td>complete result</td></tr>
 *   <tr><td>A page fails</td><td>partial result + failure</td><td>exception</td></tr>
 *   <tr><td>No usable item-count</td><td>exception</td><td>exception</td></tr>
 * </table>
 */
public class CollectionClient {

    private static final Logger logger = LoggerFactory.getLogger(CollectionClient.class);

    private final ClientConfig config;
    private final QueryEncoder encoder;
    private final PageFetcher fetcher;
    private final SequentialRetrieval sequential;
    private final ConcurrentRetrieval concurrent;
    private final ItemClient items;

    /**
     * Creates a client against the public API with default settings.
     *
     * @param apiToken token sent as {@code Authorization: Bearer <token>}
     */
    public CollectionClient(String apiToken) {
        this(ClientConfig.defaults(apiToken));
    }

    public CollectionClient(ClientConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build(), new ObjectMapper());
    }

    /**
     * Creates a client with a pre-configured HttpClient and ObjectMapper.
     */
    public CollectionClient(ClientConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        this(config,
                new HttpClientPageTransport(httpClient, config.headers(), config.requestTimeout()),
                httpClient,
                objectMapper);
    }

    /**
     * Creates a client whose page fetches go through a custom transport.
     * Single-item operations still use {@code httpClient}.
     */
    public CollectionClient(ClientConfig config, PageTransport transport, HttpClient httpClient,
                            ObjectMapper objectMapper) {
        this.config = config;
        this.encoder = new QueryEncoder(config.baseUrl());
        this.fetcher = new PageFetcher(transport, objectMapper, config.retryPolicy());
        this.sequential = new SequentialRetrieval(fetcher, config.progressListener(), config.callDeadline());
        this.concurrent = new ConcurrentRetrieval(
                fetcher, config.maxConcurrency(), config.progressListener(), config.callDeadline());
        this.items = new ItemClient(httpClient, objectMapper, encoder, config.headers(), config.requestTimeout());
        logger.debug("Collection client ready for {} with {}", config.baseUrl(), config.headers());
    }

    /**
     * Retrieves every matching document page by page, in order.
     *
     * <p>With {@code paginate=false} a single request without pagination
     * parameters is issued. A failing page ends the retrieval; the result then
     * holds the documents of the earlier pages and {@link RetrievalResult#failure()}.
     */
    public RetrievalResult getCollection(CollectionQuery query) {
        return retrieve(query, RetrievalMode.SEQUENTIAL);
    }

    /**
     * Retrieves every matching document with concurrent page fetches and
     * returns them in page order.
     *
     * @throws com.bageldb.client.error.CollectionClientException if any page fails
     */
    public RetrievalResult getCollectionParallel(CollectionQuery query) {
        return retrieve(query, RetrievalMode.CONCURRENT);
    }

    /**
     * Non-blocking variant of {@link #getCollectionParallel}. Cancelling the
     * future cancels the in-flight page fetches.
     */
    public CompletableFuture<RetrievalResult> getCollectionParallelAsync(CollectionQuery query) {
        if (!query.paginate()) {
            return CompletableFuture.supplyAsync(() -> retrieve(query, RetrievalMode.CONCURRENT));
        }
        return concurrent.retrieveAsync(encoder.encode(query, RetrievalMode.CONCURRENT.predicateStyle()));
    }

    public RetrievalResult retrieve(CollectionQuery query, RetrievalMode mode) {
        EncodedQuery encoded = encoder.encode(query, mode.predicateStyle());
        if (!query.paginate()) {
            return fetchUnpaginated(encoded, mode);
        }
        return mode == RetrievalMode.SEQUENTIAL
                ? sequential.retrieve(encoded)
                : concurrent.retrieve(encoded);
    }

    /**
     * Single-item and nested-item operations.
     */
    public ItemClient items() {
        return items;
    }

    public ClientConfig getConfig() {
        return config;
    }

    private RetrievalResult fetchUnpaginated(EncodedQuery encoded, RetrievalMode mode) {
        PageRequest request = new PageRequest(encoded.unpaginatedUrl(), 1);
        try {
            return RetrievalResult.complete(fetcher.fetchPage(request), 1);
        } catch (PageFailureException e) {
            if (mode == RetrievalMode.CONCURRENT) {
                throw e;
            }
            logger.warn("Fetching {} failed: {}", encoded.collectionName(), e.getMessage());
            return RetrievalResult.partial(List.of(), 1, 0, e);
        }
    }
}
