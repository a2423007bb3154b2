package com.bageldb.client;

import com.bageldb.client.config.ClientConfig;
import com.bageldb.client.config.RetryPolicy;
import com.bageldb.client.error.PageFetchException;
import com.bageldb.client.model.CollectionQuery;
import com.bageldb.client.model.RetrievalResult;
import com.bageldb.client.retrieval.LoggingProgressListener;
import com.bageldb.client.retrieval.RetrievalMode;
import com.bageldb.client.server.StubCollectionServer;
import com.bageldb.client.server.StubCollectionServer.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for CollectionClient - the full pipeline from query to merged result.
 *
 * <h2>Comparison of Strategies</h2>
 * <table>
 *   <tr><th>Aspect</th><th>getCollection</th><th>getCollectionParallel</th></tr>
 *   <tr><td>Page order</td><td>By construction</td><td>Restored after merge</td></tr>
 *   <tr><td>Predicates</td><td>query=a&amp;query=b</td><td>query=a%2Bb</td></tr>
 *   <tr><td>Failing page</td><td>Partial result</td><td>Exception</td></tr>
 * </table>
 */
class CollectionClientIntegrationTest {

    private StubCollectionServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    private CollectionClient client() {
        return new CollectionClient(ClientConfig.builder(StubCollectionServer.TOKEN)
                .baseUrl(server.getBaseUrl())
                .retryPolicy(new RetryPolicy(3, Duration.ofMillis(10)))
                .maxConcurrency(5)
                .build());
    }

    private static CollectionQuery filteredQuery() {
        return CollectionQuery.builder("articles")
                .pageSize(10)
                .projectOn("_id", "n")
                .where("status", "published")
                .where("title", "=", "hello world")
                .build();
    }

    private RecordedRequest firstRequest() {
        return server.getRequests().get(0);
    }

    // =========================================================================
    // STRATEGY EQUIVALENCE
    // =========================================================================

    @Test
    @DisplayName("Sequential and concurrent retrieval should return the same items")
    void strategiesShouldAgree() {
        server = StubCollectionServer.create(137);
        server.start();
        CollectionClient client = client();

        RetrievalResult sequential = client.getCollection(filteredQuery());
        RetrievalResult concurrent = client.getCollectionParallel(filteredQuery());

        assertThat(sequential.isComplete()).isTrue();
        assertThat(concurrent.isComplete()).isTrue();
        assertThat(concurrent.items()).hasSize(137).isEqualTo(sequential.items());
    }

    @Test
    @DisplayName("Re-running a retrieval should yield an identical sequence")
    void retrievalShouldBeRepeatable() {
        server = StubCollectionServer.create(64);
        server.start();
        CollectionClient client = client();

        RetrievalResult first = client.getCollectionParallel(filteredQuery());
        RetrievalResult second = client.getCollectionParallel(filteredQuery());

        assertThat(second.items()).isEqualTo(first.items());
    }

    @Test
    @DisplayName("Async retrieval should complete with the same items")
    void asyncRetrievalShouldComplete() throws Exception {
        server = StubCollectionServer.create(42);
        server.start();
        CollectionClient client = client();

        RetrievalResult result = client.getCollectionParallelAsync(filteredQuery()).get(10, TimeUnit.SECONDS);

        assertThat(result.items()).isEqualTo(client.getCollection(filteredQuery()).items());
    }

    // =========================================================================
    // WIRE FORMAT
    // =========================================================================

    @Test
    @DisplayName("Sequential mode should repeat the query parameter per predicate")
    void sequentialShouldRepeatQueryParameter() {
        server = StubCollectionServer.create(5);
        server.start();

        client().getCollection(filteredQuery());

        assertThat(firstRequest().path()).isEqualTo("/collection/articles/items");
        assertThat(firstRequest().rawQuery()).isEqualTo(
                "projectOn=_id,n&query=status:published&query=title:=:hello+world&pageNumber=1&perPage=10");
    }

    @Test
    @DisplayName("Concurrent mode should join predicates into one query parameter")
    void concurrentShouldJoinQueryParameter() {
        server = StubCollectionServer.create(5);
        server.start();

        client().getCollectionParallel(filteredQuery());

        assertThat(firstRequest().rawQuery()).isEqualTo(
                "projectOn=_id,n&query=status:published%2Btitle:=:hello+world&pageNumber=1&perPage=10");
    }

    @Test
    @DisplayName("Operators outside the URI character set should be escaped on the wire")
    void shouldEscapeOperators() {
        server = StubCollectionServer.create(5);
        server.start();

        client().getCollection(CollectionQuery.builder("articles").where("n", ">", "3").build());

        assertThat(firstRequest().rawQuery()).startsWith("query=n:%3E:3&");
    }

    @Test
    @DisplayName("Should authenticate with the bearer token and API version")
    void shouldAuthenticate() {
        server = StubCollectionServer.create(5);
        server.start();

        client().getCollection(CollectionQuery.of("articles"));

        assertThat(firstRequest().authorization()).isEqualTo("Bearer test-token");
        assertThat(firstRequest().acceptVersion()).isEqualTo("v1");
    }

    // =========================================================================
    // UNPAGINATED
    // =========================================================================

    @Test
    @DisplayName("Without pagination exactly one request without paging parameters is issued")
    void unpaginatedShouldIssueOneRequest() {
        server = StubCollectionServer.create(150);
        server.start();

        RetrievalResult result = client().getCollection(
                CollectionQuery.builder("articles").paginate(false).projectOn("n").build());

        List<RecordedRequest> requests = server.getRequests();
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).rawQuery()).isEqualTo("projectOn=n");
        // the backend's own default page
        assertThat(result.size()).isEqualTo(100);
        assertThat(result.isComplete()).isTrue();
    }

    @Test
    @DisplayName("Unpaginated failures follow each strategy's failure policy")
    void unpaginatedFailureShouldFollowStrategyPolicy() {
        server = StubCollectionServer.create(10).failPage(1, 500);
        server.start();
        CollectionClient client = client();
        CollectionQuery query = CollectionQuery.builder("articles").paginate(false).build();

        RetrievalResult sequential = client.getCollection(query);

        assertThat(sequential.isPartial()).isTrue();
        assertThat(sequential.items()).isEmpty();
        assertThatThrownBy(() -> client.retrieve(query, RetrievalMode.CONCURRENT))
                .isInstanceOf(PageFetchException.class);
    }

    // =========================================================================
    // OUTCOMES
    // =========================================================================

    @Test
    @DisplayName("Callers can tell complete, partial and failed retrievals apart")
    void outcomesShouldBeDistinguishable() {
        server = StubCollectionServer.create(50).failPage(4, 500);
        server.start();
        CollectionClient client = client();
        CollectionQuery query = CollectionQuery.builder("articles").pageSize(10).build();

        RetrievalResult partial = client.getCollection(query);
        RetrievalResult complete = client.getCollection(CollectionQuery.builder("articles").pageSize(100).build());

        assertThat(complete.isComplete()).isTrue();
        assertThat(complete.failure()).isEmpty();
        assertThat(partial.isPartial()).isTrue();
        assertThat(partial.size()).isEqualTo(30);
        assertThatThrownBy(() -> client.getCollectionParallel(query))
                .isInstanceOf(PageFetchException.class);
    }

    @Test
    @DisplayName("Should retrieve with progress logging enabled")
    void shouldRetrieveWithProgressLogging() {
        server = StubCollectionServer.create(35);
        server.start();
        CollectionClient client = new CollectionClient(ClientConfig.builder(StubCollectionServer.TOKEN)
                .baseUrl(server.getBaseUrl())
                .progressListener(new LoggingProgressListener())
                .build());

        RetrievalResult result = client.getCollectionParallel(
                CollectionQuery.builder("articles").pageSize(10).build());

        assertThat(result.size()).isEqualTo(35);
    }

    @Test
    @DisplayName("Should reject a blank API token")
    void shouldRejectBlankToken() {
        assertThatThrownBy(() -> new CollectionClient(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
