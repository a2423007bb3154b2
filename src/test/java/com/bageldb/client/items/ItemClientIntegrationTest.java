package com.bageldb.client.items;

import com.bageldb.client.CollectionClient;
import com.bageldb.client.config.ClientConfig;
import com.bageldb.client.error.CollectionClientException;
import com.bageldb.client.model.ItemResponse;
import com.bageldb.client.server.StubCollectionServer;
import com.bageldb.client.server.StubCollectionServer.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for ItemClient. The stub server echoes each request,
 * so the tests check method, path, parameters and body as sent.
 */
class ItemClientIntegrationTest {

    private StubCollectionServer server;
    private ItemClient items;

    @BeforeEach
    void setUp() {
        server = StubCollectionServer.create(0);
        server.start();
        items = new CollectionClient(ClientConfig.builder(StubCollectionServer.TOKEN)
                .baseUrl(server.getBaseUrl())
                .build()).items();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private RecordedRequest lastRequest() {
        var requests = server.getRequests();
        return requests.get(requests.size() - 1);
    }

    @Test
    @DisplayName("Should get a single item by id")
    void shouldGetItem() {
        ItemResponse response = items.getItem("articles", "abc123");

        assertThat(response.isSuccessful()).isTrue();
        assertThat(response.body().get("method").asText()).isEqualTo("GET");
        assertThat(lastRequest().path()).isEqualTo("/collection/articles/items/abc123");
        assertThat(lastRequest().authorization()).isEqualTo("Bearer test-token");
    }

    @Test
    @DisplayName("Should create an item by posting JSON to the collection")
    void shouldCreateItem() {
        ItemResponse response = items.createItem("articles", Map.of("title", "Hello"));

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(lastRequest().method()).isEqualTo("POST");
        assertThat(lastRequest().path()).isEqualTo("/collection/articles/items");
        assertThat(lastRequest().body()).isEqualTo("{\"title\":\"Hello\"}");
        assertThat(response.body().get("contentType").asText()).isEqualTo("application/json");
    }

    @Test
    @DisplayName("Should update and delete items by id")
    void shouldUpdateAndDeleteItem() {
        items.updateItem("articles", "abc", Map.of("title", "Changed"));
        RecordedRequest update = lastRequest();
        items.deleteItem("articles", "abc");
        RecordedRequest delete = lastRequest();

        assertThat(update.method()).isEqualTo("PUT");
        assertThat(update.path()).isEqualTo("/collection/articles/items/abc");
        assertThat(update.body()).contains("Changed");
        assertThat(delete.method()).isEqualTo("DELETE");
        assertThat(delete.path()).isEqualTo("/collection/articles/items/abc");
    }

    @Test
    @DisplayName("Should address nested items through the nestedID parameter")
    void shouldAddressNestedItems() {
        items.createNestedItem("articles", "abc", "chapters", Map.of("n", 1));
        assertThat(lastRequest().method()).isEqualTo("POST");
        assertThat(lastRequest().rawQuery()).isEqualTo("nestedID=chapters");

        items.updateNestedItem("articles", "abc", "chapters", "ch1", Map.of("n", 2));
        assertThat(lastRequest().method()).isEqualTo("PUT");
        assertThat(lastRequest().rawQuery()).isEqualTo("nestedID=chapters.ch1");

        items.deleteNestedItem("articles", "abc", "chapters", "ch1");
        assertThat(lastRequest().method()).isEqualTo("DELETE");
        assertThat(lastRequest().path()).isEqualTo("/collection/articles/items/abc");
    }

    @Test
    @DisplayName("Should attach an image by URL as a form field")
    void shouldAttachImageFromUrl() {
        ItemResponse response = items.addImageFromUrl("articles", "abc", "logo", "https://img.example.com/a.png");

        assertThat(lastRequest().method()).isEqualTo("PUT");
        assertThat(lastRequest().path()).isEqualTo("/collection/articles/items/abc/image");
        assertThat(lastRequest().rawQuery()).isEqualTo("imageSlug=logo");
        assertThat(lastRequest().body()).isEqualTo("imageLink=https%3A%2F%2Fimg.example.com%2Fa.png");
        assertThat(response.body().get("contentType").asText()).isEqualTo("application/x-www-form-urlencoded");
    }

    @Test
    @DisplayName("Should upload a local image as a multipart form part")
    void shouldUploadLocalImage(@TempDir Path dir) throws IOException {
        Path image = Files.writeString(dir.resolve("logo.png"), "PNGDATA");

        ItemResponse response = items.addImageFromFile("articles", "abc", "logo", image);

        assertThat(lastRequest().method()).isEqualTo("PUT");
        assertThat(lastRequest().path()).isEqualTo("/collection/articles/items/abc/image");
        assertThat(lastRequest().rawQuery()).isEqualTo("imageSlug=logo");
        assertThat(lastRequest().body())
                .contains("Content-Disposition: form-data; name=\"imageFile\"; filename=\"logo.png\"")
                .contains("PNGDATA");
        assertThat(response.body().get("contentType").asText()).startsWith("multipart/form-data; boundary=");
    }

    @Test
    @DisplayName("An unreadable image file should fail before sending")
    void missingImageFileShouldFail(@TempDir Path dir) {
        assertThatThrownBy(() -> items.addImageFromFile("articles", "abc", "logo", dir.resolve("missing.png")))
                .isInstanceOf(CollectionClientException.class)
                .hasMessageContaining("missing.png");
        assertThat(server.getRequests()).isEmpty();
    }

    @Test
    @DisplayName("Item ids should be encoded as path segments")
    void shouldEncodeItemIdAsPathSegment() {
        items.getItem("articles", "my item+1");

        assertThat(lastRequest().path()).isEqualTo("/collection/articles/items/my%20item%2B1");
    }

    @Test
    @DisplayName("Should reject blank item ids before sending")
    void shouldRejectBlankItemId() {
        assertThatThrownBy(() -> items.getItem("articles", " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(server.getRequests()).isEmpty();
    }
}
