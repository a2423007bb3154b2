package com.bageldb.client.config;

import com.bageldb.client.retrieval.ProgressListener;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a {@link com.bageldb.client.CollectionClient}.
 *
 * <p>Example usage:
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder("my-token")
 *     .maxConcurrency(4)
 *     .retryPolicy(new RetryPolicy(5, Duration.ofMillis(500)))
 *     .callDeadline(Duration.ofMinutes(2))
 *     .build();
 * }</pre>
 *
 * @param baseUrl root of the public API, without trailing slash
 * @param headers headers derived from the API token
 * @param maxConcurrency upper bound on in-flight page fetches in concurrent mode
 * @param retryPolicy retry behavior for transport failures
 * @param connectTimeout HTTP connect timeout
 * @param requestTimeout timeout of a single HTTP exchange
 * @param callDeadline optional upper bound for one whole retrieval call, may be null
 * @param progressListener receives page progress, never null
 */
public record ClientConfig(
        String baseUrl,
        RequestHeaders headers,
        int maxConcurrency,
        RetryPolicy retryPolicy,
        Duration connectTimeout,
        Duration requestTimeout,
        Duration callDeadline,
        ProgressListener progressListener
) {
    public static final String DEFAULT_BASE_URL = "https://api.bagelstudio.co/api/public";
    public static final int DEFAULT_MAX_CONCURRENCY = 10;

    public ClientConfig {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        Objects.requireNonNull(progressListener, "progressListener must not be null");
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, was " + maxConcurrency);
        }
        if (callDeadline != null && (callDeadline.isZero() || callDeadline.isNegative())) {
            throw new IllegalArgumentException("callDeadline must be positive");
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Default configuration against the public API endpoint.
     */
    public static ClientConfig defaults(String apiToken) {
        return builder(apiToken).build();
    }

    public static Builder builder(String apiToken) {
        return new Builder(RequestHeaders.forToken(apiToken));
    }

    public Optional<Duration> deadline() {
        return Optional.ofNullable(callDeadline);
    }

    public static final class Builder {
        private final RequestHeaders headers;
        private String baseUrl = DEFAULT_BASE_URL;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration callDeadline;
        private ProgressListener progressListener = ProgressListener.NONE;

        private Builder(RequestHeaders headers) {
            this.headers = headers;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder callDeadline(Duration callDeadline) {
            this.callDeadline = callDeadline;
            return this;
        }

        public Builder progressListener(ProgressListener progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(
                    baseUrl,
                    headers,
                    maxConcurrency,
                    retryPolicy,
                    connectTimeout,
                    requestTimeout,
                    callDeadline,
                    progressListener
            );
        }
    }
}
