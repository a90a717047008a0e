package com.paxkun.mangaha.service.fetch;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * HttpFetchClient is the single gateway to the source site.
 * <p>
 * One pooled {@link WebClient} is built on the first request and shared by every caller
 * until {@link #close()} disposes the pool. All fetches go through the {@link RetryPolicy}:
 * retryable statuses, connection failures and timeouts are retried with backoff, any other
 * HTTP error fails on the spot. When nothing more can be done a {@link NetworkException} is thrown.
 * <p>
 * Author: Pax
 */
@Slf4j
public class HttpFetchClient implements AutoCloseable {

    public static final String USER_AGENT = "mangaha-api/1.0 (+https://example.com)";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_CONNECTIONS = 50;
    public static final int DEFAULT_MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    private final RetryPolicy retryPolicy;
    private final Duration defaultTimeout;
    private final int maxConnections;
    private final int maxInMemoryBytes;

    private final Object lock = new Object();
    private volatile WebClient webClient;
    private ConnectionProvider connectionProvider;

    private Sleeper sleeper = delay -> Thread.sleep(delay.toMillis());

    public HttpFetchClient(RetryPolicy retryPolicy) {
        this(retryPolicy, DEFAULT_TIMEOUT, DEFAULT_MAX_CONNECTIONS, DEFAULT_MAX_IN_MEMORY_BYTES);
    }

    public HttpFetchClient(RetryPolicy retryPolicy, Duration defaultTimeout, int maxConnections, int maxInMemoryBytes) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout);
        this.maxConnections = maxConnections;
        this.maxInMemoryBytes = maxInMemoryBytes;
    }

    public byte[] fetchBytes(String url) {
        return fetchBytes(url, Map.of(), defaultTimeout);
    }

    /**
     * Fetches the raw response body of a GET request.
     *
     * @param url     absolute URL
     * @param params  query parameters appended to the URL, may be empty
     * @param timeout limit for one attempt, not for the whole retry sequence
     * @return response body, empty when the server sent none
     * @throws NetworkException once the retry policy gives up
     */
    public byte[] fetchBytes(String url, Map<String, String> params, Duration timeout) {
        URI uri = toUri(url, params);
        for (int attempt = 1; ; attempt++) {
            String reason;
            int status = NetworkException.NO_STATUS;
            Throwable failure;
            try {
                return execute(uri, timeout);
            } catch (WebClientResponseException e) {
                status = e.getStatusCode().value();
                if (!retryPolicy.isRetryableStatus(status)) {
                    throw new NetworkException(url, attempt, status, "HTTP " + status, e);
                }
                reason = "HTTP " + status;
                failure = e;
            } catch (WebClientRequestException e) {
                reason = "connection failed (" + e.getMostSpecificCause().getMessage() + ")";
                failure = e;
            } catch (RuntimeException e) {
                Throwable cause = Exceptions.unwrap(e);
                if (cause instanceof TimeoutException) {
                    reason = "timed out after " + timeout.toMillis() + "ms";
                } else if (cause instanceof IOException) {
                    reason = "connection failed (" + cause.getMessage() + ")";
                } else if (cause instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    throw new NetworkException(url, attempt, status, "interrupted", cause);
                } else {
                    throw new NetworkException(url, attempt, status, String.valueOf(cause.getMessage()), cause);
                }
                failure = cause;
            }

            if (!retryPolicy.canRetry(attempt)) {
                log.error("❌ Giving up on {} after {} attempt(s): {}", url, attempt, reason);
                throw new NetworkException(url, attempt, status, reason, failure);
            }
            Duration delay = retryPolicy.backoffAfter(attempt);
            log.warn("⚠️ {} for {} (attempt {}/{}), retrying in {}ms",
                    reason, url, attempt, retryPolicy.getMaxAttempts(), delay.toMillis());
            pause(url, attempt, status, delay);
        }
    }

    public Document fetchDocument(String url) {
        return fetchDocument(url, Map.of(), defaultTimeout);
    }

    public Document fetchDocument(String url, Map<String, String> params) {
        return fetchDocument(url, params, defaultTimeout);
    }

    /**
     * Fetches a page and parses it with jsoup. The request URL becomes the document's base URI
     * so relative links resolve through {@code absUrl}.
     *
     * @throws NetworkException once the retry policy gives up
     */
    public Document fetchDocument(String url, Map<String, String> params, Duration timeout) {
        byte[] body = fetchBytes(url, params, timeout);
        try {
            return Jsoup.parse(new ByteArrayInputStream(body), null, url);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse document from " + url, e);
        }
    }

    /**
     * Releases the connection pool. A later fetch builds a fresh client.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (connectionProvider != null) {
                connectionProvider.dispose();
                log.info("🔌 HTTP connection pool disposed");
            }
            connectionProvider = null;
            webClient = null;
        }
    }

    boolean isInitialized() {
        return webClient != null;
    }

    void setSleeper(Sleeper sleeper) {
        this.sleeper = Objects.requireNonNull(sleeper);
    }

    private byte[] execute(URI uri, Duration timeout) {
        byte[] body = client().get()
                .uri(uri)
                .retrieve()
                .bodyToMono(byte[].class)
                .timeout(timeout)
                .block();
        return body != null ? body : new byte[0];
    }

    private WebClient client() {
        WebClient current = webClient;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            if (webClient == null) {
                connectionProvider = ConnectionProvider.builder("mangaha-fetch")
                        .maxConnections(maxConnections)
                        .build();
                HttpClient httpClient = HttpClient.create(connectionProvider).followRedirect(true);
                webClient = WebClient.builder()
                        .clientConnector(new ReactorClientHttpConnector(httpClient))
                        .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemoryBytes))
                        .build();
                log.info("🌐 HTTP client initialized | maxConnections={} | maxAttempts={} | backoffFactor={}",
                        maxConnections, retryPolicy.getMaxAttempts(), retryPolicy.getBackoffFactor());
            }
            return webClient;
        }
    }

    private void pause(String url, int attempt, int status, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(url, attempt, status, "interrupted during backoff", e);
        }
    }

    private static URI toUri(String url, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            try {
                return URI.create(url);
            } catch (IllegalArgumentException e) {
                return UriComponentsBuilder.fromUriString(url).build().encode().toUri();
            }
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        params.forEach((name, value) -> builder.queryParam(name, value));
        return builder.build().encode().toUri();
    }

    /**
     * Waits out a backoff delay. Replaced in tests to avoid real sleeps.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }
}
