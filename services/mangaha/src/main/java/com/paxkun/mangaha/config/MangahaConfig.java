package com.paxkun.mangaha.config;

import com.paxkun.mangaha.service.download.DocumentAssembler;
import com.paxkun.mangaha.service.download.DownloadSettings;
import com.paxkun.mangaha.service.download.PdfDocumentAssembler;
import com.paxkun.mangaha.service.fetch.HttpFetchClient;
import com.paxkun.mangaha.service.fetch.RetryPolicy;
import com.paxkun.mangaha.service.scrape.SearchResultsScraper;
import com.paxkun.mangaha.service.scrape.SeriesCatalogWalker;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wires the scraping components from {@code mangaha.*} properties.
 * Every property has a default, so an empty configuration targets the live site.
 */
@Configuration
public class MangahaConfig {

    @Value("${mangaha.site.base-url:https://azoramoon.com}")
    private String baseUrl;

    @Bean
    public RetryPolicy retryPolicy(
            @Value("${mangaha.http.max-attempts:3}") int maxAttempts,
            @Value("${mangaha.http.backoff-factor:0.3}") double backoffFactor,
            @Value("${mangaha.http.retry-statuses:500,502,504}") int[] retryStatuses) {
        Set<Integer> statuses = Arrays.stream(retryStatuses).boxed().collect(Collectors.toSet());
        return new RetryPolicy(maxAttempts, backoffFactor, statuses);
    }

    @Bean
    public HttpFetchClient httpFetchClient(
            RetryPolicy retryPolicy,
            @Value("${mangaha.http.timeout-seconds:10}") long timeoutSeconds,
            @Value("${mangaha.http.max-connections:50}") int maxConnections,
            @Value("${mangaha.http.max-in-memory-bytes:16777216}") int maxInMemoryBytes) {
        return new HttpFetchClient(retryPolicy, Duration.ofSeconds(timeoutSeconds), maxConnections, maxInMemoryBytes);
    }

    @Bean
    public SearchResultsScraper searchResultsScraper(HttpFetchClient httpFetchClient) {
        return new SearchResultsScraper(httpFetchClient, baseUrl);
    }

    @Bean
    public SeriesCatalogWalker seriesCatalogWalker(
            HttpFetchClient httpFetchClient,
            @Value("${mangaha.catalog.max-threads:5}") int maxThreads) {
        return new SeriesCatalogWalker(httpFetchClient, baseUrl, maxThreads);
    }

    @Bean
    public DocumentAssembler documentAssembler() {
        return new PdfDocumentAssembler();
    }

    @Bean
    public DownloadSettings downloadSettings(
            @Value("${mangaha.download.max-threads:6}") int maxThreads,
            @Value("${mangaha.http.image-timeout-seconds:15}") long imageTimeoutSeconds,
            @Value("${mangaha.download.work-dir:}") String workDir) {
        Path workRoot = workDir == null || workDir.isBlank() ? null : Path.of(workDir.trim());
        return new DownloadSettings(maxThreads, Duration.ofSeconds(imageTimeoutSeconds), workRoot);
    }
}
