package com.paxkun.mangaha.service.scrape;

import com.paxkun.mangaha.service.fetch.HttpFetchClient;
import com.paxkun.mangaha.service.model.ChapterLatest;
import com.paxkun.mangaha.service.model.MangaSearchResult;
import com.paxkun.mangaha.service.model.SearchPage;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SearchResultsScraper runs the site's title search and maps each result card
 * to a {@link MangaSearchResult}.
 * <p>
 * Only the requested page is fetched; {@link SearchPage#getPages()} tells the caller
 * how many more there are.
 * <p>
 * Author: Pax
 */
@Slf4j
public class SearchResultsScraper {

    public static final int MAX_RESULTS_PER_PAGE = 12;

    private static final String RESULT_COUNT = "h1";
    private static final String RESULT_NODE = "div.row.c-tabs-item__content";
    private static final String COVER_LINK = "div.c-image-hover a";
    private static final String COVER_IMAGE = "div.c-image-hover a img";
    private static final String HEADING_LINK = "h3 a, h4 a";
    private static final String GENRES = "div.mg_genres div.summary-content a";
    private static final String STATUS = "div.mg_status div.summary-content";
    private static final String RATE = "span.total_votes";
    private static final String LATEST_CHAPTER = "div.latest-chap a";

    private final HttpFetchClient fetchClient;
    private final String baseUrl;

    public SearchResultsScraper(HttpFetchClient fetchClient, String baseUrl) {
        this.fetchClient = fetchClient;
        this.baseUrl = SiteUrls.trimTrailingSlash(baseUrl);
    }

    public SearchPage search(String query) {
        return search(query, 1);
    }

    /**
     * Fetches one page of results for {@code query}.
     *
     * @param page 1-based result page
     * @throws IllegalArgumentException if the query is blank or the page is below 1
     * @throws com.paxkun.mangaha.service.fetch.NetworkException if the page cannot be fetched
     */
    public SearchPage search(String query, int page) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        if (page < 1) {
            throw new IllegalArgumentException("Search page must be 1 or greater, got " + page);
        }

        String url = pageUrl(page);
        Map<String, String> params = new LinkedHashMap<>();
        params.put("s", query);
        params.put("post_type", "wp-manga");

        log.debug("🔍 Searching '{}' page {} at {}", query, page, url);
        Document document = fetchClient.fetchDocument(url, params);
        Elements nodes = document.select(RESULT_NODE);

        int resultCount = readResultCount(document, nodes.size(), url);
        int pages = pageCount(resultCount);

        List<MangaSearchResult> results = new ArrayList<>();
        for (Element node : nodes) {
            results.add(toResult(node, url));
        }

        log.info("🔍 Found {} result(s) across {} page(s) for '{}' (page {} has {})",
                resultCount, pages, query, page, results.size());
        return new SearchPage(query, page, resultCount, pages, results);
    }

    /**
     * Number of result pages for a total, {@code ceil(resultCount / 12)}. Zero results give zero pages.
     */
    public static int pageCount(int resultCount) {
        if (resultCount <= 0) {
            return 0;
        }
        return (resultCount + MAX_RESULTS_PER_PAGE - 1) / MAX_RESULTS_PER_PAGE;
    }

    String pageUrl(int page) {
        return page == 1 ? baseUrl + "/" : baseUrl + "/page/" + page + "/";
    }

    private int readResultCount(Document document, int nodesOnPage, String url) {
        Optional<Integer> count = HtmlNodes.text(document, RESULT_COUNT).flatMap(HtmlNodes::leadingInteger);
        if (count.isPresent()) {
            return count.get();
        }
        if (nodesOnPage > 0) {
            log.warn("⚠️ No result count heading on {}, falling back to {} result(s) on this page", url, nodesOnPage);
        }
        return nodesOnPage;
    }

    private MangaSearchResult toResult(Element node, String source) {
        Optional<String> title = HtmlNodes.attr(node, COVER_LINK, "title")
                .or(() -> HtmlNodes.text(node, HEADING_LINK));

        return MangaSearchResult.builder()
                .url(HtmlNodes.orEmpty(HtmlNodes.url(node, COVER_LINK, "href")
                        .or(() -> HtmlNodes.url(node, HEADING_LINK, "href")), "url", source))
                .title(HtmlNodes.orEmpty(title, "title", source))
                .poster(HtmlNodes.orEmpty(HtmlNodes.url(node, COVER_IMAGE, "src", "data-src"), "poster", source))
                .genres(HtmlNodes.texts(node, GENRES))
                .status(HtmlNodes.orEmpty(HtmlNodes.text(node, STATUS), "status", source))
                .rate(HtmlNodes.orEmpty(HtmlNodes.text(node, RATE), "rate", source))
                .latestChapter(readLatestChapter(node, source))
                .build();
    }

    private ChapterLatest readLatestChapter(Element node, String source) {
        Element link = node.selectFirst(LATEST_CHAPTER);
        if (link == null) {
            log.warn("⚠️ Missing 'latest chapter' on {}, using empty value", source);
            return ChapterLatest.empty();
        }
        String url = HtmlNodes.absUrl(link, "href").orElse("");
        return new ChapterLatest(url, link.text().trim());
    }
}
