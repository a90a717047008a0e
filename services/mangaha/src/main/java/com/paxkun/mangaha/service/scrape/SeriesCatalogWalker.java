package com.paxkun.mangaha.service.scrape;

import com.paxkun.mangaha.service.fetch.HttpFetchClient;
import com.paxkun.mangaha.service.support.AutoCloseableExecutor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SeriesCatalogWalker collects the URL of every title listed in the site's series index.
 * <p>
 * Index pages are fetched by a fixed-size worker pool. {@link #start(int)} waits for every
 * page before merging, and a page that fails is logged and left out instead of failing the walk.
 * <p>
 * Author: Pax
 */
@Slf4j
public class SeriesCatalogWalker {

    public static final int DEFAULT_MAX_THREADS = 5;

    private static final String PAGINATION = "div.wp-pagenavi, nav.navigation, div.nav-links";
    private static final String LAST_PAGE_LINK = "a.last";
    private static final String PAGE_LINKS = "a, span";
    private static final String RESULT_COUNT = "div.h4";
    private static final String TITLE_LINK = "h3 a";
    private static final Pattern PAGE_IN_HREF = Pattern.compile("/page/(\\d+)");
    private static final Pattern PAGE_NUMBER = Pattern.compile("^\\d+$");

    private final HttpFetchClient fetchClient;
    private final String baseUrl;
    @Getter
    private final int maxThreads;

    public SeriesCatalogWalker(HttpFetchClient fetchClient, String baseUrl, int maxThreads) {
        if (maxThreads < 1) {
            throw new IllegalArgumentException("maxThreads must be at least 1, got " + maxThreads);
        }
        this.fetchClient = fetchClient;
        this.baseUrl = SiteUrls.trimTrailingSlash(baseUrl);
        this.maxThreads = maxThreads;
    }

    public String pageUrl(int page) {
        return baseUrl + "/series/page/" + page + "/";
    }

    /**
     * Reads the number of index pages from page 1.
     * <p>
     * The pagination control's last page wins; without one, the series count heading is
     * divided by the page size; with neither, the index is assumed to be a single page.
     */
    public int getTotalPages() {
        String url = pageUrl(1);
        Document document = fetchClient.fetchDocument(url);

        OptionalInt lastPage = lastPageFromPagination(document);
        if (lastPage.isPresent()) {
            log.info("📚 Catalog has {} page(s) according to pagination", lastPage.getAsInt());
            return lastPage.getAsInt();
        }

        Optional<Integer> count = HtmlNodes.text(document, RESULT_COUNT).flatMap(HtmlNodes::leadingInteger);
        if (count.isPresent()) {
            int pages = SearchResultsScraper.pageCount(count.get());
            log.info("📚 Catalog has {} series over {} page(s)", count.get(), pages);
            return pages;
        }

        log.warn("⚠️ No pagination or series count on {}, assuming a single page", url);
        return 1;
    }

    /**
     * Title URLs listed on one index page, in page order without duplicates.
     *
     * @throws com.paxkun.mangaha.service.fetch.NetworkException if the page cannot be fetched
     */
    public List<String> getLinks(int page) {
        String url = pageUrl(page);
        Document document = fetchClient.fetchDocument(url);

        Set<String> links = new LinkedHashSet<>();
        for (Element link : document.select(TITLE_LINK)) {
            HtmlNodes.absUrl(link, "href").ifPresent(links::add);
        }
        log.debug("🔗 Page {} listed {} title(s)", page, links.size());
        return List.copyOf(links);
    }

    /**
     * Fetches index pages {@code 1..pagesToFetch} concurrently and returns every distinct title URL.
     * Pages that fail are skipped, so the result holds whatever succeeded.
     */
    public Set<String> start(int pagesToFetch) {
        if (pagesToFetch <= 0) {
            return Collections.emptySet();
        }

        int workers = Math.min(maxThreads, pagesToFetch);
        log.info("🚀 Walking {} catalog page(s) with {} worker(s)", pagesToFetch, workers);

        Map<Integer, Future<List<String>>> pending = new LinkedHashMap<>();
        List<List<String>> pageResults = new ArrayList<>();
        List<Integer> failedPages = new ArrayList<>();

        try (AutoCloseableExecutor pool = AutoCloseableExecutor.fixed("catalog", workers)) {
            for (int page = 1; page <= pagesToFetch; page++) {
                int pageNumber = page;
                pending.put(pageNumber, pool.executor().submit(() -> getLinks(pageNumber)));
            }

            for (Map.Entry<Integer, Future<List<String>>> entry : pending.entrySet()) {
                try {
                    pageResults.add(entry.getValue().get());
                } catch (ExecutionException e) {
                    failedPages.add(entry.getKey());
                    log.warn("⚠️ Catalog page {} failed, skipping it: {}", entry.getKey(), e.getCause().getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    pending.values().forEach(future -> future.cancel(true));
                    throw new IllegalStateException("Interrupted while walking the catalog", e);
                }
            }
        }

        Set<String> links = new LinkedHashSet<>();
        pageResults.forEach(links::addAll);

        log.info("📚 Catalog walk finished | pages={} | failed={} | titles={}",
                pagesToFetch, failedPages.size(), links.size());
        return Collections.unmodifiableSet(links);
    }

    /**
     * Walks the whole catalog: {@code start(getTotalPages())}.
     */
    public Set<String> enumerate() {
        return start(getTotalPages());
    }

    private OptionalInt lastPageFromPagination(Document document) {
        Element pagination = document.selectFirst(PAGINATION);
        if (pagination == null) {
            return OptionalInt.empty();
        }

        Element last = pagination.selectFirst(LAST_PAGE_LINK);
        if (last != null) {
            OptionalInt fromHref = pageFromHref(last.attr("href"));
            if (fromHref.isPresent()) {
                return fromHref;
            }
        }

        int highest = 0;
        for (Element element : pagination.select(PAGE_LINKS)) {
            String text = element.text().trim().replace(",", "");
            if (PAGE_NUMBER.matcher(text).matches()) {
                highest = Math.max(highest, parsePage(text).orElse(0));
            }
            highest = Math.max(highest, pageFromHref(element.attr("href")).orElse(0));
        }
        return highest > 0 ? OptionalInt.of(highest) : OptionalInt.empty();
    }

    private static OptionalInt pageFromHref(String href) {
        if (href == null || href.isEmpty()) {
            return OptionalInt.empty();
        }
        Matcher matcher = PAGE_IN_HREF.matcher(href);
        return matcher.find() ? parsePage(matcher.group(1)) : OptionalInt.empty();
    }

    private static OptionalInt parsePage(String digits) {
        try {
            return OptionalInt.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            log.warn("⚠️ Ignoring out-of-range page number '{}'", digits);
            return OptionalInt.empty();
        }
    }
}
