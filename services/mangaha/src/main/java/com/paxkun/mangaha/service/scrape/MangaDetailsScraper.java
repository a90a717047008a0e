package com.paxkun.mangaha.service.scrape;

import com.paxkun.mangaha.service.fetch.HttpFetchClient;
import com.paxkun.mangaha.service.model.ChapterDetailed;
import com.paxkun.mangaha.service.model.MangaDetails;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * MangaDetailsScraper reads the metadata and chapter list of a single title page.
 * <p>
 * The page is downloaded once, on the first accessor call, and reused by every other
 * accessor of the same instance. Create one instance per title.
 * <p>
 * Author: Pax
 */
@Slf4j
public class MangaDetailsScraper {

    private static final String TITLE = "div.post-title h1";
    private static final String TITLE_FALLBACK = "h1";
    private static final String POSTER = "div.summary_image a img";
    private static final String DESCRIPTION = "div.manga-summary";
    private static final String DESCRIPTION_FALLBACK = "div.summary__content";
    private static final String GENRES = "div.genres-content a";
    private static final String STATUS = "div.post-status div.summary-content";
    private static final String STATUS_FALLBACK = "div.summary-content div.tags-content";
    private static final String RATE = "span#averagerate";
    private static final String CHAPTER_ROW = "li.wp-manga-chapter";
    private static final String CHAPTER_LINK = "a";

    @Getter
    private final String mangaUrl;
    private final HttpFetchClient fetchClient;

    private Document page;

    public MangaDetailsScraper(HttpFetchClient fetchClient, String mangaUrl) {
        if (mangaUrl == null || mangaUrl.isBlank()) {
            throw new IllegalArgumentException("Manga URL must not be blank");
        }
        this.fetchClient = fetchClient;
        this.mangaUrl = mangaUrl;
    }

    /**
     * Returns the title page, fetching it on the first call.
     *
     * @throws com.paxkun.mangaha.service.fetch.NetworkException if the page cannot be fetched
     */
    public synchronized Document getPage() {
        if (page == null) {
            log.debug("📄 Fetching title page {}", mangaUrl);
            page = fetchClient.fetchDocument(mangaUrl);
        }
        return page;
    }

    public String getTitle() {
        Optional<String> title = HtmlNodes.text(getPage(), TITLE)
                .or(() -> HtmlNodes.text(getPage(), TITLE_FALLBACK));
        return HtmlNodes.orEmpty(title, "title", mangaUrl);
    }

    public String getPoster() {
        return HtmlNodes.orEmpty(HtmlNodes.url(getPage(), POSTER, "src", "data-src"), "poster", mangaUrl);
    }

    public String getDescription() {
        Optional<String> description = HtmlNodes.text(getPage(), DESCRIPTION)
                .or(() -> HtmlNodes.text(getPage(), DESCRIPTION_FALLBACK));
        return HtmlNodes.orEmpty(description, "description", mangaUrl);
    }

    public List<String> getGenres() {
        return HtmlNodes.texts(getPage(), GENRES);
    }

    public String getStatus() {
        Optional<String> status = HtmlNodes.text(getPage(), STATUS)
                .or(() -> HtmlNodes.text(getPage(), STATUS_FALLBACK));
        return HtmlNodes.orEmpty(status, "status", mangaUrl);
    }

    public String getRate() {
        return HtmlNodes.orEmpty(HtmlNodes.text(getPage(), RATE), "rate", mangaUrl);
    }

    /**
     * Chapters in reading order, numbered from 1.
     * <p>
     * The site lists the newest chapter first, so rows are reversed before numbering.
     * Rows without a chapter link are skipped.
     */
    public List<ChapterDetailed> getChapters() {
        List<Element> rows = new ArrayList<>(getPage().select(CHAPTER_ROW));
        Collections.reverse(rows);

        List<ChapterDetailed> chapters = new ArrayList<>();
        int orderNo = 0;
        for (Element row : rows) {
            Element link = row.selectFirst(CHAPTER_LINK);
            Optional<String> url = link == null ? Optional.empty() : HtmlNodes.absUrl(link, "href");
            if (url.isEmpty()) {
                log.warn("⚠️ Skipping chapter row without a link on {}: '{}'", mangaUrl, row.text());
                continue;
            }
            chapters.add(new ChapterDetailed(++orderNo, url.get(), link.text().trim()));
        }

        log.info("📄 Found {} chapter(s) for {}", chapters.size(), mangaUrl);
        return Collections.unmodifiableList(chapters);
    }

    public MangaDetails getDetails() {
        return MangaDetails.builder()
                .url(mangaUrl)
                .title(getTitle())
                .poster(getPoster())
                .description(getDescription())
                .genres(getGenres())
                .status(getStatus())
                .rate(getRate())
                .chapters(getChapters())
                .build();
    }
}
