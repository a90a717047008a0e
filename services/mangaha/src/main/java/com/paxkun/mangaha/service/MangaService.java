package com.paxkun.mangaha.service;

import com.paxkun.mangaha.service.download.ChapterImagesScraper;
import com.paxkun.mangaha.service.download.DocumentAssembler;
import com.paxkun.mangaha.service.download.DownloadSettings;
import com.paxkun.mangaha.service.fetch.HttpFetchClient;
import com.paxkun.mangaha.service.model.ChapterImage;
import com.paxkun.mangaha.service.model.MangaDetails;
import com.paxkun.mangaha.service.model.SearchPage;
import com.paxkun.mangaha.service.scrape.MangaDetailsScraper;
import com.paxkun.mangaha.service.scrape.SearchResultsScraper;
import com.paxkun.mangaha.service.scrape.SeriesCatalogWalker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * MangaService is the entry point for callers: search, title details, chapter images,
 * chapter PDFs and the full catalog. Each call runs on the shared {@link HttpFetchClient}.
 */
@Service
@RequiredArgsConstructor
public class MangaService {

    private final HttpFetchClient fetchClient;
    private final SearchResultsScraper searchScraper;
    private final SeriesCatalogWalker catalogWalker;
    private final DocumentAssembler assembler;
    private final DownloadSettings downloadSettings;
    private final LoggerService logger;

    public SearchPage search(String query) {
        return search(query, 1);
    }

    public SearchPage search(String query, int page) {
        logger.debug("SEARCH", "Searching query=" + sanitizeForLog(query) + " | page=" + page);
        SearchPage result = searchScraper.search(query, page);
        logger.info("SEARCH", "🔍 " + result.getResultCount() + " result(s) for " + sanitizeForLog(query)
                + " | page " + page + "/" + result.getPages());
        return result;
    }

    public MangaDetails getDetails(String mangaUrl) {
        logger.debug("DETAILS", "Fetching details | url=" + sanitizeForLog(mangaUrl));
        MangaDetails details = newDetailsScraper(mangaUrl).getDetails();
        logger.info("DETAILS", "📄 " + details.getTitle() + " | chapters=" + details.getChapters().size());
        return details;
    }

    public List<ChapterImage> getChapterImages(String chapterUrl) {
        logger.debug("CHAPTER", "Listing images | url=" + sanitizeForLog(chapterUrl));
        return newChapterScraper(chapterUrl).getImages();
    }

    /**
     * Downloads a chapter and writes it as one PDF at {@code outputPath}.
     */
    public void downloadChapterAsDocument(String chapterUrl, Path outputPath) {
        logger.info("DOWNLOAD", "📥 Downloading chapter " + sanitizeForLog(chapterUrl) + " -> " + outputPath);
        try {
            newChapterScraper(chapterUrl).assembleDocument(outputPath);
        } catch (RuntimeException e) {
            logger.error("DOWNLOAD", "❌ Chapter download failed for " + sanitizeForLog(chapterUrl), e);
            throw e;
        }
        logger.info("DOWNLOAD", "📦 Saved chapter to " + outputPath);
    }

    /**
     * Downloads a chapter into the downloads root as {@code chapters/<title>/<chapter>.pdf}.
     *
     * @return path of the written PDF
     */
    public Path downloadChapterToLibrary(String chapterUrl) {
        Path target = getDownloadsRoot().resolve("chapters").resolve(libraryPath(chapterUrl));
        downloadChapterAsDocument(chapterUrl, target);
        return target;
    }

    public Set<String> enumerateCatalog() {
        logger.info("CATALOG", "🚀 Enumerating the full catalog");
        Set<String> links = catalogWalker.enumerate();
        logger.info("CATALOG", "📚 Catalog enumeration found " + links.size() + " title(s)");
        return links;
    }

    public Set<String> enumerateCatalog(int pagesToFetch) {
        logger.info("CATALOG", "🚀 Enumerating " + pagesToFetch + " catalog page(s)");
        Set<String> links = catalogWalker.start(pagesToFetch);
        logger.info("CATALOG", "📚 Catalog enumeration found " + links.size() + " title(s)");
        return links;
    }

    protected MangaDetailsScraper newDetailsScraper(String mangaUrl) {
        return new MangaDetailsScraper(fetchClient, mangaUrl);
    }

    protected ChapterImagesScraper newChapterScraper(String chapterUrl) {
        return new ChapterImagesScraper(fetchClient, assembler, chapterUrl, downloadSettings);
    }

    /**
     * Relative file for a chapter URL: the last two path segments, e.g.
     * {@code .../manga/solo-leveling/chapter-1/} gives {@code solo-leveling/chapter-1.pdf}.
     */
    public static Path libraryPath(String chapterUrl) {
        String path;
        try {
            path = URI.create(chapterUrl.trim()).getPath();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid chapter URL: " + chapterUrl, e);
        }
        List<String> segments = new ArrayList<>();
        if (path != null) {
            Arrays.stream(path.split("/"))
                    .map(segment -> segment.replaceAll("[^A-Za-z0-9._-]", "_"))
                    .filter(segment -> !segment.isBlank() && !segment.matches("\\.+"))
                    .forEach(segments::add);
        }
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Chapter URL has no path to name the file after: " + chapterUrl);
        }
        String chapter = segments.get(segments.size() - 1) + ".pdf";
        if (segments.size() == 1) {
            return Path.of(chapter);
        }
        return Path.of(segments.get(segments.size() - 2), chapter);
    }

    private Path getDownloadsRoot() {
        Path root = logger.getDownloadsRoot();
        if (root == null) {
            throw new IllegalStateException("LoggerService has not initialized the downloads root directory");
        }
        return root;
    }

    private String sanitizeForLog(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("[\\r\\n]", "").trim();
    }
}
