package com.paxkun.mangaha.service.download;

import com.paxkun.mangaha.service.fetch.HttpFetchClient;
import com.paxkun.mangaha.service.fetch.NetworkException;
import com.paxkun.mangaha.service.model.ChapterImage;
import com.paxkun.mangaha.service.scrape.HtmlNodes;
import com.paxkun.mangaha.service.support.AutoCloseableExecutor;
import com.paxkun.mangaha.service.support.TemporaryDirectory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * ChapterImagesScraper lists the page images of one chapter and turns them into a single document.
 * <p>
 * Images are downloaded into a scratch directory owned by this call alone. The directory is
 * removed whether assembly succeeds or fails, and the output file only appears once the whole
 * document has been written.
 * <p>
 * Author: Pax
 */
@Slf4j
public class ChapterImagesScraper {

    private static final String PAGE_IMAGE = "img.wp-manga-chapter-img";
    private static final String STAGING_NAME = "assembled.pdf";

    @Getter
    private final String chapterUrl;
    private final HttpFetchClient fetchClient;
    private final DocumentAssembler assembler;
    private final DownloadSettings settings;

    private List<ChapterImage> images;

    public ChapterImagesScraper(HttpFetchClient fetchClient, DocumentAssembler assembler, String chapterUrl) {
        this(fetchClient, assembler, chapterUrl, DownloadSettings.defaults());
    }

    public ChapterImagesScraper(HttpFetchClient fetchClient, DocumentAssembler assembler,
                                String chapterUrl, DownloadSettings settings) {
        if (chapterUrl == null || chapterUrl.isBlank()) {
            throw new IllegalArgumentException("Chapter URL must not be blank");
        }
        this.fetchClient = fetchClient;
        this.assembler = assembler;
        this.chapterUrl = chapterUrl;
        this.settings = settings;
    }

    /**
     * Page images in display order, numbered from 1. Fetched on the first call and reused afterwards.
     *
     * @throws NetworkException if the chapter page cannot be fetched
     */
    public synchronized List<ChapterImage> getImages() {
        if (images == null) {
            images = extractImages(fetchClient.fetchDocument(chapterUrl));
        }
        return images;
    }

    /**
     * Downloads every page image and writes them, in order, as one document at {@code outputPath}.
     *
     * @throws AssemblyException if the chapter has no images or the document cannot be written
     * @throws DownloadException if any image cannot be downloaded
     * @throws NetworkException  if the chapter page itself cannot be fetched
     */
    public void assembleDocument(Path outputPath) {
        List<ChapterImage> pages = getImages();
        if (pages.isEmpty()) {
            throw new AssemblyException("Chapter has no images to assemble: " + chapterUrl);
        }

        log.info("📥 Assembling {} page(s) from {} into {}", pages.size(), chapterUrl, outputPath);
        try (TemporaryDirectory workDir = TemporaryDirectory.create(settings.getWorkRoot(), "mangaha-chapter-")) {
            List<Path> files = downloadAll(pages, workDir.getPath());

            Path staging = workDir.getPath().resolve(STAGING_NAME);
            assembler.assemble(files, staging);
            moveIntoPlace(staging, outputPath);
        } catch (IOException e) {
            throw new AssemblyException("Could not prepare a working directory for " + chapterUrl, e);
        }
        log.info("📦 Saved {} ({} pages)", outputPath, pages.size());
    }

    private List<ChapterImage> extractImages(Document document) {
        List<ChapterImage> found = new ArrayList<>();
        int orderNo = 0;
        for (Element node : document.select(PAGE_IMAGE)) {
            Optional<String> url = HtmlNodes.absUrl(node, "src", "data-src");
            if (url.isEmpty()) {
                log.warn("⚠️ Skipping page image without a source on {}", chapterUrl);
                continue;
            }
            found.add(new ChapterImage(++orderNo, url.get()));
        }
        log.info("🖼️ Found {} page image(s) on {}", found.size(), chapterUrl);
        return Collections.unmodifiableList(found);
    }

    private List<Path> downloadAll(List<ChapterImage> pages, Path directory) {
        int workers = Math.min(settings.getMaxThreads(), pages.size());
        List<Future<Path>> pending = new ArrayList<>();

        try (AutoCloseableExecutor pool = AutoCloseableExecutor.fixed("chapter-download", workers)) {
            for (ChapterImage page : pages) {
                pending.add(pool.executor().submit(() -> downloadImage(page, directory)));
            }

            List<Path> files = new ArrayList<>();
            for (int i = 0; i < pending.size(); i++) {
                try {
                    files.add(pending.get(i).get());
                } catch (ExecutionException e) {
                    pending.forEach(future -> future.cancel(true));
                    throw asDownloadException(pages.get(i), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    pending.forEach(future -> future.cancel(true));
                    throw new DownloadException(pages.get(i).getUrl(), "Interrupted while downloading " + chapterUrl, e);
                }
            }
            return files;
        }
    }

    private Path downloadImage(ChapterImage page, Path directory) throws IOException {
        byte[] bytes = fetchClient.fetchBytes(page.getUrl(), Map.of(), settings.getImageTimeout());
        Path target = directory.resolve(ImageFiles.pageFileName(page.getOrderNo(), page.getUrl()));
        Files.write(target, bytes);
        log.debug("➕ Saved page {} ({} bytes) to {}", page.getOrderNo(), bytes.length, target);
        return target;
    }

    private DownloadException asDownloadException(ChapterImage page, Throwable cause) {
        if (cause instanceof DownloadException) {
            return (DownloadException) cause;
        }
        log.error("❌ Failed to download page {} of {}: {}", page.getOrderNo(), chapterUrl, cause.getMessage());
        return new DownloadException(page.getUrl(), cause);
    }

    private void moveIntoPlace(Path staging, Path outputPath) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.move(staging, outputPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new AssemblyException("Could not write document to " + outputPath + ": " + e.getMessage(), e);
        }
    }
}
