package com.paxkun.mangaha.controller;

import com.paxkun.mangaha.service.LoggerService;
import com.paxkun.mangaha.service.MangaService;
import com.paxkun.mangaha.service.model.ChapterImage;
import com.paxkun.mangaha.service.model.MangaDetails;
import com.paxkun.mangaha.service.model.SearchPage;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MangaController exposes search, title details, chapter images, chapter PDFs and the catalog over HTTP.
 *
 * Author: Pax
 */
@RestController
@RequestMapping("/v1/manga")
@RequiredArgsConstructor
public class MangaController {

    private final MangaService mangaService;
    private final LoggerService logger;

    /**
     * Health check endpoint for the harvester.
     *
     * @return Status message
     */
    @GetMapping("/health")
    public ResponseEntity<String> healthCheck() {
        return ResponseEntity.ok("Mangaha API is up and running!");
    }

    /**
     * Searches titles on the source site.
     *
     * @param query Free-text search.
     * @param page  1-based result page.
     * @return One page of results with the reported totals.
     */
    @GetMapping("/search")
    public ResponseEntity<SearchPage> search(
            @RequestParam String query,
            @RequestParam(defaultValue = "1") int page) {
        logger.debug("MANGA_CONTROLLER", "Search request | query=" + sanitizeForLog(query) + " | page=" + page);
        return ResponseEntity.ok(mangaService.search(query, page));
    }

    /**
     * Full metadata and chapter list for one title.
     *
     * @param url Title page URL.
     */
    @GetMapping("/details")
    public ResponseEntity<MangaDetails> details(@RequestParam String url) {
        logger.debug("MANGA_CONTROLLER", "Details request | url=" + sanitizeForLog(url));
        return ResponseEntity.ok(mangaService.getDetails(url));
    }

    /**
     * Page images of a chapter in reading order.
     *
     * @param url Chapter URL.
     */
    @GetMapping("/chapter/images")
    public ResponseEntity<List<ChapterImage>> chapterImages(@RequestParam String url) {
        logger.debug("MANGA_CONTROLLER", "Chapter images request | url=" + sanitizeForLog(url));
        return ResponseEntity.ok(mangaService.getChapterImages(url));
    }

    /**
     * Assembles a chapter into a PDF and returns it as an attachment.
     *
     * @param url Chapter URL.
     */
    @GetMapping("/chapter/pdf")
    public ResponseEntity<byte[]> chapterPdf(@RequestParam String url) throws IOException {
        logger.debug("MANGA_CONTROLLER", "Chapter PDF request | url=" + sanitizeForLog(url));
        Path pdf = Files.createTempFile("mangaha-", ".pdf");
        try {
            mangaService.downloadChapterAsDocument(url, pdf);
            byte[] body = Files.readAllBytes(pdf);
            String fileName = "chapter.pdf";
            Path libraryPath = libraryName(url);
            if (libraryPath != null) {
                fileName = libraryPath.getFileName().toString();
            }
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_PDF)
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            ContentDisposition.attachment().filename(fileName).build().toString())
                    .body(body);
        } finally {
            Files.deleteIfExists(pdf);
        }
    }

    /**
     * Saves a chapter PDF into the downloads root.
     *
     * @param url Chapter URL.
     * @return Path of the saved file.
     */
    @PostMapping("/chapter/download")
    public ResponseEntity<Map<String, String>> downloadChapter(@RequestParam String url) {
        logger.debug("MANGA_CONTROLLER", "Chapter download request | url=" + sanitizeForLog(url));
        Path saved = mangaService.downloadChapterToLibrary(url);
        return ResponseEntity.ok(Map.of("path", saved.toString()));
    }

    /**
     * Every title URL in the catalog.
     *
     * @param pages Number of index pages to walk; all pages when omitted.
     */
    @GetMapping("/catalog")
    public ResponseEntity<Set<String>> catalog(@RequestParam(required = false) Integer pages) {
        logger.debug("MANGA_CONTROLLER", "Catalog request | pages=" + (pages == null ? "all" : pages));
        Set<String> links = pages == null
                ? mangaService.enumerateCatalog()
                : mangaService.enumerateCatalog(pages);
        return ResponseEntity.ok(links);
    }

    private Path libraryName(String url) {
        try {
            return MangaService.libraryPath(url);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private String sanitizeForLog(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("[\\r\\n]", "").trim();
    }
}
