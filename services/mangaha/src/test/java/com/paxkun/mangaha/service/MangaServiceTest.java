package com.paxkun.mangaha.service;

import com.paxkun.mangaha.service.download.ChapterImagesScraper;
import com.paxkun.mangaha.service.download.DocumentAssembler;
import com.paxkun.mangaha.service.download.DownloadException;
import com.paxkun.mangaha.service.download.DownloadSettings;
import com.paxkun.mangaha.service.fetch.HttpFetchClient;
import com.paxkun.mangaha.service.model.ChapterImage;
import com.paxkun.mangaha.service.model.MangaDetails;
import com.paxkun.mangaha.service.model.SearchPage;
import com.paxkun.mangaha.service.scrape.MangaDetailsScraper;
import com.paxkun.mangaha.service.scrape.SearchResultsScraper;
import com.paxkun.mangaha.service.scrape.SeriesCatalogWalker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MangaServiceTest {

    private static final String CHAPTER_URL = "https://azoramoon.com/series/solo-leveling/chapter-1/";

    @Mock
    private HttpFetchClient fetchClient;

    @Mock
    private SearchResultsScraper searchScraper;

    @Mock
    private SeriesCatalogWalker catalogWalker;

    @Mock
    private DocumentAssembler assembler;

    @Mock
    private LoggerService loggerService;

    @Mock
    private MangaDetailsScraper detailsScraper;

    @Mock
    private ChapterImagesScraper chapterScraper;

    @TempDir
    Path downloadsRoot;

    private TestableMangaService mangaService;

    @BeforeEach
    void setUp() {
        mangaService = new TestableMangaService(fetchClient, searchScraper, catalogWalker, assembler,
                DownloadSettings.defaults(), loggerService, detailsScraper, chapterScraper);
    }

    @Test
    void searchDelegatesToSearchScraper() {
        SearchPage page = new SearchPage("solo", 2, 14, 2, List.of());
        when(searchScraper.search("solo", 2)).thenReturn(page);

        assertThat(mangaService.search("solo", 2)).isSameAs(page);
        verify(loggerService).info(eq("SEARCH"), contains("14 result(s)"));
    }

    @Test
    void searchDefaultsToFirstPage() {
        SearchPage page = new SearchPage("solo", 1, 0, 0, List.of());
        when(searchScraper.search("solo", 1)).thenReturn(page);

        assertThat(mangaService.search("solo")).isSameAs(page);
    }

    @Test
    void detailsComeFromAScraperForThatTitle() {
        MangaDetails details = MangaDetails.builder().url("u").title("Solo Leveling").build();
        when(detailsScraper.getDetails()).thenReturn(details);

        assertThat(mangaService.getDetails("https://azoramoon.com/series/solo-leveling/")).isSameAs(details);
        assertThat(mangaService.lastDetailsUrl).isEqualTo("https://azoramoon.com/series/solo-leveling/");
    }

    @Test
    void chapterImagesComeFromTheChapterScraper() {
        List<ChapterImage> images = List.of(new ChapterImage(1, "https://cdn/01.jpg"));
        when(chapterScraper.getImages()).thenReturn(images);

        assertThat(mangaService.getChapterImages(CHAPTER_URL)).isEqualTo(images);
        assertThat(mangaService.lastChapterUrl).isEqualTo(CHAPTER_URL);
    }

    @Test
    void downloadToLibraryWritesUnderChaptersFolder() {
        when(loggerService.getDownloadsRoot()).thenReturn(downloadsRoot);

        Path saved = mangaService.downloadChapterToLibrary(CHAPTER_URL);

        assertThat(saved).isEqualTo(downloadsRoot.resolve("chapters").resolve("solo-leveling").resolve("chapter-1.pdf"));
        verify(chapterScraper).assembleDocument(saved);
        verify(loggerService).info(eq("DOWNLOAD"), contains("Saved chapter"));
    }

    @Test
    void downloadToLibraryNeedsADownloadsRoot() {
        when(loggerService.getDownloadsRoot()).thenReturn(null);

        assertThatThrownBy(() -> mangaService.downloadChapterToLibrary(CHAPTER_URL))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedDownloadIsLoggedAndRethrown() {
        DownloadException failure = new DownloadException("https://cdn/03.png", new RuntimeException("HTTP 502"));
        Path output = downloadsRoot.resolve("chapter-1.pdf");
        doThrow(failure).when(chapterScraper).assembleDocument(any(Path.class));

        assertThatThrownBy(() -> mangaService.downloadChapterAsDocument(CHAPTER_URL, output)).isSameAs(failure);
        verify(loggerService).error(eq("DOWNLOAD"), anyString(), eq(failure));
    }

    @Test
    void catalogEnumerationDelegatesToWalker() {
        when(catalogWalker.enumerate()).thenReturn(Set.of("a", "b"));
        when(catalogWalker.start(2)).thenReturn(Set.of("a"));

        assertThat(mangaService.enumerateCatalog()).containsExactlyInAnyOrder("a", "b");
        assertThat(mangaService.enumerateCatalog(2)).containsExactly("a");
    }

    @Test
    void libraryPathUsesTitleAndChapterSegments() {
        assertThat(MangaService.libraryPath(CHAPTER_URL)).isEqualTo(Path.of("solo-leveling", "chapter-1.pdf"));
        assertThat(MangaService.libraryPath("https://azoramoon.com/chapter-9")).isEqualTo(Path.of("chapter-9.pdf"));
        assertThat(MangaService.libraryPath("https://azoramoon.com/series/a%20b/ch:1/"))
                .isEqualTo(Path.of("a_b", "ch_1.pdf"));
    }

    @Test
    void libraryPathRejectsUrlsWithoutPath() {
        assertThatThrownBy(() -> MangaService.libraryPath("https://azoramoon.com/"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MangaService.libraryPath("not a url"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static class TestableMangaService extends MangaService {

        private final MangaDetailsScraper detailsScraper;
        private final ChapterImagesScraper chapterScraper;
        String lastDetailsUrl;
        String lastChapterUrl;

        TestableMangaService(HttpFetchClient fetchClient, SearchResultsScraper searchScraper,
                             SeriesCatalogWalker catalogWalker, DocumentAssembler assembler,
                             DownloadSettings downloadSettings, LoggerService logger,
                             MangaDetailsScraper detailsScraper, ChapterImagesScraper chapterScraper) {
            super(fetchClient, searchScraper, catalogWalker, assembler, downloadSettings, logger);
            this.detailsScraper = detailsScraper;
            this.chapterScraper = chapterScraper;
        }

        @Override
        protected MangaDetailsScraper newDetailsScraper(String mangaUrl) {
            lastDetailsUrl = mangaUrl;
            return detailsScraper;
        }

        @Override
        protected ChapterImagesScraper newChapterScraper(String chapterUrl) {
            lastChapterUrl = chapterUrl;
            return chapterScraper;
        }
    }
}
