package com.paxkun.mangaha.service.scrape;

import com.paxkun.mangaha.Fixtures;
import com.paxkun.mangaha.service.fetch.HttpFetchClient;
import com.paxkun.mangaha.service.fetch.NetworkException;
import com.paxkun.mangaha.service.model.ChapterDetailed;
import com.paxkun.mangaha.service.model.MangaDetails;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MangaDetailsScraperTest {

    private static final String URL = "https://azoramoon.com/series/solo-leveling/";

    @Mock
    private HttpFetchClient fetchClient;

    @Test
    void readsFullDetailsInReadingOrder() {
        when(fetchClient.fetchDocument(URL)).thenReturn(Fixtures.document("details.html", URL));

        MangaDetails details = new MangaDetailsScraper(fetchClient, URL).getDetails();

        assertThat(details).isEqualTo(MangaDetails.builder()
                .url(URL)
                .title("Solo Leveling")
                .poster("https://azoramoon.com/wp-content/uploads/solo-leveling-193x278.jpg")
                .description("Ten years ago, gates appeared connecting our world to a world of monsters.")
                .genre("Action")
                .genre("Adventure")
                .genre("Fantasy")
                .status("Completed")
                .rate("4.8")
                .chapter(new ChapterDetailed(1, URL + "chapter-1/", "Chapter 1"))
                .chapter(new ChapterDetailed(2, URL + "chapter-2/", "Chapter 2"))
                .chapter(new ChapterDetailed(3, URL + "chapter-3/", "Chapter 3"))
                .chapter(new ChapterDetailed(4, URL + "chapter-4/", "Chapter 4"))
                .chapter(new ChapterDetailed(5, URL + "chapter-5/", "Chapter 5"))
                .build());
    }

    @Test
    void fetchesThePageOnlyOnce() {
        when(fetchClient.fetchDocument(URL)).thenReturn(Fixtures.document("details.html", URL));
        MangaDetailsScraper scraper = new MangaDetailsScraper(fetchClient, URL);

        scraper.getTitle();
        scraper.getChapters();
        scraper.getDetails();

        verify(fetchClient, times(1)).fetchDocument(URL);
    }

    @Test
    void sparsePageFallsBackAndSkipsRowsWithoutLinks() {
        String url = "https://azoramoon.com/series/unnamed/";
        when(fetchClient.fetchDocument(url)).thenReturn(Fixtures.document("details-sparse.html", url));

        MangaDetails details = new MangaDetailsScraper(fetchClient, url).getDetails();

        assertThat(details.getTitle()).isEqualTo("Unnamed Series");
        assertThat(details.getPoster()).isEmpty();
        assertThat(details.getDescription()).isEmpty();
        assertThat(details.getGenres()).isEmpty();
        assertThat(details.getStatus()).isEmpty();
        assertThat(details.getRate()).isEmpty();
        assertThat(details.getChapters()).containsExactly(
                new ChapterDetailed(1, url + "chapter-1/", "Chapter 1"),
                new ChapterDetailed(2, url + "chapter-3/", "Chapter 3"));
    }

    @Test
    void networkFailurePropagates() {
        NetworkException failure = new NetworkException(URL, 1, 404, "HTTP 404", null);
        when(fetchClient.fetchDocument(URL)).thenThrow(failure);

        assertThatThrownBy(() -> new MangaDetailsScraper(fetchClient, URL).getDetails()).isSameAs(failure);
    }

    @Test
    void timeoutOnEveryAttemptSurfacesOnceWithoutPartialRecord() {
        when(fetchClient.fetchDocument(URL))
                .thenThrow(new NetworkException(URL, 3, NetworkException.NO_STATUS, "timed out after 10000ms", null));
        MangaDetailsScraper scraper = new MangaDetailsScraper(fetchClient, URL);

        NetworkException e = catchThrowableOfType(scraper::getDetails, NetworkException.class);

        assertThat(e.getUrl()).isEqualTo(URL);
        assertThat(e.getAttempts()).isEqualTo(3);
        assertThat(e.getStatus()).isEqualTo(NetworkException.NO_STATUS);
        assertThat(e.getMessage()).contains(URL).contains("3 attempt(s)");
        verify(fetchClient, times(1)).fetchDocument(URL);
    }

    @Test
    void rejectsBlankUrl() {
        assertThatThrownBy(() -> new MangaDetailsScraper(fetchClient, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
