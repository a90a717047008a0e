package com.paxkun.mangaha.service.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A single card from the search results page.
 * Fields missing from the markup are empty strings, never {@code null}.
 */
@Value
@Builder
public class MangaSearchResult {

    String url;
    String title;
    String poster;

    /** Genre names in the order the card lists them. */
    @Singular
    List<String> genres;

    String status;

    /** Rating text as displayed, e.g. "4.5". Not guaranteed to be numeric. */
    String rate;

    ChapterLatest latestChapter;
}
