package com.paxkun.mangaha.service.model;

import lombok.Value;

import java.util.List;

/**
 * One page of search results together with the totals reported by the site.
 */
@Value
public class SearchPage {

    String query;

    /** 1-based page number this result list came from. */
    int page;

    /** Total matches across all pages. */
    int resultCount;

    /** Number of result pages; 0 when nothing matched. */
    int pages;

    List<MangaSearchResult> results;

    public SearchPage(String query, int page, int resultCount, int pages, List<MangaSearchResult> results) {
        this.query = query;
        this.page = page;
        this.resultCount = resultCount;
        this.pages = pages;
        this.results = List.copyOf(results);
    }
}
