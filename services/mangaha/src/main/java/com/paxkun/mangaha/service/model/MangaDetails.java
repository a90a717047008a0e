package com.paxkun.mangaha.service.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Full metadata and chapter list of one title.
 */
@Value
@Builder
public class MangaDetails {

    String url;
    String title;
    String poster;
    String description;

    @Singular
    List<String> genres;

    String status;
    String rate;

    /** Chapters in ascending {@link ChapterDetailed#getOrderNo()} order. May be empty. */
    @Singular
    List<ChapterDetailed> chapters;
}
