package com.paxkun.mangaha.service.model;

import lombok.Value;

/**
 * The newest chapter link shown next to a search result.
 * Both fields are empty strings when the result card has no chapter link.
 */
@Value
public class ChapterLatest {

    String url;
    String title;

    public static ChapterLatest empty() {
        return new ChapterLatest("", "");
    }
}
