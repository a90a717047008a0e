package com.paxkun.mangaha.service.model;

import lombok.Value;

/**
 * One entry of a title's chapter list.
 * <p>
 * {@code orderNo} is the 1-based reading position (oldest chapter first).
 */
@Value
public class ChapterDetailed {

    int orderNo;
    String url;
    String title;
}
