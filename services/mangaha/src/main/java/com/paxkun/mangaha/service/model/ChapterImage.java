package com.paxkun.mangaha.service.model;

import lombok.Value;

/**
 * A page image of a chapter, numbered 1..n in display order.
 */
@Value
public class ChapterImage {

    int orderNo;
    String url;
}
