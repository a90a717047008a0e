package com.paxkun.mangaha.service.download;

import lombok.Getter;

/**
 * A chapter image could not be downloaded. The chapter's document was not written.
 */
@Getter
public class DownloadException extends RuntimeException {

    private final String url;

    public DownloadException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public DownloadException(String url, Throwable cause) {
        this(url, "Failed to download image " + url + ": " + cause.getMessage(), cause);
    }
}
