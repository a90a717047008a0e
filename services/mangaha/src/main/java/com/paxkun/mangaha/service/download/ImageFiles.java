package com.paxkun.mangaha.service.download;

import java.util.Locale;

/**
 * File name helpers for downloaded page images.
 */
public final class ImageFiles {

    public static final String FALLBACK_EXTENSION = "img";

    private ImageFiles() {
    }

    /**
     * Extension of the last path segment of {@code url}, without the dot and without any
     * query string or fragment. Everything after the segment's first dot counts, so
     * {@code archive.tar.gz} gives {@code tar.gz}. Directory URLs and names without a dot give "".
     */
    public static String extension(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String path = pathOf(url.trim());
        if (path.isEmpty() || path.endsWith("/")) {
            return "";
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.indexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * File name for page {@code orderNo}, zero-padded so names sort in reading order.
     */
    public static String pageFileName(int orderNo, String url) {
        String extension = extension(url);
        return String.format("%03d.%s", orderNo, extension.isEmpty() ? FALLBACK_EXTENSION : extension);
    }

    private static String pathOf(String url) {
        String stripped = url;
        int fragment = stripped.indexOf('#');
        if (fragment >= 0) {
            stripped = stripped.substring(0, fragment);
        }
        int query = stripped.indexOf('?');
        if (query >= 0) {
            stripped = stripped.substring(0, query);
        }
        int scheme = stripped.indexOf("://");
        if (scheme >= 0) {
            int slash = stripped.indexOf('/', scheme + 3);
            return slash < 0 ? "" : stripped.substring(slash);
        }
        return stripped;
    }
}
