package com.paxkun.mangaha.service.scrape;

/**
 * URL helpers shared by the scrapers.
 */
public final class SiteUrls {

    private SiteUrls() {
    }

    public static String trimTrailingSlash(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Site base URL must not be blank");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
