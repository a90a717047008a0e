package com.paxkun.mangaha.service.fetch;

import lombok.Getter;

/**
 * Raised when a request could not be completed: retries ran out, the server
 * answered with a non-retryable status, or the connection failed.
 */
@Getter
public class NetworkException extends RuntimeException {

    /** Marker for failures that never produced an HTTP status (timeouts, refused connections). */
    public static final int NO_STATUS = -1;

    private final String url;
    private final int attempts;
    private final int status;

    public NetworkException(String url, int attempts, int status, String reason, Throwable cause) {
        super("Failed to fetch " + url + " after " + attempts + " attempt(s): " + reason, cause);
        this.url = url;
        this.attempts = attempts;
        this.status = status;
    }
}
