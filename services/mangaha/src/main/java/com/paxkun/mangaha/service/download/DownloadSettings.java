package com.paxkun.mangaha.service.download;

import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Tuning for chapter downloads.
 */
@Value
public class DownloadSettings {

    /** Concurrent image downloads per chapter. */
    int maxThreads;

    /** Per-attempt timeout for one image. */
    Duration imageTimeout;

    /** Parent of the per-chapter scratch directories; {@code null} means the system temp directory. */
    Path workRoot;

    public static DownloadSettings defaults() {
        return new DownloadSettings(6, Duration.ofSeconds(15), null);
    }
}
