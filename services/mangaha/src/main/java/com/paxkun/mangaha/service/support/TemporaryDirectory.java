package com.paxkun.mangaha.service.support;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A scratch directory that is deleted, with everything in it, when closed.
 * Meant for try-with-resources so the directory goes away on every exit path.
 */
@Slf4j
public final class TemporaryDirectory implements AutoCloseable {

    @Getter
    private final Path path;

    private TemporaryDirectory(Path path) {
        this.path = path;
    }

    /**
     * Creates a new directory under {@code parent}, or under the system temp directory when
     * {@code parent} is {@code null}.
     */
    public static TemporaryDirectory create(Path parent, String prefix) throws IOException {
        Path directory;
        if (parent == null) {
            directory = Files.createTempDirectory(prefix);
        } else {
            Files.createDirectories(parent);
            directory = Files.createTempDirectory(parent, prefix);
        }
        log.debug("📂 Created temp directory {}", directory);
        return new TemporaryDirectory(directory);
    }

    @Override
    public void close() {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(path)) {
            entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("⚠️ Failed to list temp directory {} for cleanup: {}", path, e.getMessage());
            return;
        }
        for (Path entry : entries) {
            try {
                Files.deleteIfExists(entry);
            } catch (IOException e) {
                log.warn("⚠️ Failed to delete {}: {}", entry, e.getMessage());
            }
        }
        log.debug("🗑️ Deleted temp directory {}", path);
    }
}
