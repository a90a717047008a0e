package com.paxkun.mangaha.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * LoggerService owns the downloads root and a tagged activity log kept under it.
 * <p>
 * Lines look like {@code 2024-05-01 12:00:00 [INFO] [TAG] message} and go both to
 * {@code logs/latest.log} and to the console. The previous log is archived on startup
 * and only the newest few archives are kept.
 */
@Slf4j
@Service
public class LoggerService implements InitializingBean {

    private static final String LATEST_LOG = "latest.log";
    private static final int MAX_LOGS = 5;
    private static final DateTimeFormatter FILE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    private static final DateTimeFormatter LOG_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Path CONTAINER_FALLBACK = Path.of("/app", "downloads");

    @Value("${mangaha.downloads.root:}")
    private String configuredRoot;

    private Path downloadsRoot;
    private Path logsPath;
    private BufferedWriter writer;

    @Override
    public void afterPropertiesSet() {
        downloadsRoot = initializeDownloadsRoot();
        if (downloadsRoot == null) {
            log.warn("⚠️ LoggerService initialized without a writable downloads root. Console output only.");
            return;
        }

        logsPath = downloadsRoot.resolve("logs");
        try {
            Files.createDirectories(logsPath);
        } catch (IOException e) {
            log.warn("⚠️ Failed to create logs directory at {}. Console output only.", logsPath.toAbsolutePath(), e);
            logsPath = null;
            return;
        }

        try {
            rotateLogs();
        } catch (IOException e) {
            log.warn("⚠️ Failed to rotate logs at {}. Keeping existing files.", logsPath.toAbsolutePath(), e);
        }

        Path latestLogPath = logsPath.resolve(LATEST_LOG);
        try {
            writer = Files.newBufferedWriter(latestLogPath, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            write("SYSTEM", "DOWNLOADS_ROOT", downloadsRoot.toAbsolutePath().toString());
            write("SYSTEM", "OS", System.getProperty("os.name") + " " + System.getProperty("os.version"));
            log.info("📝 LoggerService initialized. Logging to {}", latestLogPath.toAbsolutePath());
        } catch (IOException e) {
            log.warn("⚠️ Failed to open log file at {}. Console output only.", latestLogPath.toAbsolutePath(), e);
            writer = null;
        }
    }

    private Path initializeDownloadsRoot() {
        for (Candidate candidate : candidates()) {
            if (candidate.path == null) {
                continue;
            }
            try {
                Path created = createDirectories(candidate.path);
                log.info("📁 Using {} downloads root at {}", candidate.label, created.toAbsolutePath());
                return created;
            } catch (IOException e) {
                log.warn("⚠️ Failed to create {} downloads directory at {}. Trying the next location.",
                        candidate.label, candidate.path.toAbsolutePath(), e);
            }
        }
        log.warn("⚠️ Failed to determine a writable downloads root.");
        return null;
    }

    private List<Candidate> candidates() {
        List<Candidate> candidates = new ArrayList<>();
        candidates.add(new Candidate("configured", resolveConfiguredPath()));
        candidates.add(new Candidate("APPDATA", resolveAppDataDownloadsPath()));
        candidates.add(new Candidate("user home", resolveUserHomeDownloadsPath()));
        candidates.add(new Candidate("container", resolveContainerFallbackPath()));
        return candidates;
    }

    protected Path createDirectories(Path path) throws IOException {
        return Files.createDirectories(path);
    }

    protected Path resolveConfiguredPath() {
        if (configuredRoot != null && !configuredRoot.isBlank()) {
            return Path.of(configuredRoot.trim());
        }
        return null;
    }

    protected Path resolveAppDataDownloadsPath() {
        String appData = System.getenv("APPDATA");
        if (appData != null && !appData.isBlank()) {
            return Path.of(appData, "Mangaha", "downloads");
        }
        return null;
    }

    protected Path resolveUserHomeDownloadsPath() {
        String userHome = System.getProperty("user.home");
        if (userHome != null && !userHome.isBlank()) {
            return Path.of(userHome, ".mangaha", "downloads");
        }
        return Path.of(".mangaha", "downloads");
    }

    protected Path resolveContainerFallbackPath() {
        return CONTAINER_FALLBACK;
    }

    private void rotateLogs() throws IOException {
        Path latestLog = logsPath.resolve(LATEST_LOG);
        if (Files.exists(latestLog) && Files.size(latestLog) > 0) {
            Path archivedLog = logsPath.resolve(LocalDateTime.now().format(FILE_FORMATTER) + ".log");
            Files.move(latestLog, archivedLog, StandardCopyOption.REPLACE_EXISTING);
            log.info("🔄 Rotated log to {}", archivedLog.getFileName());
        }

        List<Path> archives;
        try (Stream<Path> files = Files.list(logsPath)) {
            archives = files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .filter(p -> !p.getFileName().toString().equals(LATEST_LOG))
                    .sorted(Comparator.comparingLong(this::getFileModifiedTime).reversed())
                    .collect(Collectors.toList());
        }
        for (Path stale : archives.subList(Math.min(MAX_LOGS - 1, archives.size()), archives.size())) {
            try {
                Files.delete(stale);
                log.info("🗑️ Deleted old log file: {}", stale.getFileName());
            } catch (IOException e) {
                log.warn("⚠️ Failed to delete old log file: {}", stale.getFileName(), e);
            }
        }
    }

    private long getFileModifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private synchronized void write(String level, String tag, String message) {
        String logLine = String.format("%s [%s] [%s] %s%n",
                LocalDateTime.now().format(LOG_FORMATTER), level, tag, message);
        if (writer != null) {
            try {
                writer.write(logLine);
                writer.flush();
            } catch (IOException e) {
                log.error("❌ Failed to write to log file", e);
                writer = null;
            }
        }
        System.out.print(logLine);
    }

    public void info(String tag, String message) {
        write("INFO", tag, message);
    }

    public void warn(String tag, String message) {
        write("WARN", tag, message);
    }

    public void error(String tag, String message, Throwable throwable) {
        write("ERROR", tag, message + " | Exception: " + throwable.getMessage());
    }

    public void debug(String tag, String message) {
        write("DEBUG", tag, message);
    }

    public Path getDownloadsRoot() {
        return downloadsRoot;
    }

    private static final class Candidate {
        private final String label;
        private final Path path;

        private Candidate(String label, Path path) {
            this.label = label;
            this.path = path;
        }
    }
}
