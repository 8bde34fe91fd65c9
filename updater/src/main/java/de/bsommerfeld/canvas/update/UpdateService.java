package de.bsommerfeld.canvas.update;

import de.bsommerfeld.canvas.core.concurrent.DaemonExecutors;
import de.bsommerfeld.canvas.core.config.UpdateConfig;
import de.bsommerfeld.canvas.core.util.AppVersion;
import de.bsommerfeld.canvas.update.download.DownloadProgressListener;
import de.bsommerfeld.canvas.update.download.Downloader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

/**
 * Checks the release bucket for a newer version.
 *
 * <h3>Bucket layout</h3>
 *
 * <pre>
 * {baseUrl}/latest.txt             → "5.4.0"
 * {baseUrl}/v5.4.0/files.txt       → one "name" or "name|size" per line
 * {baseUrl}/v5.4.0/{name}          → the files themselves
 * </pre>
 *
 * <p>
 * A check is retried a few times on I/O errors. When every attempt fails the
 * returned future still completes normally, with an empty result, and the
 * last known version info is kept.
 */
public class UpdateService {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateService.class);

    static final Pattern VERSION_FORMAT = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    private static final int DEFAULT_ATTEMPTS = 3;
    private static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(2);

    private final String baseUrl;
    private final String currentVersion;
    private final int attempts;
    private final Duration retryDelay;
    private final Executor executor;

    private volatile VersionInfo lastChecked;

    public UpdateService(UpdateConfig config) {
        this(config.getBaseUrl(), AppVersion.release(), DEFAULT_ATTEMPTS, DEFAULT_RETRY_DELAY,
                DaemonExecutors.singleThread("update-check"));
    }

    UpdateService(String baseUrl, String currentVersion, int attempts, Duration retryDelay, Executor executor) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.currentVersion = currentVersion;
        this.attempts = Math.max(1, attempts);
        this.retryDelay = retryDelay;
        this.executor = executor;
    }

    public String getCurrentVersion() {
        return currentVersion;
    }

    /** The newer release found by the last successful check, if any. */
    public Optional<VersionInfo> lastCheckedVersionInfo() {
        return Optional.ofNullable(lastChecked);
    }

    /**
     * Looks for a release newer than the running one on a background thread.
     * Never completes exceptionally.
     */
    public CompletableFuture<Optional<VersionInfo>> checkForUpdates() {
        return CompletableFuture.supplyAsync(this::checkWithRetries, executor);
    }

    /**
     * Downloads every file of the release into the target directory. Blocks.
     *
     * @throws IOException if a download fails or a file name escapes the
     *                     target directory
     */
    public void download(VersionInfo info, Path targetDir, DownloadProgressListener listener) throws IOException {
        Path root = targetDir.toAbsolutePath().normalize();
        for (UpdateFileInfo file : info.files()) {
            Path target = root.resolve(file.fileName()).normalize();
            if (!target.startsWith(root)) {
                throw new IOException("Refusing to write outside " + root + ": " + file.fileName());
            }
            LOG.info("Downloading {} ({} bytes)", file.fileName(), file.size());
            Downloader.toFile(file.downloadUrl(), target, listener);
        }
    }

    private Optional<VersionInfo> checkWithRetries() {
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return checkOnce();
            } catch (IOException e) {
                LOG.warn("Update check attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                if (attempt < attempts && !pause()) {
                    break;
                }
            }
        }
        LOG.warn("Update check gave up after {} attempts", attempts);
        return Optional.empty();
    }

    private Optional<VersionInfo> checkOnce() throws IOException {
        String latest = Downloader.toString(baseUrl + "/latest.txt").trim();
        if (!VERSION_FORMAT.matcher(latest).matches()) {
            LOG.warn("Ignoring malformed latest version '{}'", latest);
            return Optional.empty();
        }
        if (!VersionComparator.isNewer(latest, currentVersion)) {
            LOG.info("Up to date ({}, latest {})", currentVersion, latest);
            lastChecked = null;
            return Optional.empty();
        }
        VersionInfo info = new VersionInfo(latest, fetchFiles(latest));
        lastChecked = info;
        LOG.info("Update available: {} -> {} ({} files)", currentVersion, latest, info.files().size());
        return Optional.of(info);
    }

    private List<UpdateFileInfo> fetchFiles(String version) {
        String releaseUrl = baseUrl + "/v" + version;
        try {
            return parseFileList(Downloader.toString(releaseUrl + "/files.txt"), releaseUrl);
        } catch (IOException e) {
            LOG.warn("No file list for {}: {}", version, e.getMessage());
            return List.of();
        }
    }

    static List<UpdateFileInfo> parseFileList(String content, String releaseUrl) {
        List<UpdateFileInfo> files = new ArrayList<>();
        for (String line : content.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String name = trimmed;
            long size = -1;
            int bar = trimmed.indexOf('|');
            if (bar >= 0) {
                name = trimmed.substring(0, bar).trim();
                try {
                    size = Long.parseLong(trimmed.substring(bar + 1).trim());
                } catch (NumberFormatException e) {
                    LOG.debug("Ignoring size of {}: {}", name, e.getMessage());
                }
            }
            if (!name.isEmpty()) {
                files.add(new UpdateFileInfo(name, releaseUrl + "/" + name, size));
            }
        }
        return files;
    }

    private boolean pause() {
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
