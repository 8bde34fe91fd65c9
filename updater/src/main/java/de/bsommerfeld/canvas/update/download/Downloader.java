package de.bsommerfeld.canvas.update.download;

import de.bsommerfeld.canvas.core.util.AppVersion;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * HTTP download helper built on {@link HttpClient}.
 *
 * <p>
 * Streams to a file with an atomic rename, or reads small payloads
 * ({@code latest.txt}, {@code files.txt}) into memory. Redirects are followed.
 */
public final class Downloader {

    private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(5);
    private static final String USER_AGENT = "canvas-presenter-updater/" + AppVersion.get();

    private static final HttpClient HTTP = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(15))
            .build();

    private Downloader() {
    }

    /**
     * Downloads a URL to the target file. Bytes go to a {@code .tmp} sibling
     * first, which is renamed onto the target once complete, so a partial
     * download never replaces an existing file.
     */
    public static void toFile(String url, Path target, DownloadProgressListener listener) throws IOException {
        HttpResponse<InputStream> response = send(url);
        long totalBytes = response.headers().firstValueAsLong("Content-Length").orElse(-1);

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try (InputStream in = response.body()) {
            transferWithProgress(in, temp, totalBytes, listener);
        }
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /** Downloads a URL entirely into memory. */
    public static byte[] toBytes(String url, DownloadProgressListener listener) throws IOException {
        HttpResponse<InputStream> response = send(url);
        long totalBytes = response.headers().firstValueAsLong("Content-Length").orElse(-1);
        try (InputStream in = response.body()) {
            return readWithProgress(in, totalBytes, listener);
        }
    }

    /** Downloads a small UTF-8 text resource. */
    public static String toString(String url) throws IOException {
        return new String(toBytes(url, DownloadProgressListener.NONE), StandardCharsets.UTF_8);
    }

    private static HttpResponse<InputStream> send(String url) throws IOException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(REQUEST_TIMEOUT)
                    .header("User-Agent", USER_AGENT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + url, e);
        }
        try {
            HttpResponse<InputStream> response = HTTP.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (!isSuccess(response.statusCode())) {
                response.body().close();
                throw new IOException("HTTP " + response.statusCode() + " for " + url);
            }
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Download interrupted: " + url, e);
        }
    }

    private static void transferWithProgress(InputStream in, Path target, long totalBytes,
            DownloadProgressListener listener) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            byte[] buffer = new byte[8192];
            long transferred = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                transferred += read;
                listener.onProgress(transferred, totalBytes);
            }
        }
    }

    private static byte[] readWithProgress(InputStream in, long totalBytes,
            DownloadProgressListener listener) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(totalBytes > 0 ? (int) totalBytes : 8192);
        byte[] chunk = new byte[8192];
        long transferred = 0;
        int read;
        while ((read = in.read(chunk)) != -1) {
            buffer.write(chunk, 0, read);
            transferred += read;
            listener.onProgress(transferred, totalBytes);
        }
        return buffer.toByteArray();
    }

    static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
