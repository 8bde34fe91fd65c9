package de.bsommerfeld.canvas.update.download;

/**
 * Callback for tracking download progress.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    DownloadProgressListener NONE = (bytesRead, totalBytes) -> {
    };

    /**
     * Called after every chunk.
     *
     * @param bytesRead  bytes transferred so far
     * @param totalBytes total expected size, or -1 if unknown
     */
    void onProgress(long bytesRead, long totalBytes);
}
