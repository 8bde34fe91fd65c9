package de.bsommerfeld.canvas.update;

import java.util.List;

/**
 * A release newer than the running application.
 */
public record VersionInfo(String version, List<UpdateFileInfo> files) {

    public VersionInfo {
        files = List.copyOf(files);
    }

    /** Sum of known file sizes. */
    public long totalSize() {
        long total = 0;
        for (UpdateFileInfo file : files) {
            if (file.size() > 0) {
                total += file.size();
            }
        }
        return total;
    }
}
