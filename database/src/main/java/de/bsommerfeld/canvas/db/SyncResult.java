package de.bsommerfeld.canvas.db;

/**
 * Number of media files added and removed while reconciling folders with disk.
 */
public record SyncResult(int added, int removed) {

    public static final SyncResult NONE = new SyncResult(0, 0);

    public SyncResult plus(SyncResult other) {
        return new SyncResult(added + other.added, removed + other.removed);
    }

    public boolean hasChanges() {
        return added > 0 || removed > 0;
    }
}
