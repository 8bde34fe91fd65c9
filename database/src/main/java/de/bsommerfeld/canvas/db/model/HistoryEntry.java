package de.bsommerfeld.canvas.db.model;

import java.time.Instant;

/**
 * One projected item in the history log.
 *
 * @param reference what was projected, usually a media file path
 * @param timestamp when it was projected
 */
public record HistoryEntry(String reference, Instant timestamp) {
}
