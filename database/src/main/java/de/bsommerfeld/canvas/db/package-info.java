/**
 * SQLite persistence for the media library and the projection history.
 *
 * <h2>Databases</h2>
 * Two files live in the app-data directory, each held open by one
 * {@link de.bsommerfeld.canvas.db.SqliteDatabase} in WAL mode:
 * <ul>
 * <li>{@code canvas.db} (primary): {@code folders} and {@code media_files},
 * schema {@code schema/library.sql}</li>
 * <li>{@code history.db} (secondary): {@code history_entries}, schema
 * {@code schema/history.sql}</li>
 * </ul>
 * On shutdown the secondary is checkpointed and closed first, then the
 * primary. In TEST mode both are in-memory.
 *
 * <h2>Layers</h2>
 *
 * <pre>
 *   [Desktop]
 *       │
 *       ▼
 *   ImportService ── HistoryLog
 *       │                │
 *       ▼                │
 *   MediaLibrary         │
 *       │                │
 *       ▼                ▼
 *   SqlMediaLibrary   SqliteDatabase(history)
 *       │
 *       ▼
 *   SqliteDatabase(library)
 * </pre>
 *
 * All statements are externalized to {@code sql/*.sql} and loaded through
 * {@link de.bsommerfeld.canvas.db.SqlLoader}.
 */
package de.bsommerfeld.canvas.db;
