package de.bsommerfeld.canvas.db;

/**
 * Unchecked wrapper for {@link java.sql.SQLException}s that callers outside
 * this module cannot meaningfully recover from.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
