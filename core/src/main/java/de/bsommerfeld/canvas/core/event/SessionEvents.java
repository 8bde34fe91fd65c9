package de.bsommerfeld.canvas.core.event;

/**
 * Events shared between the session, library and window layers.
 * Only events that more than one module produces or consumes belong here.
 */
public class SessionEvents {

    /**
     * Fired after a login succeeds and after the session is torn down.
     * {@code username} is {@code null} when {@code authenticated} is false.
     */
    public record AuthenticationChangedEvent(boolean authenticated, String username) {
    }

    /** Fired on the UI thread once an import has been applied to the library. */
    public record MediaImportedEvent(int newFiles, int existingFiles) {
    }

    /** Fired when the update check finds a version newer than the running one. */
    public record UpdateAvailableEvent(String version) {
    }
}
