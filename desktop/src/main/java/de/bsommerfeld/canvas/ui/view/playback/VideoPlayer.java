package de.bsommerfeld.canvas.ui.view.playback;

import de.bsommerfeld.canvas.core.event.Subscription;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Plays one video at a time. Listeners are attached through
 * {@link Subscription} handles so the owner can detach exactly what it
 * attached before disposing the player.
 */
public interface VideoPlayer {

    void play(Path video);

    void pause();

    void stop();

    PlaybackStatus getStatus();

    Subscription onStatusChanged(Consumer<PlaybackStatus> listener);

    /** Playback position in seconds, reported while playing. */
    Subscription onProgress(Consumer<Double> listener);

    /** Releases the native media resources. The player cannot be used afterwards. */
    void dispose();
}
