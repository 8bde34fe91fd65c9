package de.bsommerfeld.canvas.ui.view.playback;

import de.bsommerfeld.canvas.core.event.Subscription;
import javafx.scene.media.Media;
import javafx.scene.media.MediaException;
import javafx.scene.media.MediaPlayer;
import javafx.scene.media.MediaView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * {@link VideoPlayer} backed by a JavaFX {@link MediaPlayer}. A new native
 * player is created per video; the {@link MediaView} stays the same.
 *
 * <p>
 * Must be used on the JavaFX Application Thread.
 */
public class FxVideoPlayer implements VideoPlayer {

    private static final Logger LOG = LoggerFactory.getLogger(FxVideoPlayer.class);

    private final MediaView view = new MediaView();
    private final List<Consumer<PlaybackStatus>> statusListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Double>> progressListeners = new CopyOnWriteArrayList<>();

    private MediaPlayer player;
    private PlaybackStatus status = PlaybackStatus.IDLE;
    private boolean disposed;

    public FxVideoPlayer() {
        view.setPreserveRatio(true);
    }

    public MediaView getView() {
        return view;
    }

    @Override
    public void play(Path video) {
        if (disposed) {
            throw new IllegalStateException("Video player has been disposed");
        }
        releasePlayer();

        MediaPlayer next;
        try {
            next = new MediaPlayer(new Media(video.toUri().toString()));
        } catch (MediaException e) {
            LOG.warn("Cannot play {}: {}", video, e.getMessage());
            changeStatus(PlaybackStatus.ERROR);
            return;
        }
        next.setOnPlaying(() -> changeStatus(PlaybackStatus.PLAYING));
        next.setOnPaused(() -> changeStatus(PlaybackStatus.PAUSED));
        next.setOnStopped(() -> changeStatus(PlaybackStatus.STOPPED));
        next.setOnEndOfMedia(() -> changeStatus(PlaybackStatus.FINISHED));
        next.setOnError(() -> {
            LOG.warn("Playback of {} failed", video, next.getError());
            changeStatus(PlaybackStatus.ERROR);
        });
        next.currentTimeProperty().addListener((obs, oldVal, newVal) -> {
            double seconds = newVal.toSeconds();
            for (Consumer<Double> listener : progressListeners) {
                listener.accept(seconds);
            }
        });

        player = next;
        view.setMediaPlayer(next);
        LOG.info("Playing {}", video);
        next.play();
    }

    @Override
    public void pause() {
        if (player != null) {
            player.pause();
        }
    }

    @Override
    public void stop() {
        if (player != null) {
            player.stop();
        }
    }

    @Override
    public PlaybackStatus getStatus() {
        return status;
    }

    @Override
    public Subscription onStatusChanged(Consumer<PlaybackStatus> listener) {
        statusListeners.add(listener);
        return () -> statusListeners.remove(listener);
    }

    @Override
    public Subscription onProgress(Consumer<Double> listener) {
        progressListeners.add(listener);
        return () -> progressListeners.remove(listener);
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        releasePlayer();
        statusListeners.clear();
        progressListeners.clear();
        LOG.debug("Video player disposed");
    }

    private void releasePlayer() {
        if (player != null) {
            view.setMediaPlayer(null);
            player.dispose();
            player = null;
        }
    }

    private void changeStatus(PlaybackStatus next) {
        status = next;
        for (Consumer<PlaybackStatus> listener : statusListeners) {
            listener.accept(next);
        }
    }
}
