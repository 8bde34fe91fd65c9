package de.bsommerfeld.canvas.ui.view.main;

import de.bsommerfeld.canvas.auth.AuthSession;
import de.bsommerfeld.canvas.core.config.GlobalConfig;
import de.bsommerfeld.canvas.core.event.Subscription;
import de.bsommerfeld.canvas.core.lifecycle.ShutdownSequence;
import de.bsommerfeld.canvas.db.HistoryLog;
import de.bsommerfeld.canvas.db.SqliteDatabase;
import de.bsommerfeld.canvas.ui.input.HotKeys;
import de.bsommerfeld.canvas.ui.monitor.FrameRateMonitor;
import de.bsommerfeld.canvas.ui.view.playback.VideoPlayer;
import de.bsommerfeld.canvas.ui.view.projection.ProjectionScreen;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Teardown of the main window, in this order:
 *
 * <ol>
 * <li>capture the window layout and save the configuration</li>
 * <li>detach video listeners</li>
 * <li>stop and dispose the video player</li>
 * <li>close the projection screen</li>
 * <li>release hotkeys</li>
 * <li>stop the frame-rate monitor</li>
 * <li>close the auth session</li>
 * <li>persist or clear the history, depending on {@code save-history}</li>
 * <li>wait for a running import, then checkpoint and close the history
 * database and the library database</li>
 * </ol>
 *
 * Collaborators are looked up when the sequence runs, so ones the window
 * never created are skipped.
 */
public final class MainWindowShutdown {

    private static final Logger LOG = LoggerFactory.getLogger(MainWindowShutdown.class);

    static final String SAVE_SETTINGS = "save-settings";
    static final String DETACH_VIDEO_LISTENERS = "detach-video-listeners";
    static final String DISPOSE_VIDEO_PLAYER = "dispose-video-player";
    static final String CLOSE_PROJECTION = "close-projection";
    static final String RELEASE_HOTKEYS = "release-hotkeys";
    static final String STOP_FRAME_RATE_MONITOR = "stop-frame-rate-monitor";
    static final String CLOSE_AUTH_SESSION = "close-auth-session";
    static final String FLUSH_HISTORY = "flush-history";
    static final String CLOSE_DATABASES = "checkpoint-databases";

    static final Duration IMPORT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    /** What the main window owns at close time. Any getter may return {@code null}. */
    public interface Resources {

        GlobalConfig config();

        /** Copies live window state, like the divider position, into the config. */
        void captureSettings();

        List<Subscription> videoSubscriptions();

        VideoPlayer videoPlayer();

        ProjectionScreen projection();

        HotKeys hotKeys();

        FrameRateMonitor frameRateMonitor();

        AuthSession authSession();

        HistoryLog history();

        ImportController importController();

        SqliteDatabase historyDatabase();

        SqliteDatabase libraryDatabase();
    }

    private MainWindowShutdown() {
    }

    public static ShutdownSequence create(Resources resources) {
        return new ShutdownSequence("Main window")
                .stepFor(SAVE_SETTINGS, resources::config, config -> {
                    try {
                        resources.captureSettings();
                    } finally {
                        config.save();
                    }
                })
                .stepFor(DETACH_VIDEO_LISTENERS, resources::videoSubscriptions, MainWindowShutdown::detachAll)
                .stepFor(DISPOSE_VIDEO_PLAYER, resources::videoPlayer, player -> {
                    try {
                        player.stop();
                    } finally {
                        player.dispose();
                    }
                })
                .stepFor(CLOSE_PROJECTION, resources::projection, ProjectionScreen::close)
                .stepFor(RELEASE_HOTKEYS, resources::hotKeys, HotKeys::close)
                .stepFor(STOP_FRAME_RATE_MONITOR, resources::frameRateMonitor, monitor -> {
                    try {
                        monitor.stop();
                    } finally {
                        monitor.close();
                    }
                })
                .stepFor(CLOSE_AUTH_SESSION, resources::authSession, AuthSession::close)
                .stepFor(FLUSH_HISTORY, resources::history, history -> flushHistory(resources.config(), history))
                .step(CLOSE_DATABASES, () -> closeDatabases(resources.importController(),
                        resources.historyDatabase(), resources.libraryDatabase()));
    }

    private static void detachAll(List<Subscription> subscriptions) {
        RuntimeException failure = null;
        List<Subscription> snapshot = new ArrayList<>(subscriptions);
        for (Subscription subscription : snapshot) {
            try {
                subscription.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        subscriptions.clear();
        if (failure != null) {
            throw failure;
        }
    }

    private static void flushHistory(GlobalConfig config, HistoryLog history) {
        if (config == null || config.getHistory().isSaveHistory()) {
            history.persist();
        } else {
            history.clear();
        }
    }

    /**
     * Each database is checkpointed and closed on its own; a failure on the
     * first does not keep the second open.
     */
    private static void closeDatabases(ImportController imports, SqliteDatabase... databases) throws Exception {
        Exception failure = null;
        if (imports != null) {
            try {
                imports.shutdown(IMPORT_DRAIN_TIMEOUT);
            } catch (RuntimeException e) {
                LOG.warn("Failed to stop import worker: {}", e.getMessage());
                failure = e;
            }
        }
        for (SqliteDatabase database : databases) {
            if (database == null) {
                continue;
            }
            try {
                database.checkpointAndClose();
                LOG.debug("Database {} checkpointed and closed", database.getName());
            } catch (Exception e) {
                LOG.warn("Failed to close database {}: {}", database.getName(), e.getMessage());
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
