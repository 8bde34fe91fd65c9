package de.bsommerfeld.canvas.ui.view.main;

import de.bsommerfeld.canvas.auth.AuthSession;
import de.bsommerfeld.canvas.core.config.GlobalConfig;
import de.bsommerfeld.canvas.core.config.HistoryConfig;
import de.bsommerfeld.canvas.core.event.Subscription;
import de.bsommerfeld.canvas.core.lifecycle.ShutdownReport;
import de.bsommerfeld.canvas.core.lifecycle.ShutdownSequence;
import de.bsommerfeld.canvas.core.lifecycle.StepResult;
import de.bsommerfeld.canvas.db.HistoryLog;
import de.bsommerfeld.canvas.db.SqliteDatabase;
import de.bsommerfeld.canvas.ui.input.HotKeys;
import de.bsommerfeld.canvas.ui.monitor.FrameRateMonitor;
import de.bsommerfeld.canvas.ui.view.playback.VideoPlayer;
import de.bsommerfeld.canvas.ui.view.projection.ProjectionScreen;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MainWindowShutdownTest {

    @Mock
    private GlobalConfig config;
    @Mock
    private Subscription statusSubscription;
    @Mock
    private Subscription progressSubscription;
    @Mock
    private VideoPlayer videoPlayer;
    @Mock
    private ProjectionScreen projection;
    @Mock
    private HotKeys hotKeys;
    @Mock
    private FrameRateMonitor frameRateMonitor;
    @Mock
    private AuthSession authSession;
    @Mock
    private HistoryLog history;
    @Mock
    private ImportController importController;
    @Mock
    private SqliteDatabase historyDatabase;
    @Mock
    private SqliteDatabase libraryDatabase;

    private final HistoryConfig historyConfig = new HistoryConfig();
    private TestResources resources;

    @BeforeEach
    void setUp() {
        when(config.getHistory()).thenReturn(historyConfig);
        when(historyDatabase.getName()).thenReturn("history");
        when(libraryDatabase.getName()).thenReturn("library");
        resources = new TestResources();
    }

    @Test
    void create_shouldRegisterNineStepsInOrder() {
        ShutdownSequence sequence = MainWindowShutdown.create(resources);

        assertEquals(List.of(
                MainWindowShutdown.SAVE_SETTINGS,
                MainWindowShutdown.DETACH_VIDEO_LISTENERS,
                MainWindowShutdown.DISPOSE_VIDEO_PLAYER,
                MainWindowShutdown.CLOSE_PROJECTION,
                MainWindowShutdown.RELEASE_HOTKEYS,
                MainWindowShutdown.STOP_FRAME_RATE_MONITOR,
                MainWindowShutdown.CLOSE_AUTH_SESSION,
                MainWindowShutdown.FLUSH_HISTORY,
                MainWindowShutdown.CLOSE_DATABASES), sequence.stepNames());
    }

    @Test
    void run_shouldReleaseEverythingInOrder() throws Exception {
        ShutdownReport report = MainWindowShutdown.create(resources).run();

        assertTrue(report.isClean());
        InOrder order = inOrder(config, statusSubscription, progressSubscription, videoPlayer, projection, hotKeys,
                frameRateMonitor, authSession, history, importController, historyDatabase, libraryDatabase);
        order.verify(config).save();
        order.verify(statusSubscription).close();
        order.verify(progressSubscription).close();
        order.verify(videoPlayer).stop();
        order.verify(videoPlayer).dispose();
        order.verify(projection).close();
        order.verify(hotKeys).close();
        order.verify(frameRateMonitor).stop();
        order.verify(frameRateMonitor).close();
        order.verify(authSession).close();
        order.verify(history).persist();
        order.verify(importController).shutdown(MainWindowShutdown.IMPORT_DRAIN_TIMEOUT);
        order.verify(historyDatabase).checkpointAndClose();
        order.verify(libraryDatabase).checkpointAndClose();
        assertTrue(resources.subscriptions.isEmpty());
        assertEquals(1, resources.settingsCaptured);
        verify(history, never()).clear();
    }

    @Test
    void run_shouldCaptureSettingsBeforeSaving() {
        List<String> log = new ArrayList<>();
        resources.onCapture = () -> log.add("capture");
        doAnswer(inv -> log.add("save")).when(config).save();

        MainWindowShutdown.create(resources).run();

        assertEquals(List.of("capture", "save"), log);
    }

    @Test
    void run_shouldSaveSettingsWhenCaptureFails() {
        resources.onCapture = () -> {
            throw new IllegalStateException("window already gone");
        };

        ShutdownReport report = MainWindowShutdown.create(resources).run();

        verify(config).save();
        assertEquals(MainWindowShutdown.SAVE_SETTINGS, report.failures().get(0).name());
    }

    @Test
    void run_shouldCloseDatabasesWhenImportWorkerFails() throws Exception {
        doThrow(new IllegalStateException("worker broken")).when(importController)
                .shutdown(MainWindowShutdown.IMPORT_DRAIN_TIMEOUT);

        ShutdownReport report = MainWindowShutdown.create(resources).run();

        verify(historyDatabase).checkpointAndClose();
        verify(libraryDatabase).checkpointAndClose();
        assertEquals(MainWindowShutdown.CLOSE_DATABASES, report.failures().get(0).name());
    }

    @Test
    void run_shouldContinueWhenStepThrowsLinkageError() throws Exception {
        doThrow(new UnsatisfiedLinkError("jfxmedia")).when(videoPlayer).dispose();

        ShutdownReport report = MainWindowShutdown.create(resources).run();

        assertEquals(MainWindowShutdown.DISPOSE_VIDEO_PLAYER, report.failures().get(0).name());
        verify(projection).close();
        verify(authSession).close();
        verify(libraryDatabase).checkpointAndClose();
    }

    @Test
    void run_shouldContinueAfterFailingStep() {
        List<String> log = new ArrayList<>();
        doAnswer(inv -> log.add("save")).when(config).save();
        doAnswer(inv -> log.add("player")).when(videoPlayer).dispose();
        doAnswer(inv -> {
            log.add("projection");
            throw new IllegalStateException("display gone");
        }).when(projection).close();
        doAnswer(inv -> log.add("hotkeys")).when(hotKeys).close();
        doAnswer(inv -> log.add("fps")).when(frameRateMonitor).close();
        doAnswer(inv -> log.add("session")).when(authSession).close();
        doAnswer(inv -> log.add("history")).when(history).persist();

        ShutdownReport report = MainWindowShutdown.create(resources).run();

        assertEquals(List.of("save", "player", "projection", "hotkeys", "fps", "session", "history"), log);
        assertEquals(1, report.failures().size());
        StepResult failed = report.failures().get(0);
        assertEquals(MainWindowShutdown.CLOSE_PROJECTION, failed.name());
        assertEquals("display gone", failed.failure().getMessage());
    }

    @Test
    void run_shouldStillDisposePlayerWhenStopFails() {
        doThrow(new IllegalStateException("no media")).when(videoPlayer).stop();

        ShutdownReport report = MainWindowShutdown.create(resources).run();

        verify(videoPlayer).dispose();
        assertEquals(MainWindowShutdown.DISPOSE_VIDEO_PLAYER, report.failures().get(0).name());
    }

    @Test
    void run_shouldClearHistoryWhenSavingIsDisabled() {
        historyConfig.setSaveHistory(false);

        MainWindowShutdown.create(resources).run();

        verify(history).clear();
        verify(history, never()).persist();
    }

    @Test
    void run_shouldCloseLibraryDatabaseWhenHistoryDatabaseFails() throws Exception {
        doThrow(new SQLException("database is locked")).when(historyDatabase).checkpointAndClose();

        ShutdownReport report = MainWindowShutdown.create(resources).run();

        verify(libraryDatabase).checkpointAndClose();
        assertEquals(1, report.failures().size());
        assertEquals(MainWindowShutdown.CLOSE_DATABASES, report.failures().get(0).name());
    }

    @Test
    void run_shouldDetachRemainingListenersWhenOneFails() {
        doThrow(new IllegalStateException("already detached")).when(statusSubscription).close();

        ShutdownReport report = MainWindowShutdown.create(resources).run();

        verify(progressSubscription).close();
        assertEquals(MainWindowShutdown.DETACH_VIDEO_LISTENERS, report.failures().get(0).name());
    }

    @Test
    void run_shouldSkipCollaboratorsThatWereNeverCreated() throws Exception {
        resources.videoPlayer = null;
        resources.projection = null;
        resources.hotKeys = null;
        resources.frameRateMonitor = null;

        ShutdownReport report = MainWindowShutdown.create(resources).run();

        assertTrue(report.isClean());
        assertFalse(report.executedSteps().contains(MainWindowShutdown.DISPOSE_VIDEO_PLAYER));
        assertFalse(report.executedSteps().contains(MainWindowShutdown.CLOSE_PROJECTION));
        verify(authSession).close();
        verify(libraryDatabase).checkpointAndClose();
    }

    @Test
    void run_shouldOnlyTearDownOnce() {
        ShutdownSequence sequence = MainWindowShutdown.create(resources);

        ShutdownReport first = sequence.run();
        ShutdownReport second = sequence.run();

        assertSame(first, second);
        verify(authSession, times(1)).close();
        verify(config, times(1)).save();
    }

    private final class TestResources implements MainWindowShutdown.Resources {

        final List<Subscription> subscriptions = new ArrayList<>(List.of(statusSubscription, progressSubscription));
        VideoPlayer videoPlayer = MainWindowShutdownTest.this.videoPlayer;
        ProjectionScreen projection = MainWindowShutdownTest.this.projection;
        HotKeys hotKeys = MainWindowShutdownTest.this.hotKeys;
        FrameRateMonitor frameRateMonitor = MainWindowShutdownTest.this.frameRateMonitor;
        Runnable onCapture = () -> {
        };
        int settingsCaptured;

        @Override
        public GlobalConfig config() {
            return config;
        }

        @Override
        public void captureSettings() {
            settingsCaptured++;
            onCapture.run();
        }

        @Override
        public List<Subscription> videoSubscriptions() {
            return subscriptions;
        }

        @Override
        public VideoPlayer videoPlayer() {
            return videoPlayer;
        }

        @Override
        public ProjectionScreen projection() {
            return projection;
        }

        @Override
        public HotKeys hotKeys() {
            return hotKeys;
        }

        @Override
        public FrameRateMonitor frameRateMonitor() {
            return frameRateMonitor;
        }

        @Override
        public AuthSession authSession() {
            return authSession;
        }

        @Override
        public HistoryLog history() {
            return history;
        }

        @Override
        public ImportController importController() {
            return importController;
        }

        @Override
        public SqliteDatabase historyDatabase() {
            return historyDatabase;
        }

        @Override
        public SqliteDatabase libraryDatabase() {
            return libraryDatabase;
        }
    }
}
