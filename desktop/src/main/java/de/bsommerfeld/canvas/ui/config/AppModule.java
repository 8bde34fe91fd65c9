package de.bsommerfeld.canvas.ui.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;

import de.bsommerfeld.canvas.auth.AuthClient;
import de.bsommerfeld.canvas.auth.AuthSession;
import de.bsommerfeld.canvas.auth.DeviceIdentity;
import de.bsommerfeld.canvas.auth.HttpAuthClient;
import de.bsommerfeld.canvas.auth.TestAuthClient;
import de.bsommerfeld.canvas.core.concurrent.DaemonExecutors;
import de.bsommerfeld.canvas.core.concurrent.TimedRemoteOperation;
import de.bsommerfeld.canvas.core.config.ApplicationMode;
import de.bsommerfeld.canvas.core.config.AuthConfig;
import de.bsommerfeld.canvas.core.config.ConfigStore;
import de.bsommerfeld.canvas.core.config.GlobalConfig;
import de.bsommerfeld.canvas.core.config.HistoryConfig;
import de.bsommerfeld.canvas.core.config.UpdateConfig;
import de.bsommerfeld.canvas.core.config.UserConfig;
import de.bsommerfeld.canvas.core.event.ApplicationEventBus;
import de.bsommerfeld.canvas.core.util.StorageUtils;
import de.bsommerfeld.canvas.db.HistoryLog;
import de.bsommerfeld.canvas.db.ImportService;
import de.bsommerfeld.canvas.db.MediaLibrary;
import de.bsommerfeld.canvas.db.SqlMediaLibrary;
import de.bsommerfeld.canvas.db.SqliteDatabase;
import de.bsommerfeld.canvas.ui.FxExecutor;
import de.bsommerfeld.canvas.ui.view.main.ImportController;
import de.bsommerfeld.canvas.update.UpdateService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Guice Module for UI and Application wiring.
 */
public class AppModule extends AbstractModule {

    /** UI thread executor, {@code Platform::runLater} in production. */
    public static final String FX_EXECUTOR = "fx";
    /** Shared daemon timer for timeouts, close delays and countdowns. */
    public static final String UI_TIMER = "ui-timer";
    public static final String LIBRARY_DATABASE = "library";
    public static final String HISTORY_DATABASE = "history";

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path appDataDir;
    private final ApplicationMode mode;

    public AppModule() {
        this(StorageUtils.getAppDataDir(StorageUtils.APP_NAME), ApplicationMode.get());
    }

    AppModule(Path appDataDir, ApplicationMode mode) {
        this.appDataDir = appDataDir;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        // Load Configuration
        try {
            if (!Files.exists(appDataDir)) {
                Files.createDirectories(appDataDir);
            }
            Path configPath = appDataDir.resolve("config.toml");
            LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());

            GlobalConfig config = new ConfigStore(configPath).load();

            bind(GlobalConfig.class).toInstance(config);
            bind(UserConfig.class).toInstance(config.getUser());
            bind(AuthConfig.class).toInstance(config.getAuth());
            bind(HistoryConfig.class).toInstance(config.getHistory());
            bind(UpdateConfig.class).toInstance(config.getUpdate());

            // --- MODE SWITCHING (PROD vs TEST) ---
            LOG.info("Application Mode initialized: {}", mode);
            if (mode == ApplicationMode.TEST) {
                // TEST MODE: local accounts, nothing leaves the machine
                bind(AuthClient.class).to(TestAuthClient.class).in(Singleton.class);
            } else {
                bind(AuthClient.class).toInstance(new HttpAuthClient(config.getAuth(), DeviceIdentity.detect()));
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to load Application Configuration", e);
        }
    }

    @Provides
    @Singleton
    @Named(FX_EXECUTOR)
    Executor fxExecutor() {
        return new FxExecutor();
    }

    @Provides
    @Singleton
    @Named(UI_TIMER)
    ScheduledExecutorService uiTimer() {
        return DaemonExecutors.scheduler("ui-timer");
    }

    @Provides
    @Singleton
    TimedRemoteOperation timedRemoteOperation(@Named(UI_TIMER) ScheduledExecutorService timer, AuthConfig auth) {
        return new TimedRemoteOperation(timer, Duration.ofSeconds(auth.getOperationTimeoutSeconds()));
    }

    @Provides
    @Singleton
    AuthSession authSession(AuthClient client, ApplicationEventBus eventBus, AuthConfig auth) {
        // The session shuts its scheduler down on close, so it gets its own.
        return new AuthSession(client, eventBus, DaemonExecutors.scheduler("auth-heartbeat"),
                Duration.ofMinutes(auth.getHeartbeatIntervalMinutes()));
    }

    @Provides
    @Singleton
    @Named(LIBRARY_DATABASE)
    SqliteDatabase libraryDatabase() {
        if (mode == ApplicationMode.TEST) {
            return SqliteDatabase.inMemory("library", "library");
        }
        return SqliteDatabase.open("library", appDataDir.resolve("canvas.db"), "library");
    }

    @Provides
    @Singleton
    @Named(HISTORY_DATABASE)
    SqliteDatabase historyDatabase() {
        if (mode == ApplicationMode.TEST) {
            return SqliteDatabase.inMemory("history", "history");
        }
        return SqliteDatabase.open("history", appDataDir.resolve("history.db"), "history");
    }

    @Provides
    @Singleton
    MediaLibrary mediaLibrary(@Named(LIBRARY_DATABASE) SqliteDatabase database) {
        return new SqlMediaLibrary(database);
    }

    @Provides
    @Singleton
    ImportService importService(MediaLibrary library) {
        return new ImportService(library);
    }

    @Provides
    @Singleton
    HistoryLog historyLog(@Named(HISTORY_DATABASE) SqliteDatabase database, HistoryConfig history) {
        HistoryLog log = new HistoryLog(database, history.getMaxEntries());
        if (history.isSaveHistory()) {
            log.load();
        }
        return log;
    }

    @Provides
    @Singleton
    UpdateService updateService(UpdateConfig update) {
        return new UpdateService(update);
    }

    @Provides
    @Singleton
    ImportController importController(ImportService importService, ApplicationEventBus eventBus,
            @Named(FX_EXECUTOR) Executor fx) {
        return new ImportController(importService, eventBus, DaemonExecutors.singleThread("library-import"), fx);
    }
}
