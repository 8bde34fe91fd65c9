package de.bsommerfeld.canvas.ui.config;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.name.Names;
import de.bsommerfeld.canvas.auth.AuthClient;
import de.bsommerfeld.canvas.auth.AuthSession;
import de.bsommerfeld.canvas.auth.HttpAuthClient;
import de.bsommerfeld.canvas.auth.TestAuthClient;
import de.bsommerfeld.canvas.core.concurrent.TimedRemoteOperation;
import de.bsommerfeld.canvas.core.config.ApplicationMode;
import de.bsommerfeld.canvas.core.config.GlobalConfig;
import de.bsommerfeld.canvas.core.config.HistoryConfig;
import de.bsommerfeld.canvas.db.ImportService;
import de.bsommerfeld.canvas.db.MediaLibrary;
import de.bsommerfeld.canvas.db.SqliteDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AppModuleTest {

    @TempDir
    Path appDataDir;

    private Injector injector;

    @AfterEach
    void tearDown() throws Exception {
        if (injector != null) {
            injector.getInstance(AuthSession.class).close();
            database(AppModule.LIBRARY_DATABASE).close();
            database(AppModule.HISTORY_DATABASE).close();
        }
    }

    private SqliteDatabase database(String name) {
        return injector.getInstance(Key.get(SqliteDatabase.class, Names.named(name)));
    }

    @Test
    void configure_shouldWriteDefaultConfiguration() {
        injector = Guice.createInjector(new AppModule(appDataDir, ApplicationMode.TEST));

        assertTrue(Files.exists(appDataDir.resolve("config.toml")));
        GlobalConfig config = injector.getInstance(GlobalConfig.class);
        assertSame(config.getHistory(), injector.getInstance(HistoryConfig.class));
    }

    @Test
    void testMode_shouldUseLocalCollaborators() {
        injector = Guice.createInjector(new AppModule(appDataDir, ApplicationMode.TEST));

        assertTrue(injector.getInstance(AuthClient.class) instanceof TestAuthClient);
        assertTrue(injector.getInstance(MediaLibrary.class).getAllFolders().isEmpty());
        assertFalse(Files.exists(appDataDir.resolve("canvas.db")));
    }

    @Test
    void prodMode_shouldUseHttpClientAndDatabaseFiles() {
        injector = Guice.createInjector(new AppModule(appDataDir, ApplicationMode.PROD));

        assertTrue(injector.getInstance(AuthClient.class) instanceof HttpAuthClient);
        injector.getInstance(MediaLibrary.class);
        assertTrue(Files.exists(appDataDir.resolve("canvas.db")));
    }

    @Test
    void providers_shouldShareSingletons() {
        injector = Guice.createInjector(new AppModule(appDataDir, ApplicationMode.TEST));

        assertSame(injector.getInstance(AuthSession.class), injector.getInstance(AuthSession.class));
        assertSame(injector.getInstance(ImportService.class), injector.getInstance(ImportService.class));
        assertEquals(Duration.ofSeconds(60), injector.getInstance(TimedRemoteOperation.class).getTimeout());
    }
}
