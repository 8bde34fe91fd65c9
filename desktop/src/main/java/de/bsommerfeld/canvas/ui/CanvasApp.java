package de.bsommerfeld.canvas.ui;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.canvas.core.util.AppVersion;
import de.bsommerfeld.canvas.core.util.StorageUtils;
import de.bsommerfeld.canvas.ui.config.AppModule;
import de.bsommerfeld.canvas.ui.view.account.AccountDialogs;
import de.bsommerfeld.canvas.ui.view.main.MainWindow;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

public class CanvasApp extends Application {

    static {
        // Logback reads LOG_DIR, so it must be set before the first logger exists
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CanvasApp.class);
    private Injector injector;
    private MainWindow mainWindow;

    @Override
    public void init() throws Exception {
        LOG.info("Initializing Canvas Presenter {}...", AppVersion.get());
        this.injector = Guice.createInjector(new AppModule());
    }

    @Override
    public void start(Stage primaryStage) {
        LOG.info("Starting UI...");

        // The login dialog is the only window until it closes
        Platform.setImplicitExit(false);
        boolean signedIn = injector.getInstance(AccountDialogs.class).login(null);
        if (!signedIn) {
            LOG.info("Login dialog closed without signing in, exiting");
            Platform.exit();
            return;
        }

        mainWindow = injector.getInstance(MainWindow.class);
        mainWindow.show(primaryStage);
        Platform.setImplicitExit(true);
    }

    @Override
    public void stop() throws Exception {
        LOG.info("Stopping...");

        try {
            if (mainWindow != null) {
                mainWindow.close();
            }
        } catch (Exception | LinkageError e) {
            LOG.warn("Failed to close main window: " + e.getMessage());
        } finally {
            super.stop();
            System.exit(0);
        }
    }

    public static void main(String[] args) {
        launch(args);
    }
}
