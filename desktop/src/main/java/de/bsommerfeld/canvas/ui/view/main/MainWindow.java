package de.bsommerfeld.canvas.ui.view.main;

import com.google.common.eventbus.Subscribe;
import com.google.inject.name.Named;
import de.bsommerfeld.canvas.auth.AuthSession;
import de.bsommerfeld.canvas.core.config.GlobalConfig;
import de.bsommerfeld.canvas.core.event.ApplicationEventBus;
import de.bsommerfeld.canvas.core.event.SessionEvents.AuthenticationChangedEvent;
import de.bsommerfeld.canvas.core.event.SessionEvents.MediaImportedEvent;
import de.bsommerfeld.canvas.core.event.SessionEvents.UpdateAvailableEvent;
import de.bsommerfeld.canvas.core.event.Subscription;
import de.bsommerfeld.canvas.core.lifecycle.ShutdownReport;
import de.bsommerfeld.canvas.core.lifecycle.ShutdownSequence;
import de.bsommerfeld.canvas.db.HistoryLog;
import de.bsommerfeld.canvas.db.MediaLibrary;
import de.bsommerfeld.canvas.db.SqliteDatabase;
import de.bsommerfeld.canvas.db.model.Folder;
import de.bsommerfeld.canvas.db.model.MediaFile;
import de.bsommerfeld.canvas.db.model.MediaType;
import de.bsommerfeld.canvas.ui.config.AppModule;
import de.bsommerfeld.canvas.ui.input.HotKeys;
import de.bsommerfeld.canvas.ui.input.SceneHotKeys;
import de.bsommerfeld.canvas.ui.monitor.FrameRateMonitor;
import de.bsommerfeld.canvas.ui.monitor.FxFrameRateMonitor;
import de.bsommerfeld.canvas.ui.view.playback.FxVideoPlayer;
import de.bsommerfeld.canvas.ui.view.playback.VideoPlayer;
import de.bsommerfeld.canvas.ui.view.projection.ProjectionScreen;
import de.bsommerfeld.canvas.ui.view.projection.ProjectionWindow;
import de.bsommerfeld.canvas.update.UpdateService;
import jakarta.inject.Inject;
import javafx.beans.binding.Bindings;
import javafx.geometry.Insets;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.ListCell;
import javafx.scene.control.ListView;
import javafx.scene.control.SplitPane;
import javafx.scene.control.ToolBar;
import javafx.scene.image.Image;
import javafx.scene.image.ImageView;
import javafx.scene.input.KeyCode;
import javafx.scene.input.KeyCodeCombination;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.scene.layout.StackPane;
import javafx.stage.DirectoryChooser;
import javafx.stage.FileChooser;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * The library browser and projection control window.
 *
 * <p>
 * Owns the video player, projection screen, hotkeys and frame-rate monitor
 * it creates, plus the session and databases handed to it. All of them are
 * released by {@link MainWindowShutdown} when the window closes.
 */
public class MainWindow {

    private static final Logger LOG = LoggerFactory.getLogger(MainWindow.class);

    private final GlobalConfig config;
    private final ApplicationEventBus eventBus;
    private final AuthSession authSession;
    private final MediaLibrary library;
    private final ImportController importController;
    private final HistoryLog history;
    private final SqliteDatabase libraryDatabase;
    private final SqliteDatabase historyDatabase;
    private final UpdateService updateService;
    private final Executor fx;

    private final List<Subscription> videoSubscriptions = new ArrayList<>();
    private final ShutdownSequence shutdown;

    private final ListView<MediaFile> mediaList = new ListView<>();
    private final ImageView preview = new ImageView();
    private final Label statusLabel = new Label();
    private final Label userLabel = new Label();
    private final Label updateLabel = new Label();
    private final Label fpsLabel = new Label();
    private final SplitPane split = new SplitPane();

    private Stage stage;
    private Subscription busSubscription;
    private VideoPlayer videoPlayer;
    private ProjectionScreen projection;
    private HotKeys hotKeys;
    private FrameRateMonitor frameRateMonitor;

    @Inject
    public MainWindow(GlobalConfig config, ApplicationEventBus eventBus, AuthSession authSession,
            MediaLibrary library, ImportController importController, HistoryLog history,
            @Named(AppModule.LIBRARY_DATABASE) SqliteDatabase libraryDatabase,
            @Named(AppModule.HISTORY_DATABASE) SqliteDatabase historyDatabase,
            UpdateService updateService, @Named(AppModule.FX_EXECUTOR) Executor fx) {
        this.config = config;
        this.eventBus = eventBus;
        this.authSession = authSession;
        this.library = library;
        this.importController = importController;
        this.history = history;
        this.libraryDatabase = libraryDatabase;
        this.historyDatabase = historyDatabase;
        this.updateService = updateService;
        this.fx = fx;
        this.shutdown = MainWindowShutdown.create(new OwnedResources());
    }

    public void show(Stage stage) {
        this.stage = stage;
        FxVideoPlayer player = new FxVideoPlayer();
        this.videoPlayer = player;
        videoSubscriptions.add(player.onStatusChanged(status -> statusLabel.setText("Playback: " + status)));
        videoSubscriptions.add(player.onProgress(seconds -> statusLabel.setText(
                String.format("Playing %d:%02d", seconds.intValue() / 60, seconds.intValue() % 60))));

        preview.setPreserveRatio(true);
        StackPane center = new StackPane(preview, player.getView());
        preview.fitWidthProperty().bind(center.widthProperty());
        preview.fitHeightProperty().bind(center.heightProperty());
        player.getView().fitWidthProperty().bind(center.widthProperty());
        player.getView().fitHeightProperty().bind(center.heightProperty());

        mediaList.setCellFactory(list -> new ListCell<>() {
            @Override
            protected void updateItem(MediaFile item, boolean empty) {
                super.updateItem(item, empty);
                setText(empty || item == null ? null : item.name());
            }
        });
        mediaList.getSelectionModel().selectedItemProperty().addListener((obs, oldVal, newVal) -> {
            if (newVal != null) {
                present(newVal);
            }
        });

        split.getItems().setAll(mediaList, center);
        split.setDividerPositions(config.getUser().getLibrarySidebarRatio());

        BorderPane root = new BorderPane(split);
        root.setTop(createToolBar());
        root.setBottom(createStatusBar());

        Scene scene = new Scene(root, 1200, 800);
        stage.setScene(scene);
        stage.setTitle("Canvas Presenter");
        stage.setOnCloseRequest(e -> close());

        hotKeys = new SceneHotKeys(List.of(scene));
        hotKeys.register(new KeyCodeCombination(KeyCode.F5), this::syncFolders);
        hotKeys.register(new KeyCodeCombination(KeyCode.F11), this::toggleProjection);
        hotKeys.register(new KeyCodeCombination(KeyCode.ESCAPE), this::blankProjection);

        frameRateMonitor = new FxFrameRateMonitor();
        fpsLabel.textProperty().bind(Bindings.format("%.0f FPS", frameRateMonitor.framesPerSecondProperty()));
        frameRateMonitor.start();

        busSubscription = eventBus.subscribe(this);
        userLabel.setText(authSession.getUsername().map(name -> "Signed in as " + name).orElse(""));

        refreshLibrary();
        stage.show();
        LOG.info("Main window shown");

        if (config.getUser().isAutoUpdate()) {
            checkForUpdates();
        }
    }

    private ToolBar createToolBar() {
        Button importFile = new Button("Import file");
        importFile.setOnAction(e -> chooseFile());
        Button importFolder = new Button("Import folder");
        importFolder.setOnAction(e -> chooseFolder());
        Button sync = new Button("Sync folders");
        sync.setOnAction(e -> syncFolders());
        Button project = new Button("Projection");
        project.setOnAction(e -> toggleProjection());
        Button stop = new Button("Stop video");
        stop.setOnAction(e -> videoPlayer.stop());
        return new ToolBar(importFile, importFolder, sync, project, stop);
    }

    private HBox createStatusBar() {
        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);
        HBox bar = new HBox(12, statusLabel, spacer, updateLabel, userLabel, fpsLabel);
        bar.setPadding(new Insets(4, 8, 4, 8));
        return bar;
    }

    // =====================================================================
    // Library
    // =====================================================================

    private void chooseFile() {
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Import media file");
        File file = chooser.showOpenDialog(stage);
        if (file != null) {
            statusLabel.setText("Importing " + file.getName() + "...");
            importController.importFile(file.toPath()).whenCompleteAsync((imported, error) -> {
                if (error != null) {
                    LOG.error("Import of {} failed", file, error);
                    statusLabel.setText("Import failed: " + error.getMessage());
                } else if (imported.isEmpty()) {
                    statusLabel.setText("Unsupported file: " + file.getName());
                }
            }, fx);
        }
    }

    private void chooseFolder() {
        DirectoryChooser chooser = new DirectoryChooser();
        chooser.setTitle("Import media folder");
        File directory = chooser.showDialog(stage);
        if (directory != null) {
            statusLabel.setText("Scanning " + directory.getName() + "...");
            importController.importFolder(directory.toPath()).whenCompleteAsync((result, error) -> {
                if (error != null) {
                    LOG.error("Import of {} failed", directory, error);
                    statusLabel.setText("Import failed: " + error.getMessage());
                } else if (!result.hasFolder()) {
                    statusLabel.setText("No supported media in " + directory.getName());
                } else if (result.isAllExisting()) {
                    statusLabel.setText("All files already imported");
                }
            }, fx);
        }
    }

    private void syncFolders() {
        statusLabel.setText("Synchronizing folders...");
        importController.syncAll().whenCompleteAsync((result, error) -> {
            if (error != null) {
                LOG.error("Folder sync failed", error);
                statusLabel.setText("Sync failed: " + error.getMessage());
            } else {
                statusLabel.setText(String.format("Sync: %d added, %d removed", result.added(), result.removed()));
            }
        }, fx);
    }

    private void refreshLibrary() {
        List<MediaFile> files = new ArrayList<>(library.getRootMediaFiles());
        for (Folder folder : library.getAllFolders()) {
            files.addAll(library.getMediaFilesInFolder(folder.id()));
        }
        mediaList.getItems().setAll(files);
    }

    @Subscribe
    public void onMediaImported(MediaImportedEvent event) {
        fx.execute(() -> {
            refreshLibrary();
            statusLabel.setText(String.format("Imported %d new, %d already present",
                    event.newFiles(), event.existingFiles()));
        });
    }

    // =====================================================================
    // Presentation
    // =====================================================================

    private void present(MediaFile file) {
        Path path = Paths.get(file.path());
        if (file.type() == MediaType.IMAGE) {
            videoPlayer.stop();
            preview.setImage(new Image(path.toUri().toString(), true));
            if (projection != null && projection.isShowing()) {
                projection.showImage(path);
            }
        } else {
            preview.setImage(null);
            videoPlayer.play(path);
        }
        history.record(file.path());
    }

    private void toggleProjection() {
        if (projection != null && projection.isShowing()) {
            projection.close();
            projection = null;
            return;
        }
        if (projection == null) {
            projection = new ProjectionWindow();
        }
        MediaFile selected = mediaList.getSelectionModel().getSelectedItem();
        if (selected != null && selected.type() == MediaType.IMAGE) {
            projection.showImage(Paths.get(selected.path()));
        } else {
            statusLabel.setText("Select an image to project");
        }
    }

    private void blankProjection() {
        if (projection != null) {
            projection.blank();
        }
    }

    // =====================================================================
    // Session & updates
    // =====================================================================

    @Subscribe
    public void onAuthenticationChanged(AuthenticationChangedEvent event) {
        fx.execute(() -> userLabel.setText(event.authenticated()
                ? "Signed in as " + event.username()
                : "Signed out"));
    }

    @Subscribe
    public void onUpdateAvailable(UpdateAvailableEvent event) {
        fx.execute(() -> updateLabel.setText("Update available: " + event.version()));
    }

    private void checkForUpdates() {
        updateService.checkForUpdates().thenAccept(found -> found.ifPresent(info -> {
            LOG.info("Update {} available", info.version());
            eventBus.post(new UpdateAvailableEvent(info.version()));
        }));
    }

    // =====================================================================
    // Shutdown
    // =====================================================================

    /** Runs the teardown once. Safe to call again; later calls do nothing. */
    public void close() {
        if (shutdown.hasRun()) {
            return;
        }
        try {
            ShutdownReport report = shutdown.run();
            if (!report.isClean()) {
                LOG.warn("{} teardown step(s) failed", report.failures().size());
            }
        } finally {
            if (busSubscription != null) {
                busSubscription.close();
            }
        }
    }

    private final class OwnedResources implements MainWindowShutdown.Resources {

        @Override
        public GlobalConfig config() {
            return config;
        }

        @Override
        public void captureSettings() {
            double[] dividers = split.getDividerPositions();
            if (stage != null && dividers.length > 0) {
                config.getUser().setLibrarySidebarRatio(dividers[0]);
            }
        }

        @Override
        public List<Subscription> videoSubscriptions() {
            return videoSubscriptions;
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
