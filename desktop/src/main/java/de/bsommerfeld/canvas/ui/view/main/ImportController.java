package de.bsommerfeld.canvas.ui.view.main;

import de.bsommerfeld.canvas.core.event.ApplicationEventBus;
import de.bsommerfeld.canvas.core.event.SessionEvents.MediaImportedEvent;
import de.bsommerfeld.canvas.db.FolderImportResult;
import de.bsommerfeld.canvas.db.ImportService;
import de.bsommerfeld.canvas.db.SyncResult;
import de.bsommerfeld.canvas.db.model.MediaFile;
import com.google.common.util.concurrent.MoreExecutors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * Runs library imports on a background worker and hands the results back on
 * the UI executor. Futures returned here complete on the UI thread, after
 * the matching {@link MediaImportedEvent} has been posted.
 */
public class ImportController {

    private static final Logger LOG = LoggerFactory.getLogger(ImportController.class);

    private final ImportService importService;
    private final ApplicationEventBus eventBus;
    private final ExecutorService worker;
    private final Executor ui;

    public ImportController(ImportService importService, ApplicationEventBus eventBus, ExecutorService worker,
            Executor ui) {
        this.importService = importService;
        this.eventBus = eventBus;
        this.worker = worker;
        this.ui = ui;
    }

    public CompletableFuture<Optional<MediaFile>> importFile(Path file) {
        return CompletableFuture.supplyAsync(() -> importService.importSingleFile(file), worker)
                .thenApplyAsync(imported -> {
                    if (imported.isPresent()) {
                        eventBus.post(new MediaImportedEvent(1, 0));
                    } else {
                        LOG.info("Nothing imported from {}", file);
                    }
                    return imported;
                }, ui);
    }

    public CompletableFuture<FolderImportResult> importFolder(Path directory) {
        return CompletableFuture.supplyAsync(() -> importService.importFolder(directory), worker)
                .thenApplyAsync(result -> {
                    LOG.info("Imported {}: {} new, {} already present", directory,
                            result.newFiles().size(), result.existingFiles().size());
                    if (result.hasFolder()) {
                        eventBus.post(new MediaImportedEvent(result.newFiles().size(), result.existingFiles().size()));
                    }
                    return result;
                }, ui);
    }

    public CompletableFuture<SyncResult> syncAll() {
        return CompletableFuture.supplyAsync(importService::syncAllFolders, worker)
                .thenApplyAsync(result -> {
                    if (result.hasChanges()) {
                        eventBus.post(new MediaImportedEvent(result.added(), 0));
                    }
                    return result;
                }, ui);
    }

    /**
     * Stops accepting imports and waits for the running one to finish, so
     * nothing writes to the library after its database is closed.
     *
     * @return whether the worker finished within {@code timeout}; if not, it
     *         has been interrupted
     */
    public boolean shutdown(Duration timeout) {
        boolean drained = MoreExecutors.shutdownAndAwaitTermination(worker, timeout);
        if (!drained) {
            LOG.warn("Import worker still busy after {} ms, interrupted it", timeout.toMillis());
        }
        return drained;
    }
}
