package de.bsommerfeld.canvas.ui;

import javafx.application.Platform;

import java.util.concurrent.Executor;

/**
 * Runs tasks on the JavaFX Application Thread. Tasks submitted from that
 * thread run inline.
 */
public final class FxExecutor implements Executor {

    @Override
    public void execute(Runnable command) {
        if (Platform.isFxApplicationThread()) {
            command.run();
        } else {
            Platform.runLater(command);
        }
    }
}
