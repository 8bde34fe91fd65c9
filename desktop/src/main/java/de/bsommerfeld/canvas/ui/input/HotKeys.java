package de.bsommerfeld.canvas.ui.input;

import javafx.scene.input.KeyCombination;

/**
 * Application-wide keyboard shortcuts.
 */
public interface HotKeys extends AutoCloseable {

    void register(KeyCombination combination, Runnable action);

    /** Removes every shortcut registered through this instance. */
    @Override
    void close();
}
