package de.bsommerfeld.canvas.ui.input;

import javafx.scene.Scene;
import javafx.scene.input.KeyCombination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers shortcuts as accelerators on one or more scenes, so they work
 * from the main window and the projection window alike.
 */
public class SceneHotKeys implements HotKeys {

    private static final Logger LOG = LoggerFactory.getLogger(SceneHotKeys.class);

    private final List<Scene> scenes;
    private final List<KeyCombination> registered = new ArrayList<>();

    public SceneHotKeys(List<Scene> scenes) {
        this.scenes = List.copyOf(scenes);
    }

    @Override
    public void register(KeyCombination combination, Runnable action) {
        for (Scene scene : scenes) {
            scene.getAccelerators().put(combination, action);
        }
        registered.add(combination);
        LOG.debug("Registered hotkey {}", combination.getDisplayText());
    }

    @Override
    public void close() {
        for (Scene scene : scenes) {
            for (KeyCombination combination : registered) {
                scene.getAccelerators().remove(combination);
            }
        }
        LOG.debug("Released {} hotkeys", registered.size());
        registered.clear();
    }
}
