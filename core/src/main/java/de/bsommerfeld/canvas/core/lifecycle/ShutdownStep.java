package de.bsommerfeld.canvas.core.lifecycle;

import java.util.Objects;

/**
 * A named, ordered unit of teardown work.
 */
public record ShutdownStep(String name, CleanupAction action) {

    public ShutdownStep {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(action, "action");
    }
}
