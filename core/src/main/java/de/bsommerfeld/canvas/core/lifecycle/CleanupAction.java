package de.bsommerfeld.canvas.core.lifecycle;

/**
 * A piece of teardown work. May throw; {@link ShutdownSequence} contains the
 * failure.
 */
@FunctionalInterface
public interface CleanupAction {

    void run() throws Exception;
}
