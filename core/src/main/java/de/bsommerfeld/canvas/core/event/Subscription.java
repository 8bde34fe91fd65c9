package de.bsommerfeld.canvas.core.event;

/**
 * Handle returned when a listener is attached. Closing it detaches the
 * listener; closing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
