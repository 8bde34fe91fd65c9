package de.bsommerfeld.canvas.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Thin wrapper around Guava's {@link EventBus} that decouples the session,
 * library and window layers.
 *
 * <p>
 * Prefer {@link #subscribe(Object)}: the returned {@link Subscription} lets
 * the owner detach exactly what it attached when it is torn down.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus("Canvas-EventBus");
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    /**
     * Registers the listener and returns a handle that unregisters it once.
     */
    public Subscription subscribe(Object listener) {
        register(listener);
        AtomicBoolean open = new AtomicBoolean(true);
        return () -> {
            if (open.compareAndSet(true, false)) {
                unregister(listener);
            }
        };
    }
}
