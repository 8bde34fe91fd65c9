package de.bsommerfeld.canvas.ui.monitor;

import javafx.animation.AnimationTimer;
import javafx.beans.property.ReadOnlyDoubleProperty;
import javafx.beans.property.ReadOnlyDoubleWrapper;

import java.util.concurrent.TimeUnit;

/**
 * Counts pulses of the JavaFX animation timer and publishes the rate once
 * per second.
 */
public class FxFrameRateMonitor implements FrameRateMonitor {

    private static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final ReadOnlyDoubleWrapper framesPerSecond = new ReadOnlyDoubleWrapper(0);
    private final AnimationTimer timer = new AnimationTimer() {
        @Override
        public void handle(long now) {
            onFrame(now);
        }
    };

    private long windowStart = -1;
    private int frames;
    private boolean closed;

    private void onFrame(long now) {
        if (windowStart < 0) {
            windowStart = now;
        }
        frames++;
        long elapsed = now - windowStart;
        if (elapsed >= WINDOW_NANOS) {
            framesPerSecond.set(frames * (double) WINDOW_NANOS / elapsed);
            frames = 0;
            windowStart = now;
        }
    }

    @Override
    public void start() {
        if (closed) {
            throw new IllegalStateException("Frame rate monitor has been closed");
        }
        timer.start();
    }

    @Override
    public void stop() {
        timer.stop();
        windowStart = -1;
        frames = 0;
    }

    @Override
    public ReadOnlyDoubleProperty framesPerSecondProperty() {
        return framesPerSecond.getReadOnlyProperty();
    }

    @Override
    public void close() {
        stop();
        closed = true;
        framesPerSecond.set(0);
    }
}
