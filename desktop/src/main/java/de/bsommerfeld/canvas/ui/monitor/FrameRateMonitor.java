package de.bsommerfeld.canvas.ui.monitor;

import javafx.beans.property.ReadOnlyDoubleProperty;

/**
 * Measures how many frames per second the UI renders.
 */
public interface FrameRateMonitor extends AutoCloseable {

    void start();

    void stop();

    ReadOnlyDoubleProperty framesPerSecondProperty();

    @Override
    void close();
}
