package de.bsommerfeld.canvas.ui.view.projection;

import java.nio.file.Path;

/**
 * The audience-facing output, usually a borderless window on a second
 * display.
 */
public interface ProjectionScreen extends AutoCloseable {

    void showImage(Path image);

    /** Blanks the screen without closing it. */
    void blank();

    boolean isShowing();

    @Override
    void close();
}
