package de.bsommerfeld.canvas.ui.view.projection;

import javafx.geometry.Rectangle2D;
import javafx.scene.Scene;
import javafx.scene.image.Image;
import javafx.scene.image.ImageView;
import javafx.scene.layout.StackPane;
import javafx.scene.paint.Color;
import javafx.stage.Screen;
import javafx.stage.Stage;
import javafx.stage.StageStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Borderless full-screen window on the last attached display. Falls back to
 * the primary display when only one is connected.
 */
public class ProjectionWindow implements ProjectionScreen {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectionWindow.class);

    private final Stage stage = new Stage(StageStyle.UNDECORATED);
    private final ImageView imageView = new ImageView();
    private boolean closed;

    public ProjectionWindow() {
        imageView.setPreserveRatio(true);
        imageView.setSmooth(true);

        StackPane root = new StackPane(imageView);
        root.setStyle("-fx-background-color: black;");
        Scene scene = new Scene(root, Color.BLACK);
        stage.setScene(scene);
        stage.setTitle("Projection");

        List<Screen> screens = Screen.getScreens();
        Screen target = screens.get(screens.size() - 1);
        Rectangle2D bounds = target.getBounds();
        stage.setX(bounds.getMinX());
        stage.setY(bounds.getMinY());
        stage.setWidth(bounds.getWidth());
        stage.setHeight(bounds.getHeight());
        imageView.fitWidthProperty().bind(root.widthProperty());
        imageView.fitHeightProperty().bind(root.heightProperty());
        LOG.info("Projection targets screen {} of {} ({}x{})", screens.indexOf(target) + 1, screens.size(),
                (int) bounds.getWidth(), (int) bounds.getHeight());
    }

    @Override
    public void showImage(Path image) {
        if (closed) {
            throw new IllegalStateException("Projection window has been closed");
        }
        imageView.setImage(new Image(image.toUri().toString(), true));
        if (!stage.isShowing()) {
            stage.show();
        }
    }

    @Override
    public void blank() {
        imageView.setImage(null);
    }

    @Override
    public boolean isShowing() {
        return stage.isShowing();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        imageView.setImage(null);
        stage.close();
        LOG.debug("Projection window closed");
    }
}
