package de.bsommerfeld.canvas.ui.view.account;

import javafx.beans.property.ReadOnlyObjectProperty;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.Scene;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.VBox;
import javafx.scene.paint.Color;
import javafx.stage.Modality;
import javafx.stage.Stage;
import javafx.stage.Window;

/**
 * Shared layout for the account dialogs: a label/field grid, a status line
 * and a button row.
 */
final class AccountForm {

    private final GridPane grid = new GridPane();
    private final Label status = new Label();
    private int row;

    AccountForm() {
        grid.setHgap(10);
        grid.setVgap(8);
        status.setWrapText(true);
        status.setMaxWidth(320);
    }

    AccountForm field(String label, Node input) {
        grid.add(new Label(label), 0, row);
        grid.add(input, 1, row);
        row++;
        return this;
    }

    /** Adds a node spanning both columns. */
    AccountForm line(Node node) {
        grid.add(node, 0, row, 2, 1);
        row++;
        return this;
    }

    void bindStatus(ReadOnlyObjectProperty<StatusMessage> message) {
        render(message.get());
        message.addListener((obs, oldVal, newVal) -> render(newVal));
    }

    private void render(StatusMessage message) {
        StatusMessage shown = message == null ? StatusMessage.NONE : message;
        status.setText(shown.text());
        switch (shown.severity()) {
            case ERROR:
                status.setTextFill(Color.FIREBRICK);
                break;
            case SUCCESS:
                status.setTextFill(Color.FORESTGREEN);
                break;
            default:
                status.setTextFill(Color.GRAY);
        }
    }

    Stage createStage(Window owner, String title, Node buttons) {
        VBox root = new VBox(12, grid, status, buttons);
        root.setPadding(new Insets(16));

        Stage stage = new Stage();
        stage.setTitle(title);
        stage.setResizable(false);
        if (owner != null) {
            stage.initOwner(owner);
        }
        stage.initModality(Modality.APPLICATION_MODAL);
        stage.setScene(new Scene(root));
        return stage;
    }
}
