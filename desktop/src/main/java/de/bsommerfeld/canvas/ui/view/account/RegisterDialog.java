package de.bsommerfeld.canvas.ui.view.account;

import de.bsommerfeld.canvas.auth.validation.PasswordMatch;
import javafx.geometry.Pos;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.PasswordField;
import javafx.scene.control.TextField;
import javafx.scene.layout.HBox;
import javafx.scene.paint.Color;
import javafx.stage.Stage;
import javafx.stage.Window;

import java.util.Optional;

final class RegisterDialog {

    private final Stage stage;
    private final RegisterViewModel viewModel;

    RegisterDialog(Window owner, RegisterViewModel viewModel) {
        this.viewModel = viewModel;

        TextField username = new TextField();
        username.setPromptText("3-20 letters, digits or _");
        username.textProperty().bindBidirectional(viewModel.usernameProperty());
        TextField email = new TextField();
        email.textProperty().bindBidirectional(viewModel.emailProperty());
        PasswordField password = new PasswordField();
        password.setPromptText("At least 6 characters");
        password.textProperty().bindBidirectional(viewModel.passwordProperty());
        PasswordField confirm = new PasswordField();
        confirm.textProperty().bindBidirectional(viewModel.confirmPasswordProperty());

        Label matchHint = new Label();
        renderHint(matchHint, viewModel.passwordMatchProperty().get());
        viewModel.passwordMatchProperty().addListener((obs, oldVal, newVal) -> renderHint(matchHint, newVal));

        Button submit = new Button("Register");
        submit.setDefaultButton(true);
        submit.disableProperty().bind(viewModel.lockedProperty());
        submit.setOnAction(e -> viewModel.register());
        Button cancel = new Button("Cancel");
        cancel.setCancelButton(true);
        cancel.disableProperty().bind(viewModel.lockedProperty());

        HBox buttons = new HBox(8, cancel, submit);
        buttons.setAlignment(Pos.CENTER_RIGHT);

        AccountForm form = new AccountForm()
                .field("Username", username)
                .field("Email", email)
                .field("Password", password)
                .field("Confirm password", confirm)
                .line(matchHint);
        form.bindStatus(viewModel.statusProperty());
        this.stage = form.createStage(owner, "Create account", buttons);

        cancel.setOnAction(e -> stage.close());
        viewModel.setOnClose(stage::close);
    }

    private static void renderHint(Label hint, PasswordMatch match) {
        switch (match) {
            case PROMPT:
                hint.setText("Please confirm your password");
                hint.setTextFill(Color.GRAY);
                break;
            case MATCH:
                hint.setText("Passwords match");
                hint.setTextFill(Color.FORESTGREEN);
                break;
            case MISMATCH:
                hint.setText("Passwords do not match");
                hint.setTextFill(Color.FIREBRICK);
                break;
            default:
                hint.setText("");
        }
    }

    /**
     * Blocks until the dialog closes.
     *
     * @return the registered username if the registration went through
     */
    Optional<String> showAndWait() {
        stage.showAndWait();
        return viewModel.getRegisteredUsername();
    }
}
