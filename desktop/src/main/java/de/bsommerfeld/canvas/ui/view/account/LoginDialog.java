package de.bsommerfeld.canvas.ui.view.account;

import javafx.geometry.Pos;
import javafx.scene.control.Button;
import javafx.scene.control.CheckBox;
import javafx.scene.control.Hyperlink;
import javafx.scene.control.PasswordField;
import javafx.scene.control.TextField;
import javafx.scene.layout.HBox;
import javafx.stage.Stage;
import javafx.stage.Window;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Modal login window. Links to the registration and password-reset dialogs.
 */
final class LoginDialog {

    private final Stage stage;
    private final LoginViewModel viewModel;

    LoginDialog(Window owner, LoginViewModel viewModel, Function<Window, Optional<String>> openRegistration,
            Consumer<Window> openReset) {
        this.viewModel = viewModel;

        TextField username = new TextField();
        username.textProperty().bindBidirectional(viewModel.usernameProperty());
        PasswordField password = new PasswordField();
        password.textProperty().bindBidirectional(viewModel.passwordProperty());
        CheckBox remember = new CheckBox("Remember username");
        remember.selectedProperty().bindBidirectional(viewModel.rememberUsernameProperty());

        Button login = new Button("Sign in");
        login.setDefaultButton(true);
        login.disableProperty().bind(viewModel.lockedProperty());
        login.setOnAction(e -> viewModel.login());

        Hyperlink register = new Hyperlink("Create account");
        register.disableProperty().bind(viewModel.lockedProperty());
        Hyperlink forgot = new Hyperlink("Forgot password?");
        forgot.disableProperty().bind(viewModel.lockedProperty());

        HBox buttons = new HBox(8, register, forgot, login);
        buttons.setAlignment(Pos.CENTER_RIGHT);

        AccountForm form = new AccountForm()
                .field("Username", username)
                .field("Password", password)
                .line(remember);
        form.bindStatus(viewModel.statusProperty());
        this.stage = form.createStage(owner, "Sign in", buttons);

        register.setOnAction(e -> openRegistration.apply(stage).ifPresent(viewModel::prefill));
        forgot.setOnAction(e -> openReset.accept(stage));
        viewModel.setOnClose(stage::close);
    }

    /** Blocks until the dialog closes. */
    void showAndWait() {
        stage.showAndWait();
    }

    LoginViewModel getViewModel() {
        return viewModel;
    }
}
