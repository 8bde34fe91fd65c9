package de.bsommerfeld.canvas.ui.view.account;

import javafx.beans.binding.Bindings;
import javafx.geometry.Pos;
import javafx.scene.control.Button;
import javafx.scene.control.PasswordField;
import javafx.scene.control.TextField;
import javafx.scene.layout.HBox;
import javafx.stage.Stage;
import javafx.stage.Window;

final class ResetPasswordDialog {

    private final Stage stage;

    ResetPasswordDialog(Window owner, ResetPasswordViewModel viewModel) {
        TextField email = new TextField();
        email.textProperty().bindBidirectional(viewModel.emailProperty());
        TextField code = new TextField();
        code.setPromptText("6 digits");
        code.textProperty().bindBidirectional(viewModel.codeProperty());
        PasswordField newPassword = new PasswordField();
        newPassword.setPromptText("At least 6 characters");
        newPassword.textProperty().bindBidirectional(viewModel.newPasswordProperty());

        Button sendCode = new Button();
        sendCode.textProperty().bind(Bindings.createStringBinding(() -> {
            int left = viewModel.resendCountdownProperty().get();
            return left > 0 ? "Resend in " + left + " s" : "Send code";
        }, viewModel.resendCountdownProperty()));
        sendCode.disableProperty().bind(viewModel.canSendCodeProperty().not());
        sendCode.setOnAction(e -> viewModel.sendCode());

        Button submit = new Button("Reset password");
        submit.setDefaultButton(true);
        submit.disableProperty().bind(viewModel.lockedProperty());
        submit.setOnAction(e -> viewModel.resetPassword());
        Button cancel = new Button("Cancel");
        cancel.setCancelButton(true);
        cancel.disableProperty().bind(viewModel.lockedProperty());

        HBox emailRow = new HBox(8, email, sendCode);
        HBox buttons = new HBox(8, cancel, submit);
        buttons.setAlignment(Pos.CENTER_RIGHT);

        AccountForm form = new AccountForm()
                .field("Email", emailRow)
                .field("Verification code", code)
                .field("New password", newPassword);
        form.bindStatus(viewModel.statusProperty());
        this.stage = form.createStage(owner, "Reset password", buttons);

        cancel.setOnAction(e -> stage.close());
        viewModel.setOnClose(stage::close);
        stage.setOnHidden(e -> viewModel.dispose());
    }

    void showAndWait() {
        stage.showAndWait();
    }
}
