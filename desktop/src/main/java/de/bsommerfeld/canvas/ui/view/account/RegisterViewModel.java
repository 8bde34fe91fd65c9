package de.bsommerfeld.canvas.ui.view.account;

import de.bsommerfeld.canvas.auth.AuthResult;
import de.bsommerfeld.canvas.auth.AuthSession;
import de.bsommerfeld.canvas.auth.validation.CredentialValidator;
import de.bsommerfeld.canvas.auth.validation.Credentials;
import de.bsommerfeld.canvas.auth.validation.Field;
import de.bsommerfeld.canvas.auth.validation.PasswordMatch;
import de.bsommerfeld.canvas.auth.validation.ValidationException;
import de.bsommerfeld.canvas.core.concurrent.RemoteOutcome;
import de.bsommerfeld.canvas.core.concurrent.TimedRemoteOperation;
import javafx.beans.property.ReadOnlyBooleanProperty;
import javafx.beans.property.ReadOnlyObjectProperty;
import javafx.beans.property.ReadOnlyObjectWrapper;
import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Observable state of the registration dialog, including the live
 * password-confirmation hint.
 */
final class RegisterViewModel {

    static final Duration CLOSE_DELAY = Duration.ofSeconds(2);
    static final String PENDING = "Creating account...";
    static final String SUCCESS = "Registration successful";

    private final StringProperty username = new SimpleStringProperty("");
    private final StringProperty email = new SimpleStringProperty("");
    private final StringProperty password = new SimpleStringProperty("");
    private final StringProperty confirmPassword = new SimpleStringProperty("");
    private final ReadOnlyObjectWrapper<PasswordMatch> passwordMatch = new ReadOnlyObjectWrapper<>(PasswordMatch.EMPTY);

    private final AuthSession session;
    private final RemoteSubmission submission;
    private final Duration closeDelay;

    private String registeredUsername;
    private Runnable onClose = () -> {
    };

    RegisterViewModel(AuthSession session, TimedRemoteOperation operation, Executor ui) {
        this(session, operation, ui, CLOSE_DELAY);
    }

    RegisterViewModel(AuthSession session, TimedRemoteOperation operation, Executor ui, Duration closeDelay) {
        this.session = session;
        this.submission = new RemoteSubmission("register", operation, ui);
        this.closeDelay = closeDelay;

        password.addListener((obs, oldVal, newVal) -> updatePasswordMatch());
        confirmPassword.addListener((obs, oldVal, newVal) -> updatePasswordMatch());
    }

    private void updatePasswordMatch() {
        passwordMatch.set(PasswordMatch.evaluate(password.get(), confirmPassword.get()));
    }

    /**
     * Validates the form and submits the registration. A confirmation that
     * does not match is cleared so the user retypes it.
     *
     * @return the outcome, or empty if the form was invalid or a registration
     *         is pending or the dialog is closing
     */
    Optional<CompletableFuture<RemoteOutcome>> register() {
        if (submission.isLocked()) {
            return Optional.empty();
        }
        Credentials credentials = new Credentials(username.get(), password.get(), email.get());
        try {
            CredentialValidator.validateRegistration(credentials, confirmPassword.get());
        } catch (ValidationException e) {
            if (e.getField() == Field.CONFIRM_PASSWORD && !confirmPassword.get().isEmpty()) {
                confirmPassword.set("");
            }
            submission.showError(e.getMessage());
            return Optional.empty();
        }

        return submission.submit(PENDING, SUCCESS, true,
                () -> session.register(credentials.username(), credentials.password(), credentials.email())
                        .thenApply(AuthResult::toReply))
                .map(pending -> pending.thenApply(outcome -> {
                    if (outcome instanceof RemoteOutcome.Success) {
                        registeredUsername = credentials.username();
                        submission.closeAfter(closeDelay, () -> onClose.run());
                    }
                    return outcome;
                }));
    }

    /** The username of a successful registration, for prefilling the login form. */
    Optional<String> getRegisteredUsername() {
        return Optional.ofNullable(registeredUsername);
    }

    void setOnClose(Runnable onClose) {
        this.onClose = onClose;
    }

    StringProperty usernameProperty() {
        return username;
    }

    StringProperty emailProperty() {
        return email;
    }

    StringProperty passwordProperty() {
        return password;
    }

    StringProperty confirmPasswordProperty() {
        return confirmPassword;
    }

    ReadOnlyObjectProperty<PasswordMatch> passwordMatchProperty() {
        return passwordMatch.getReadOnlyProperty();
    }

    ReadOnlyObjectProperty<StatusMessage> statusProperty() {
        return submission.statusProperty();
    }

    ReadOnlyObjectProperty<SubmissionState> stateProperty() {
        return submission.stateProperty();
    }

    ReadOnlyBooleanProperty lockedProperty() {
        return submission.lockedProperty();
    }
}
