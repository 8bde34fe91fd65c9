package de.bsommerfeld.canvas.ui.view.account;

import de.bsommerfeld.canvas.auth.AuthResult;
import de.bsommerfeld.canvas.auth.AuthSession;
import de.bsommerfeld.canvas.auth.validation.CredentialValidator;
import de.bsommerfeld.canvas.auth.validation.Credentials;
import de.bsommerfeld.canvas.auth.validation.ValidationException;
import de.bsommerfeld.canvas.core.concurrent.RemoteOutcome;
import de.bsommerfeld.canvas.core.concurrent.TimedRemoteOperation;
import de.bsommerfeld.canvas.core.config.UserConfig;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.ReadOnlyBooleanProperty;
import javafx.beans.property.ReadOnlyObjectProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Observable state of the login dialog. On success the entered username is
 * remembered in {@link UserConfig} (if the user asked for it) and the dialog
 * closes after a short delay.
 */
final class LoginViewModel {

    static final Duration CLOSE_DELAY = Duration.ofSeconds(1);
    static final String PENDING = "Signing in...";
    static final String SUCCESS = "Login successful";

    private static final Logger LOG = LoggerFactory.getLogger(LoginViewModel.class);

    private final StringProperty username = new SimpleStringProperty("");
    private final StringProperty password = new SimpleStringProperty("");
    private final BooleanProperty rememberUsername = new SimpleBooleanProperty();

    private final AuthSession session;
    private final UserConfig userConfig;
    private final RemoteSubmission submission;
    private final Duration closeDelay;

    private Runnable onClose = () -> {
    };

    LoginViewModel(AuthSession session, UserConfig userConfig, TimedRemoteOperation operation, Executor ui) {
        this(session, userConfig, operation, ui, CLOSE_DELAY);
    }

    LoginViewModel(AuthSession session, UserConfig userConfig, TimedRemoteOperation operation, Executor ui,
            Duration closeDelay) {
        this.session = session;
        this.userConfig = userConfig;
        this.submission = new RemoteSubmission("login", operation, ui);
        this.closeDelay = closeDelay;

        rememberUsername.set(userConfig.isRememberUsername());
        if (userConfig.isRememberUsername() && userConfig.getLastUsername() != null) {
            username.set(userConfig.getLastUsername());
        }
        rememberUsername.addListener((obs, oldVal, newVal) -> userConfig.setRememberUsername(newVal));
    }

    /**
     * Validates the form and starts the login.
     *
     * @return the outcome, or empty if the form was invalid or a login is
     *         pending or the dialog is closing
     */
    Optional<CompletableFuture<RemoteOutcome>> login() {
        if (submission.isLocked()) {
            return Optional.empty();
        }
        Credentials credentials = Credentials.login(username.get(), password.get());
        try {
            CredentialValidator.validateLogin(credentials);
        } catch (ValidationException e) {
            submission.showError(e.getMessage());
            return Optional.empty();
        }

        return submission.submit(PENDING, SUCCESS, true,
                () -> session.login(credentials.username(), credentials.password()).thenApply(AuthResult::toReply))
                .map(pending -> pending.thenApply(outcome -> {
                    if (outcome instanceof RemoteOutcome.Success) {
                        onLoggedIn(credentials.username());
                    }
                    return outcome;
                }));
    }

    private void onLoggedIn(String user) {
        userConfig.setLastUsername(rememberUsername.get() ? user : "");
        LOG.info("Logged in as {}, closing login dialog in {} ms", user, closeDelay.toMillis());
        submission.closeAfter(closeDelay, () -> onClose.run());
    }

    /** Prefills the form, e.g. after a registration. */
    void prefill(String user) {
        username.set(user);
        password.set("");
        submission.showInfo("Account created, please sign in");
    }

    void setOnClose(Runnable onClose) {
        this.onClose = onClose;
    }

    StringProperty usernameProperty() {
        return username;
    }

    StringProperty passwordProperty() {
        return password;
    }

    BooleanProperty rememberUsernameProperty() {
        return rememberUsername;
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
