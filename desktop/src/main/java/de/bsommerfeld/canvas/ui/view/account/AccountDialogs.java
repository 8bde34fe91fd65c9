package de.bsommerfeld.canvas.ui.view.account;

import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.canvas.auth.AuthSession;
import de.bsommerfeld.canvas.core.concurrent.TimedRemoteOperation;
import de.bsommerfeld.canvas.core.config.UserConfig;
import de.bsommerfeld.canvas.ui.config.AppModule;
import jakarta.inject.Inject;
import javafx.stage.Window;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Entry point to the login, registration and password-reset dialogs. Each
 * call builds a fresh dialog and view model.
 */
@Singleton
public class AccountDialogs {

    private final AuthSession session;
    private final UserConfig userConfig;
    private final TimedRemoteOperation operation;
    private final Executor fx;
    private final ScheduledExecutorService timer;

    @Inject
    public AccountDialogs(AuthSession session, UserConfig userConfig, TimedRemoteOperation operation,
            @Named(AppModule.FX_EXECUTOR) Executor fx, @Named(AppModule.UI_TIMER) ScheduledExecutorService timer) {
        this.session = session;
        this.userConfig = userConfig;
        this.operation = operation;
        this.fx = fx;
        this.timer = timer;
    }

    /**
     * Shows the login dialog and blocks until it closes.
     *
     * @return whether the user is signed in afterwards
     */
    public boolean login(Window owner) {
        LoginViewModel viewModel = new LoginViewModel(session, userConfig, operation, fx);
        new LoginDialog(owner, viewModel, this::register, this::resetPassword).showAndWait();
        return session.isAuthenticated();
    }

    /** @return the new username if an account was created */
    public Optional<String> register(Window owner) {
        return new RegisterDialog(owner, new RegisterViewModel(session, operation, fx)).showAndWait();
    }

    public void resetPassword(Window owner) {
        new ResetPasswordDialog(owner, new ResetPasswordViewModel(session, operation, fx, timer)).showAndWait();
    }
}
