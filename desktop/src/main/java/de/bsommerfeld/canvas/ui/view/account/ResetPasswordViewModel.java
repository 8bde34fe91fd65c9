package de.bsommerfeld.canvas.ui.view.account;

import de.bsommerfeld.canvas.auth.AuthResult;
import de.bsommerfeld.canvas.auth.AuthSession;
import de.bsommerfeld.canvas.auth.validation.CredentialValidator;
import de.bsommerfeld.canvas.auth.validation.ValidationException;
import de.bsommerfeld.canvas.core.concurrent.RemoteOutcome;
import de.bsommerfeld.canvas.core.concurrent.TimedRemoteOperation;
import javafx.beans.binding.Bindings;
import javafx.beans.binding.BooleanBinding;
import javafx.beans.property.ReadOnlyBooleanProperty;
import javafx.beans.property.ReadOnlyIntegerProperty;
import javafx.beans.property.ReadOnlyIntegerWrapper;
import javafx.beans.property.ReadOnlyObjectProperty;
import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Observable state of the password-reset dialog: requesting a verification
 * code by email, then setting a new password with it.
 *
 * <p>
 * After a code has been sent, {@link #canSendCodeProperty()} stays false for
 * {@value #RESEND_SECONDS} seconds.
 */
final class ResetPasswordViewModel {

    static final Duration CLOSE_DELAY = Duration.ofMillis(1500);
    static final int RESEND_SECONDS = 60;
    static final String SENDING = "Sending verification code...";
    static final String CODE_SENT = "Verification code sent, please check your inbox";
    static final String PENDING = "Resetting password...";
    static final String SUCCESS = "Password has been reset";

    private final StringProperty email = new SimpleStringProperty("");
    private final StringProperty code = new SimpleStringProperty("");
    private final StringProperty newPassword = new SimpleStringProperty("");
    private final ReadOnlyIntegerWrapper resendCountdown = new ReadOnlyIntegerWrapper(0);
    private final BooleanBinding canSendCode;

    private final AuthSession session;
    private final RemoteSubmission submission;
    private final ScheduledExecutorService timer;
    private final Executor ui;
    private final Duration closeDelay;

    private ScheduledFuture<?> countdownTask;
    private Runnable onClose = () -> {
    };

    ResetPasswordViewModel(AuthSession session, TimedRemoteOperation operation, Executor ui,
            ScheduledExecutorService timer) {
        this(session, operation, ui, timer, CLOSE_DELAY);
    }

    ResetPasswordViewModel(AuthSession session, TimedRemoteOperation operation, Executor ui,
            ScheduledExecutorService timer, Duration closeDelay) {
        this.session = session;
        this.submission = new RemoteSubmission("reset-password", operation, ui);
        this.timer = timer;
        this.ui = ui;
        this.closeDelay = closeDelay;
        this.canSendCode = Bindings.createBooleanBinding(
                () -> resendCountdown.get() == 0 && !submission.isLocked(),
                resendCountdown, submission.lockedProperty());
    }

    /**
     * Requests a verification code for the entered email address and starts
     * the resend countdown once the server accepted.
     */
    Optional<CompletableFuture<RemoteOutcome>> sendCode() {
        if (!canSendCode.get()) {
            return Optional.empty();
        }
        String address = email.get() == null ? "" : email.get().trim();
        try {
            CredentialValidator.validateEmail(address);
        } catch (ValidationException e) {
            submission.showError(e.getMessage());
            return Optional.empty();
        }

        return submission.submit(SENDING, CODE_SENT,
                () -> session.sendResetCode(address).thenApply(AuthResult::toReply))
                .map(pending -> pending.thenApply(outcome -> {
                    if (outcome instanceof RemoteOutcome.Success) {
                        startCountdown();
                    }
                    return outcome;
                }));
    }

    /**
     * Validates the form and resets the password. Closes the dialog after a
     * short delay on success.
     */
    Optional<CompletableFuture<RemoteOutcome>> resetPassword() {
        if (submission.isLocked()) {
            return Optional.empty();
        }
        String address = email.get() == null ? "" : email.get().trim();
        String verificationCode = code.get() == null ? "" : code.get().trim();
        try {
            CredentialValidator.validatePasswordReset(address, verificationCode, newPassword.get());
        } catch (ValidationException e) {
            submission.showError(e.getMessage());
            return Optional.empty();
        }

        return submission.submit(PENDING, SUCCESS, true,
                () -> session.resetPassword(address, verificationCode, newPassword.get())
                        .thenApply(AuthResult::toReply))
                .map(pending -> pending.thenApply(outcome -> {
                    if (outcome instanceof RemoteOutcome.Success) {
                        stopCountdown();
                        submission.closeAfter(closeDelay, () -> onClose.run());
                    }
                    return outcome;
                }));
    }

    private void startCountdown() {
        stopCountdown();
        resendCountdown.set(RESEND_SECONDS);
        countdownTask = timer.scheduleAtFixedRate(() -> ui.execute(this::tick), 1, 1, TimeUnit.SECONDS);
    }

    private void tick() {
        int left = Math.max(0, resendCountdown.get() - 1);
        resendCountdown.set(left);
        if (left == 0) {
            stopCountdown();
        }
    }

    private void stopCountdown() {
        if (countdownTask != null) {
            countdownTask.cancel(false);
            countdownTask = null;
        }
    }

    /** Stops the countdown when the dialog goes away. */
    void dispose() {
        stopCountdown();
    }

    void setOnClose(Runnable onClose) {
        this.onClose = onClose;
    }

    StringProperty emailProperty() {
        return email;
    }

    StringProperty codeProperty() {
        return code;
    }

    StringProperty newPasswordProperty() {
        return newPassword;
    }

    ReadOnlyIntegerProperty resendCountdownProperty() {
        return resendCountdown.getReadOnlyProperty();
    }

    BooleanBinding canSendCodeProperty() {
        return canSendCode;
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
