package de.bsommerfeld.canvas.ui.view.account;

import de.bsommerfeld.canvas.core.concurrent.RemoteOutcome;
import de.bsommerfeld.canvas.core.concurrent.RemoteReply;
import de.bsommerfeld.canvas.core.concurrent.TimedRemoteOperation;
import javafx.beans.property.ReadOnlyBooleanProperty;
import javafx.beans.property.ReadOnlyBooleanWrapper;
import javafx.beans.property.ReadOnlyObjectProperty;
import javafx.beans.property.ReadOnlyObjectWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Drives one dialog's remote call through {@link TimedRemoteOperation} and
 * exposes the result as observable state.
 *
 * <p>
 * {@link #lockedProperty()} is true while a call is in flight; dialogs bind
 * their buttons' {@code disable} to it. A success that closes the dialog
 * keeps it locked through {@code SUCCESS} and {@code CLOSING}, so the close
 * delay cannot start a second call. Any other resolution unlocks it. The
 * resolution is applied on the UI executor, and the lock is updated in a
 * {@code finally} block so controls come back even if rendering the status
 * fails.
 *
 * <p>
 * All methods must be called on the UI thread.
 */
final class RemoteSubmission {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteSubmission.class);

    private final String name;
    private final TimedRemoteOperation operation;
    private final Executor ui;

    private final ReadOnlyObjectWrapper<SubmissionState> state = new ReadOnlyObjectWrapper<>(SubmissionState.IDLE);
    private final ReadOnlyObjectWrapper<StatusMessage> status = new ReadOnlyObjectWrapper<>(StatusMessage.NONE);
    private final ReadOnlyBooleanWrapper locked = new ReadOnlyBooleanWrapper(false);

    RemoteSubmission(String name, TimedRemoteOperation operation, Executor ui) {
        this.name = name;
        this.operation = operation;
        this.ui = ui;
    }

    /**
     * Starts a call whose success leaves the dialog open, like sending a
     * verification code.
     *
     * @see #submit(String, String, boolean, Supplier)
     */
    Optional<CompletableFuture<RemoteOutcome>> submit(String pendingText, String successFallback,
            Supplier<CompletableFuture<RemoteReply>> call) {
        return submit(pendingText, successFallback, false, call);
    }

    /**
     * Starts a call unless one is pending or the dialog is closing.
     *
     * @param pendingText     status shown while waiting
     * @param successFallback status shown if the server accepts without a
     *                        message
     * @param closesOnSuccess keep the controls locked after a success, until
     *                        the dialog is gone
     * @return the outcome, completed after it has been applied on the UI
     *         executor; empty if the submission is locked
     */
    Optional<CompletableFuture<RemoteOutcome>> submit(String pendingText, String successFallback,
            boolean closesOnSuccess, Supplier<CompletableFuture<RemoteReply>> call) {
        if (locked.get()) {
            LOG.debug("[{}] Ignoring submit in state {}", name, state.get());
            return Optional.empty();
        }
        locked.set(true);
        state.set(SubmissionState.SUBMITTING);
        status.set(StatusMessage.info(pendingText));

        return Optional.of(operation.race(name, call)
                .thenApplyAsync(outcome -> resolve(outcome, successFallback, closesOnSuccess), ui));
    }

    private RemoteOutcome resolve(RemoteOutcome outcome, String successFallback, boolean closesOnSuccess) {
        try {
            status.set(StatusMessages.describe(outcome, successFallback));
        } finally {
            state.set(StatusMessages.stateOf(outcome));
            locked.set(closesOnSuccess && outcome instanceof RemoteOutcome.Success);
        }
        return outcome;
    }

    /** Shows a client-side error. Does not touch the submission state. */
    void showError(String message) {
        status.set(StatusMessage.error(message));
    }

    void showInfo(String message) {
        status.set(StatusMessage.info(message));
    }

    /**
     * Moves to {@code CLOSING} after {@code delay} and then runs
     * {@code onClose}, both on the UI executor.
     */
    void closeAfter(Duration delay, Runnable onClose) {
        Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, ui);
        delayed.execute(() -> {
            state.set(SubmissionState.CLOSING);
            onClose.run();
        });
    }

    SubmissionState getState() {
        return state.get();
    }

    ReadOnlyObjectProperty<SubmissionState> stateProperty() {
        return state.getReadOnlyProperty();
    }

    StatusMessage getStatus() {
        return status.get();
    }

    ReadOnlyObjectProperty<StatusMessage> statusProperty() {
        return status.getReadOnlyProperty();
    }

    boolean isLocked() {
        return locked.get();
    }

    ReadOnlyBooleanProperty lockedProperty() {
        return locked.getReadOnlyProperty();
    }
}
