package de.bsommerfeld.canvas.ui.view.account;

import de.bsommerfeld.canvas.core.concurrent.RemoteOutcome;

/**
 * Maps a {@link RemoteOutcome} to the status line of an account dialog.
 * Server messages are shown as sent; the other cases use fixed texts.
 */
final class StatusMessages {

    static final String TIMED_OUT = "The server did not respond in time. Please check your network connection and try again.";
    static final String TRANSPORT = "Cannot reach the server. Please check your network connection.";
    static final String CANCELLED = "The request timed out or was cancelled. Please try again.";
    static final String UNEXPECTED = "Unexpected error: ";
    static final String REJECTED = "The server rejected the request";

    private StatusMessages() {
    }

    /**
     * @param successFallback shown when the server accepts without a message
     */
    static StatusMessage describe(RemoteOutcome outcome, String successFallback) {
        if (outcome instanceof RemoteOutcome.Success) {
            String message = ((RemoteOutcome.Success) outcome).message();
            return StatusMessage.success(isBlank(message) ? successFallback : message);
        }
        if (outcome instanceof RemoteOutcome.Failure) {
            String message = ((RemoteOutcome.Failure) outcome).message();
            return StatusMessage.error(isBlank(message) ? REJECTED : message);
        }
        if (outcome instanceof RemoteOutcome.TimedOut) {
            return StatusMessage.error(TIMED_OUT);
        }
        RemoteOutcome.Errored errored = (RemoteOutcome.Errored) outcome;
        switch (errored.kind()) {
            case TRANSPORT:
                return StatusMessage.error(TRANSPORT);
            case CANCELLED:
                return StatusMessage.error(CANCELLED);
            default:
                return StatusMessage.error(UNEXPECTED + errored.message());
        }
    }

    static SubmissionState stateOf(RemoteOutcome outcome) {
        if (outcome instanceof RemoteOutcome.Success) {
            return SubmissionState.SUCCESS;
        }
        if (outcome instanceof RemoteOutcome.Failure) {
            return SubmissionState.FAILURE;
        }
        if (outcome instanceof RemoteOutcome.TimedOut) {
            return SubmissionState.TIMED_OUT;
        }
        return SubmissionState.ERRORED;
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
