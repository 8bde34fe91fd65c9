package de.bsommerfeld.canvas.ui.view.account;

/**
 * Lifecycle of one account-dialog submission.
 *
 * <pre>
 * IDLE → SUBMITTING → { SUCCESS, FAILURE, TIMED_OUT, ERRORED }
 * SUCCESS → CLOSING   (after the display delay)
 * </pre>
 *
 * {@link #SUBMITTING} never accepts a new submit. {@link #SUCCESS} and
 * {@link #CLOSING} do not either when the success closes the dialog.
 */
public enum SubmissionState {
    IDLE,
    SUBMITTING,
    SUCCESS,
    FAILURE,
    TIMED_OUT,
    ERRORED,
    CLOSING;

    public boolean isResolved() {
        return this == SUCCESS || this == FAILURE || this == TIMED_OUT || this == ERRORED;
    }
}
