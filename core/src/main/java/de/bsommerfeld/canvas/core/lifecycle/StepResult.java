package de.bsommerfeld.canvas.core.lifecycle;

import java.time.Duration;

/**
 * What happened to one {@link ShutdownStep}.
 *
 * @param failure the exception thrown by the step, {@code null} unless
 *                {@code status} is {@link Status#FAILED}
 */
public record StepResult(String name, Status status, Throwable failure, Duration elapsed) {

    public enum Status {
        COMPLETED,
        FAILED,
        /** The collaborator the step tears down was never created. */
        SKIPPED
    }

    static StepResult completed(String name, Duration elapsed) {
        return new StepResult(name, Status.COMPLETED, null, elapsed);
    }

    static StepResult failed(String name, Throwable failure, Duration elapsed) {
        return new StepResult(name, Status.FAILED, failure, elapsed);
    }

    static StepResult skipped(String name) {
        return new StepResult(name, Status.SKIPPED, null, Duration.ZERO);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
