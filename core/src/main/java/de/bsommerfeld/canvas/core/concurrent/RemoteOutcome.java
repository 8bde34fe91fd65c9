package de.bsommerfeld.canvas.core.concurrent;

/**
 * How a timed remote call resolved. Exactly one outcome is produced per
 * call.
 */
public sealed interface RemoteOutcome
        permits RemoteOutcome.Success, RemoteOutcome.Failure, RemoteOutcome.TimedOut, RemoteOutcome.Errored {

    /** The server accepted the request. */
    record Success(String message) implements RemoteOutcome {
    }

    /** The server answered but rejected the request. */
    record Failure(String message) implements RemoteOutcome {
    }

    /** The timer fired before the server answered. */
    record TimedOut() implements RemoteOutcome {
    }

    /** The call threw instead of answering. */
    record Errored(ErrorKind kind, Throwable cause) implements RemoteOutcome {

        public String message() {
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
    }

    static RemoteOutcome of(RemoteReply reply) {
        return reply.success() ? new Success(reply.message()) : new Failure(reply.message());
    }

    static RemoteOutcome errored(Throwable error) {
        Throwable cause = ErrorKind.unwrap(error);
        return new Errored(ErrorKind.classify(cause), cause);
    }
}
