package de.bsommerfeld.canvas.core.concurrent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Buckets for exceptions thrown by a remote call. Each bucket has its own
 * user-facing message.
 */
public enum ErrorKind {

    /** The server could not be reached at all. */
    TRANSPORT,

    /**
     * The request was aborted before a reply arrived. Covers the HTTP
     * client's own request timeout as well as cancellation and interrupts.
     */
    CANCELLED,

    /** Anything else. */
    UNEXPECTED;

    /**
     * Classifies a failure after stripping the {@link CompletionException} and
     * {@link ExecutionException} wrappers that futures add.
     */
    public static ErrorKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof HttpTimeoutException
                || cause instanceof CancellationException
                || cause instanceof InterruptedException) {
            return CANCELLED;
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return TRANSPORT;
        }
        return UNEXPECTED;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
