package de.bsommerfeld.canvas.core.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TimedRemoteOperationTest {

    private ScheduledExecutorService timer;

    @BeforeEach
    void setUp() {
        timer = DaemonExecutors.scheduler("test-timer");
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    void race_shouldReportSuccessWhenReplyArrivesFirst() throws Exception {
        var operation = new TimedRemoteOperation(timer, Duration.ofSeconds(60));

        RemoteOutcome outcome = operation.race("login",
                () -> CompletableFuture.completedFuture(RemoteReply.accepted("ok")))
                .get(1, TimeUnit.SECONDS);

        assertEquals(new RemoteOutcome.Success("ok"), outcome);
    }

    @Test
    void race_shouldReportFailureForRejectedReply() throws Exception {
        var operation = new TimedRemoteOperation(timer, Duration.ofSeconds(60));

        RemoteOutcome outcome = operation.race("register",
                () -> CompletableFuture.completedFuture(RemoteReply.rejected("user exists")))
                .get(1, TimeUnit.SECONDS);

        assertEquals(new RemoteOutcome.Failure("user exists"), outcome);
    }

    @Test
    void race_shouldSucceedForSlowReplyWithinTimeout() throws Exception {
        var operation = new TimedRemoteOperation(timer, Duration.ofMillis(60_000));

        RemoteOutcome outcome = operation.race("register",
                () -> CompletableFuture.supplyAsync(() -> RemoteReply.accepted("ok"),
                        CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS)))
                .get(5, TimeUnit.SECONDS);

        assertEquals(new RemoteOutcome.Success("ok"), outcome);
    }

    @Test
    void race_shouldTimeOutWhenReplyNeverArrives() throws Exception {
        var operation = new TimedRemoteOperation(timer, Duration.ofMillis(50));

        RemoteOutcome outcome = operation.race("login", CompletableFuture::new)
                .get(2, TimeUnit.SECONDS);

        assertInstanceOf(RemoteOutcome.TimedOut.class, outcome);
    }

    @Test
    void race_lateReplyShouldNotOverwriteTimeout() throws Exception {
        var operation = new TimedRemoteOperation(timer, Duration.ofMillis(50));
        CompletableFuture<RemoteReply> pending = new CompletableFuture<>();

        CompletableFuture<RemoteOutcome> result = operation.race("login", () -> pending);
        RemoteOutcome first = result.get(2, TimeUnit.SECONDS);
        pending.complete(RemoteReply.accepted("too late"));

        assertInstanceOf(RemoteOutcome.TimedOut.class, first);
        assertInstanceOf(RemoteOutcome.TimedOut.class, result.join());
    }

    @Test
    void race_shouldLeaveRemoteCallRunningAfterTimeout() throws Exception {
        var operation = new TimedRemoteOperation(timer, Duration.ofMillis(50));
        CompletableFuture<RemoteReply> pending = new CompletableFuture<>();

        operation.race("login", () -> pending).get(2, TimeUnit.SECONDS);

        assertFalse(pending.isDone());
        assertFalse(pending.isCancelled());
    }

    @Test
    void race_shouldClassifyConnectFailureAsTransport() throws Exception {
        var operation = new TimedRemoteOperation(timer, Duration.ofSeconds(60));

        RemoteOutcome outcome = operation.race("login",
                () -> CompletableFuture.failedFuture(new ConnectException("refused")))
                .get(1, TimeUnit.SECONDS);

        var errored = assertInstanceOf(RemoteOutcome.Errored.class, outcome);
        assertEquals(ErrorKind.TRANSPORT, errored.kind());
        assertEquals("refused", errored.message());
    }

    @Test
    void race_shouldClassifyClientTimeoutAndCancellationAsCancelled() throws Exception {
        var operation = new TimedRemoteOperation(timer, Duration.ofSeconds(60));

        RemoteOutcome httpTimeout = operation.race("register",
                () -> CompletableFuture.failedFuture(new HttpTimeoutException("request timed out")))
                .get(1, TimeUnit.SECONDS);
        CompletableFuture<RemoteReply> cancelled = new CompletableFuture<>();
        cancelled.cancel(true);
        RemoteOutcome cancellation = operation.race("register", () -> cancelled)
                .get(1, TimeUnit.SECONDS);

        assertEquals(ErrorKind.CANCELLED, ((RemoteOutcome.Errored) httpTimeout).kind());
        assertEquals(ErrorKind.CANCELLED, ((RemoteOutcome.Errored) cancellation).kind());
    }

    @Test
    void race_shouldReportSynchronousThrowAsUnexpected() throws Exception {
        var operation = new TimedRemoteOperation(timer, Duration.ofSeconds(60));

        RemoteOutcome outcome = operation.race("login", () -> {
            throw new IllegalStateException("boom");
        }).get(1, TimeUnit.SECONDS);

        var errored = assertInstanceOf(RemoteOutcome.Errored.class, outcome);
        assertEquals(ErrorKind.UNEXPECTED, errored.kind());
    }

    @Test
    void race_shouldTreatNullReplyAsError() throws Exception {
        var operation = new TimedRemoteOperation(timer, Duration.ofSeconds(60));

        RemoteOutcome outcome = operation.race("login", () -> CompletableFuture.completedFuture(null))
                .get(1, TimeUnit.SECONDS);

        assertInstanceOf(RemoteOutcome.Errored.class, outcome);
    }

    @Test
    void constructor_shouldRejectNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new TimedRemoteOperation(timer, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new TimedRemoteOperation(timer, Duration.ofSeconds(-1)));
    }

    @Test
    void classify_shouldUnwrapCompletionException() {
        var wrapped = new java.util.concurrent.CompletionException(new ConnectException("down"));
        assertEquals(ErrorKind.TRANSPORT, ErrorKind.classify(wrapped));
        assertEquals(ErrorKind.CANCELLED, ErrorKind.classify(new CancellationException()));
        assertEquals(ErrorKind.UNEXPECTED, ErrorKind.classify(new NullPointerException()));
    }
}
