package de.bsommerfeld.canvas.ui.view.account;

import de.bsommerfeld.canvas.core.concurrent.DaemonExecutors;
import de.bsommerfeld.canvas.core.concurrent.ErrorKind;
import de.bsommerfeld.canvas.core.concurrent.RemoteOutcome;
import de.bsommerfeld.canvas.core.concurrent.RemoteReply;
import de.bsommerfeld.canvas.core.concurrent.TimedRemoteOperation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RemoteSubmissionTest {

    private ScheduledExecutorService timer;
    private RemoteSubmission submission;

    @BeforeEach
    void setUp() {
        timer = DaemonExecutors.scheduler("submission-test");
        submission = new RemoteSubmission("test", new TimedRemoteOperation(timer, Duration.ofMillis(300)),
                Runnable::run);
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    void submit_shouldDisableControlsWhilePending() {
        CompletableFuture<RemoteReply> reply = new CompletableFuture<>();

        CompletableFuture<RemoteOutcome> outcome = submission.submit("Working...", "Done", () -> reply).orElseThrow();

        assertTrue(submission.isLocked());
        assertEquals(SubmissionState.SUBMITTING, submission.getState());
        assertEquals(StatusMessage.info("Working..."), submission.getStatus());

        reply.complete(new RemoteReply(true, "ok"));
        assertEquals(new RemoteOutcome.Success("ok"), outcome.join());
        assertFalse(submission.isLocked());
        assertEquals(SubmissionState.SUCCESS, submission.getState());
    }

    @Test
    void submit_shouldRejectWhileSubmitting() {
        CompletableFuture<RemoteReply> reply = new CompletableFuture<>();
        submission.submit("Working...", "Done", () -> reply);

        Optional<CompletableFuture<RemoteOutcome>> second = submission.submit("Again", "Done",
                () -> CompletableFuture.completedFuture(new RemoteReply(true, "ok")));

        assertTrue(second.isEmpty());
        assertEquals(StatusMessage.info("Working..."), submission.getStatus());
    }

    @Test
    void submit_shouldStayLockedAfterSuccessThatClosesDialog() throws InterruptedException {
        submission.submit("Working...", "Done", true,
                () -> CompletableFuture.completedFuture(new RemoteReply(true, "ok"))).orElseThrow().join();

        assertEquals(SubmissionState.SUCCESS, submission.getState());
        assertTrue(submission.isLocked());
        assertTrue(submission.submit("Again", "Done", true,
                () -> CompletableFuture.completedFuture(new RemoteReply(true, "ok"))).isEmpty());

        CountDownLatch closed = new CountDownLatch(1);
        submission.closeAfter(Duration.ofMillis(20), closed::countDown);
        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertEquals(SubmissionState.CLOSING, submission.getState());
        assertTrue(submission.isLocked());
    }

    @Test
    void submit_shouldUnlockAfterFailureThatClosesDialog() {
        submission.submit("Working...", "Done", true,
                () -> CompletableFuture.completedFuture(new RemoteReply(false, "nope"))).orElseThrow().join();

        assertEquals(SubmissionState.FAILURE, submission.getState());
        assertFalse(submission.isLocked());
    }

    @Test
    void submit_shouldUseFallbackWhenServerSendsNoMessage() {
        RemoteOutcome outcome = submission.submit("Working...", "Done",
                () -> CompletableFuture.completedFuture(new RemoteReply(true, ""))).orElseThrow().join();

        assertTrue(outcome instanceof RemoteOutcome.Success);
        assertEquals(StatusMessage.success("Done"), submission.getStatus());
    }

    @Test
    void submit_shouldReenableControlsAfterTransportError() {
        RemoteOutcome outcome = submission.submit("Working...", "Done",
                () -> CompletableFuture.<RemoteReply>failedFuture(new ConnectException("Connection refused")))
                .orElseThrow().join();

        assertEquals(ErrorKind.TRANSPORT, ((RemoteOutcome.Errored) outcome).kind());
        assertEquals(SubmissionState.ERRORED, submission.getState());
        assertEquals(StatusMessage.error(StatusMessages.TRANSPORT), submission.getStatus());
        assertFalse(submission.isLocked());
    }

    @Test
    void submit_shouldKeepTimeoutStatusWhenLateReplyArrives() {
        CompletableFuture<RemoteReply> reply = new CompletableFuture<>();

        RemoteOutcome outcome = submission.submit("Working...", "Done", () -> reply).orElseThrow().join();
        reply.complete(new RemoteReply(true, "too late"));

        assertTrue(outcome instanceof RemoteOutcome.TimedOut);
        assertEquals(SubmissionState.TIMED_OUT, submission.getState());
        assertEquals(StatusMessage.error(StatusMessages.TIMED_OUT), submission.getStatus());
        assertFalse(submission.isLocked());
    }

    @Test
    void submit_shouldAcceptNewSubmitAfterFailure() {
        submission.submit("Working...", "Done",
                () -> CompletableFuture.completedFuture(new RemoteReply(false, "nope"))).orElseThrow().join();

        assertEquals(SubmissionState.FAILURE, submission.getState());
        assertTrue(submission.submit("Working...", "Done",
                () -> CompletableFuture.completedFuture(new RemoteReply(true, "ok"))).isPresent());
    }

    @Test
    void closeAfter_shouldMoveToClosingAndRunCallback() throws InterruptedException {
        CountDownLatch closed = new CountDownLatch(1);

        submission.closeAfter(Duration.ofMillis(20), closed::countDown);

        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertEquals(SubmissionState.CLOSING, submission.getState());
    }

    @Test
    void showError_shouldNotChangeState() {
        submission.showError("Please enter a username");

        assertEquals(SubmissionState.IDLE, submission.getState());
        assertTrue(submission.getStatus().isError());
    }
}
