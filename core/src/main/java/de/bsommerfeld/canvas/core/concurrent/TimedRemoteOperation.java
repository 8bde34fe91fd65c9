package de.bsommerfeld.canvas.core.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Races a remote call against a timer.
 *
 * <p>
 * Whichever side finishes first completes the returned future; the other
 * side's result is dropped. When the timer wins, the remote call is
 * <strong>not</strong> cancelled. It keeps running and whatever it
 * eventually returns is discarded, so the timeout only decides when the
 * caller stops waiting.
 *
 * <h3>Outcomes</h3>
 * <ul>
 * <li>reply with {@code success=true} → {@link RemoteOutcome.Success}</li>
 * <li>reply with {@code success=false} → {@link RemoteOutcome.Failure}</li>
 * <li>timer first → {@link RemoteOutcome.TimedOut}</li>
 * <li>call throws (synchronously or through its future) →
 * {@link RemoteOutcome.Errored}</li>
 * </ul>
 * The returned future never completes exceptionally.
 */
public final class TimedRemoteOperation {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private static final Logger LOG = LoggerFactory.getLogger(TimedRemoteOperation.class);

    private final ScheduledExecutorService timer;
    private final Duration timeout;

    public TimedRemoteOperation(ScheduledExecutorService timer, Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        this.timer = timer;
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Starts the call and the timer.
     *
     * @param name      label for log output, e.g. {@code "login"}
     * @param operation starts the remote call and returns its pending reply
     */
    public CompletableFuture<RemoteOutcome> race(String name, Supplier<CompletableFuture<RemoteReply>> operation) {
        CompletableFuture<RemoteOutcome> outcome = new CompletableFuture<>();

        CompletableFuture<RemoteReply> call;
        try {
            call = operation.get();
        } catch (RuntimeException e) {
            LOG.warn("[{}] Remote call failed to start", name, e);
            outcome.complete(RemoteOutcome.errored(e));
            return outcome;
        }
        if (call == null) {
            outcome.complete(RemoteOutcome.errored(new IllegalStateException("No pending reply for " + name)));
            return outcome;
        }

        ScheduledFuture<?> deadline = timer.schedule(() -> {
            if (outcome.complete(new RemoteOutcome.TimedOut())) {
                LOG.warn("[{}] No reply within {} ms, giving up", name, timeout.toMillis());
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        call.whenComplete((reply, error) -> {
            RemoteOutcome resolved;
            if (error != null) {
                resolved = RemoteOutcome.errored(error);
            } else if (reply == null) {
                resolved = RemoteOutcome.errored(new IllegalStateException("Empty reply for " + name));
            } else {
                resolved = RemoteOutcome.of(reply);
            }

            if (outcome.complete(resolved)) {
                deadline.cancel(false);
                LOG.debug("[{}] Resolved: {}", name, resolved);
            } else {
                LOG.info("[{}] Late result discarded: {}", name, resolved);
            }
        });
        return outcome;
    }
}
