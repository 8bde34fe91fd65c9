package de.bsommerfeld.canvas.auth;

import de.bsommerfeld.canvas.core.event.ApplicationEventBus;
import de.bsommerfeld.canvas.core.event.SessionEvents.AuthenticationChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The signed-in account of this application instance.
 *
 * <p>
 * Wraps an {@link AuthClient}: a successful {@link #login} records the
 * {@link SessionGrant}, starts the heartbeat and posts an
 * {@link AuthenticationChangedEvent}. The heartbeat re-validates the token
 * periodically; a rejection ends the session, a transport failure does not.
 *
 * <p>
 * Created once by the injector and owned by the main window, which closes it
 * during shutdown. Events are posted from whichever thread completes the
 * call; UI listeners marshal themselves.
 */
public class AuthSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AuthSession.class);
    private static final Duration FIRST_HEARTBEAT = Duration.ofMinutes(1);

    private final AuthClient client;
    private final ApplicationEventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final Duration heartbeatInterval;

    private String username;
    private SessionGrant grant;
    private ScheduledFuture<?> heartbeat;
    private boolean closed;

    public AuthSession(AuthClient client, ApplicationEventBus eventBus,
            ScheduledExecutorService scheduler, Duration heartbeatInterval) {
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("Heartbeat interval must be positive: " + heartbeatInterval);
        }
        this.client = client;
        this.eventBus = eventBus;
        this.scheduler = scheduler;
        this.heartbeatInterval = heartbeatInterval;
    }

    // =====================================================================
    // Account operations
    // =====================================================================

    /**
     * Logs in and, on success, establishes the session before the returned
     * future completes.
     *
     * @throws IllegalStateException if the session has been closed
     */
    public CompletableFuture<AuthResult> login(String username, String password) {
        ensureOpen();
        return client.login(username, password).thenApply(result -> {
            if (result.success()) {
                establish(username, result.grant());
            }
            return result;
        });
    }

    public CompletableFuture<AuthResult> register(String username, String password, String email) {
        ensureOpen();
        return client.register(username, password, email);
    }

    public CompletableFuture<AuthResult> sendResetCode(String email) {
        ensureOpen();
        return client.sendResetCode(email);
    }

    public CompletableFuture<AuthResult> resetPassword(String email, String code, String newPassword) {
        ensureOpen();
        return client.resetPassword(email, code, newPassword);
    }

    // =====================================================================
    // State
    // =====================================================================

    public synchronized boolean isAuthenticated() {
        return username != null;
    }

    public synchronized Optional<String> getUsername() {
        return Optional.ofNullable(username);
    }

    public synchronized int getRemainingDays() {
        return grant != null ? grant.remainingDays() : 0;
    }

    public synchronized Optional<Instant> getExpiresAt() {
        return grant != null ? Optional.ofNullable(grant.expiresAt()) : Optional.empty();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /** Ends the session if there is one. */
    public void logout() {
        boolean wasAuthenticated;
        synchronized (this) {
            wasAuthenticated = username != null;
            stopHeartbeat();
            username = null;
            grant = null;
        }
        if (wasAuthenticated) {
            LOG.info("Logged out");
            eventBus.post(new AuthenticationChangedEvent(false, null));
        }
    }

    /**
     * Logs out, stops the heartbeat scheduler and refuses further calls.
     * Calling it again does nothing.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        logout();
        scheduler.shutdownNow();
        LOG.info("Auth session closed");
    }

    // =====================================================================
    // Heartbeat
    // =====================================================================

    private void establish(String username, SessionGrant grant) {
        synchronized (this) {
            if (closed) {
                LOG.warn("Login for {} completed after the session was closed; ignoring", username);
                return;
            }
            stopHeartbeat();
            this.username = username;
            this.grant = grant;
            long first = Math.min(FIRST_HEARTBEAT.toMillis(), heartbeatInterval.toMillis());
            heartbeat = scheduler.scheduleAtFixedRate(this::runHeartbeat,
                    first, heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
        LOG.info("Session established for {}", username);
        eventBus.post(new AuthenticationChangedEvent(true, username));
    }

    /** One heartbeat round trip. Package-private so tests can drive it. */
    void runHeartbeat() {
        String token;
        synchronized (this) {
            if (username == null || grant == null) {
                return;
            }
            token = grant.token();
        }
        client.heartbeat(token).whenComplete((result, error) -> {
            if (error != null) {
                LOG.warn("Heartbeat failed, keeping session: {}", error.getMessage());
                return;
            }
            if (!result.success()) {
                LOG.warn("Heartbeat rejected: {}", result.message());
                logout();
                return;
            }
            refresh(token, result.grant());
        });
    }

    private synchronized void refresh(String token, SessionGrant update) {
        if (grant == null || update == null || !Objects.equals(token, grant.token())) {
            return;
        }
        grant = new SessionGrant(
                grant.token(),
                update.expiresAt() != null ? update.expiresAt() : grant.expiresAt(),
                update.remainingDays() > 0 ? update.remainingDays() : grant.remainingDays(),
                grant.resetDeviceCount());
    }

    private void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.cancel(false);
            heartbeat = null;
        }
    }

    private synchronized void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Auth session is closed");
        }
    }
}
