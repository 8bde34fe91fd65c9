package de.bsommerfeld.canvas.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Offline {@link AuthClient} for TEST mode. Keeps accounts in memory and
 * answers immediately.
 *
 * <p>
 * A {@code demo}/{@code demo123} account exists from the start. The reset
 * code is always {@value #RESET_CODE}.
 */
public class TestAuthClient implements AuthClient {

    private static final Logger LOG = LoggerFactory.getLogger(TestAuthClient.class);

    static final String RESET_CODE = "123456";
    private static final int TEST_DAYS = 30;

    private record Account(String password, String email) {
    }

    private final Map<String, Account> accounts = new ConcurrentHashMap<>();
    private final Map<String, String> tokens = new ConcurrentHashMap<>();

    public TestAuthClient() {
        accounts.put("demo", new Account("demo123", "demo@example.com"));
    }

    @Override
    public CompletableFuture<AuthResult> login(String username, String password) {
        Account account = accounts.get(username);
        if (account == null || !account.password().equals(password)) {
            return CompletableFuture.completedFuture(AuthResult.failed("Invalid username or password"));
        }
        String token = UUID.randomUUID().toString();
        tokens.put(token, username);
        SessionGrant grant = new SessionGrant(token, Instant.now().plus(TEST_DAYS, ChronoUnit.DAYS), TEST_DAYS, 3);
        LOG.info("[TEST] Login for {}", username);
        return CompletableFuture.completedFuture(
                new AuthResult(true, "Login successful. " + TEST_DAYS + " days remaining", grant));
    }

    @Override
    public CompletableFuture<AuthResult> register(String username, String password, String email) {
        if (accounts.putIfAbsent(username, new Account(password, email)) != null) {
            return CompletableFuture.completedFuture(AuthResult.failed("Username already exists"));
        }
        LOG.info("[TEST] Registered {}", username);
        return CompletableFuture.completedFuture(AuthResult.ok("Registration successful"));
    }

    @Override
    public CompletableFuture<AuthResult> sendResetCode(String email) {
        if (findByEmail(email) == null) {
            return CompletableFuture.completedFuture(AuthResult.failed("No account with this email"));
        }
        LOG.info("[TEST] Reset code for {} is {}", email, RESET_CODE);
        return CompletableFuture.completedFuture(AuthResult.ok("Verification code sent"));
    }

    @Override
    public CompletableFuture<AuthResult> resetPassword(String email, String code, String newPassword) {
        String username = findByEmail(email);
        if (username == null) {
            return CompletableFuture.completedFuture(AuthResult.failed("No account with this email"));
        }
        if (!RESET_CODE.equals(code)) {
            return CompletableFuture.completedFuture(AuthResult.failed("Invalid verification code"));
        }
        accounts.put(username, new Account(newPassword, email));
        return CompletableFuture.completedFuture(AuthResult.ok("Password reset successful"));
    }

    @Override
    public CompletableFuture<AuthResult> heartbeat(String token) {
        if (token == null || !tokens.containsKey(token)) {
            return CompletableFuture.completedFuture(AuthResult.failed("Session is no longer valid"));
        }
        return CompletableFuture.completedFuture(AuthResult.ok("ok"));
    }

    private String findByEmail(String email) {
        for (Map.Entry<String, Account> entry : accounts.entrySet()) {
            if (entry.getValue().email() != null && entry.getValue().email().equalsIgnoreCase(email)) {
                return entry.getKey();
            }
        }
        return null;
    }
}
