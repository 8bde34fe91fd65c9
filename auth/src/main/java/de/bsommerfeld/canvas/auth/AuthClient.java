package de.bsommerfeld.canvas.auth;

import java.util.concurrent.CompletableFuture;

/**
 * Account-server operations.
 *
 * <p>
 * A rejection by the server completes normally with
 * {@code success == false}. Transport problems complete the future
 * exceptionally so callers can tell them apart from rejections.
 *
 * @see HttpAuthClient
 * @see TestAuthClient
 */
public interface AuthClient {

    /** Verifies credentials and binds this device. Carries a {@link SessionGrant} on success. */
    CompletableFuture<AuthResult> login(String username, String password);

    CompletableFuture<AuthResult> register(String username, String password, String email);

    /** Asks the server to mail a six-digit reset code. */
    CompletableFuture<AuthResult> sendResetCode(String email);

    CompletableFuture<AuthResult> resetPassword(String email, String code, String newPassword);

    /** Re-validates a running session. {@code success == false} means the session is no longer valid. */
    CompletableFuture<AuthResult> heartbeat(String token);
}
