package de.bsommerfeld.canvas.auth;

import de.bsommerfeld.canvas.core.concurrent.RemoteReply;

/**
 * Answer of an account-server call.
 *
 * @param success whether the server accepted the request
 * @param message text to show to the user
 * @param grant   session data, only present on a successful login
 */
public record AuthResult(boolean success, String message, SessionGrant grant) {

    public static AuthResult ok(String message) {
        return new AuthResult(true, message, null);
    }

    public static AuthResult failed(String message) {
        return new AuthResult(false, message, null);
    }

    public RemoteReply toReply() {
        return new RemoteReply(success, message);
    }
}
