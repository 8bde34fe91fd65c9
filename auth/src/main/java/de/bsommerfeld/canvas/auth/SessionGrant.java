package de.bsommerfeld.canvas.auth;

import java.time.Instant;

/**
 * What the server hands out on a successful login.
 *
 * @param token            bearer token used for heartbeats
 * @param expiresAt        account expiry, or {@code null} if the server sent none
 * @param remainingDays    days left on the account
 * @param resetDeviceCount how often the device binding may still be reset
 */
public record SessionGrant(String token, Instant expiresAt, int remainingDays, int resetDeviceCount) {
}
