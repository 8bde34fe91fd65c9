package de.bsommerfeld.canvas.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * JSON body returned by the account server for every endpoint. Unused fields
 * are simply absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("valid") Boolean valid,
        @JsonProperty("message") String message,
        @JsonProperty("reason") String reason,
        @JsonProperty("data") Data data) {

    /** Account details attached to successful verify and heartbeat replies. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(
            @JsonProperty("token") String token,
            @JsonProperty("expires_at") Long expiresAt,
            @JsonProperty("remaining_days") Integer remainingDays,
            @JsonProperty("reset_device_count") Integer resetDeviceCount,
            @JsonProperty("device_info") DeviceInfo deviceInfo) {
    }

    /** Device binding summary. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeviceInfo(
            @JsonProperty("bound_devices") int boundDevices,
            @JsonProperty("max_devices") int maxDevices,
            @JsonProperty("remaining_slots") int remainingSlots,
            @JsonProperty("is_new_device") boolean newDevice) {
    }

    /** {@code valid} defaults to true when the endpoint does not send it. */
    public boolean isValid() {
        return valid == null || valid;
    }

    SessionGrant toGrant() {
        if (data == null) {
            return new SessionGrant(null, null, 0, 0);
        }
        return new SessionGrant(
                data.token(),
                data.expiresAt() != null ? Instant.ofEpochSecond(data.expiresAt()) : null,
                data.remainingDays() != null ? data.remainingDays() : 0,
                data.resetDeviceCount() != null ? data.resetDeviceCount() : 0);
    }
}
