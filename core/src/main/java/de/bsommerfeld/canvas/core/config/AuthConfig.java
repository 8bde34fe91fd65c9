package de.bsommerfeld.canvas.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Endpoint and timing settings for the account server.
 *
 * <p>
 * Two timeouts are in play: {@code request-timeout-seconds} bounds a single
 * HTTP exchange inside the client, {@code operation-timeout-seconds} is the
 * UI-side race that decides when a dialog stops waiting.
 */
public class AuthConfig {

    @JsonProperty("api-base-url")
    private String apiBaseUrl = "https://wx.019890311.xyz";

    @JsonProperty("request-timeout-seconds")
    private int requestTimeoutSeconds = 10;

    @JsonProperty("operation-timeout-seconds")
    private int operationTimeoutSeconds = 60;

    @JsonProperty("heartbeat-interval-minutes")
    private int heartbeatIntervalMinutes = 20;

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public int getOperationTimeoutSeconds() {
        return operationTimeoutSeconds;
    }

    public void setOperationTimeoutSeconds(int operationTimeoutSeconds) {
        this.operationTimeoutSeconds = operationTimeoutSeconds;
    }

    public int getHeartbeatIntervalMinutes() {
        return heartbeatIntervalMinutes;
    }
}
