package de.bsommerfeld.canvas.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.canvas.core.config.AuthConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link AuthClient} talking JSON over HTTPS to the account server.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code POST /api/auth/verify}: login with device identity</li>
 * <li>{@code POST /api/user/register}</li>
 * <li>{@code POST /api/user/send-reset-code}</li>
 * <li>{@code POST /api/user/reset-password}</li>
 * <li>{@code POST /api/auth/heartbeat}</li>
 * </ul>
 *
 * <h3>Errors</h3>
 * The body is parsed regardless of the HTTP status, since the server reports
 * rejections as JSON on 4xx responses too. A body that is not valid JSON
 * yields a failed {@link AuthResult}. Connection failures and the per-request
 * timeout complete the returned future exceptionally.
 */
public class HttpAuthClient implements AuthClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpAuthClient.class);

    static final String VERIFY_ENDPOINT = "/api/auth/verify";
    static final String REGISTER_ENDPOINT = "/api/user/register";
    static final String SEND_RESET_CODE_ENDPOINT = "/api/user/send-reset-code";
    static final String RESET_PASSWORD_ENDPOINT = "/api/user/reset-password";
    static final String HEARTBEAT_ENDPOINT = "/api/auth/heartbeat";

    static final String UNPARSABLE_RESPONSE = "Could not parse server response";

    private final String baseUrl;
    private final Duration requestTimeout;
    private final DeviceIdentity device;
    private final HttpClient httpClient;

    /** Thread-safe for reading; shared by all calls. */
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public HttpAuthClient(AuthConfig config, DeviceIdentity device) {
        this(config.getApiBaseUrl(), Duration.ofSeconds(config.getRequestTimeoutSeconds()), device);
    }

    HttpAuthClient(String baseUrl, Duration requestTimeout, DeviceIdentity device) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.requestTimeout = requestTimeout;
        this.device = device;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public CompletableFuture<AuthResult> login(String username, String password) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", username);
        body.put("password", password);
        body.put("hardware_id", device.hardwareId());
        body.put("device_name", device.deviceName());
        body.put("os_version", device.osVersion());
        body.put("app_version", device.appVersion());
        return post(VERIFY_ENDPOINT, body).thenApply(response -> {
            if (response == null) {
                return AuthResult.failed(UNPARSABLE_RESPONSE);
            }
            if (!response.success()) {
                return AuthResult.failed(orDefault(response.message(), "Verification failed"));
            }
            if (!response.isValid()) {
                return AuthResult.failed(orDefault(response.message(), "Account is not valid"));
            }
            SessionGrant grant = response.toGrant();
            LOG.info("Login accepted for {} ({} days remaining)", username, grant.remainingDays());
            return new AuthResult(true,
                    "Login successful. " + grant.remainingDays() + " days remaining", grant);
        });
    }

    @Override
    public CompletableFuture<AuthResult> register(String username, String password, String email) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", username);
        body.put("password", password);
        body.put("email", email);
        body.put("hardware_id", device.hardwareId());
        body.put("device_name", device.deviceName());
        return post(REGISTER_ENDPOINT, body).thenApply(response -> simple(response,
                "Registration successful", "Registration failed"));
    }

    @Override
    public CompletableFuture<AuthResult> sendResetCode(String email) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", email);
        return post(SEND_RESET_CODE_ENDPOINT, body).thenApply(response -> simple(response,
                "Verification code sent", "Could not send verification code"));
    }

    @Override
    public CompletableFuture<AuthResult> resetPassword(String email, String code, String newPassword) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", email);
        body.put("code", code);
        body.put("new_password", newPassword);
        return post(RESET_PASSWORD_ENDPOINT, body).thenApply(response -> simple(response,
                "Password reset successful", "Password reset failed"));
    }

    @Override
    public CompletableFuture<AuthResult> heartbeat(String token) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", token);
        body.put("hardware_id", device.hardwareId());
        return post(HEARTBEAT_ENDPOINT, body).thenApply(response -> {
            if (response == null) {
                return AuthResult.failed(UNPARSABLE_RESPONSE);
            }
            if (!response.success() || !response.isValid()) {
                return AuthResult.failed(orDefault(response.message(), "Session is no longer valid"));
            }
            return new AuthResult(true, orDefault(response.message(), "ok"), response.toGrant());
        });
    }

    // =====================================================================
    // Transport
    // =====================================================================

    /**
     * Posts the body as JSON and parses the reply. Completes with {@code null}
     * if the reply is not parseable.
     */
    private CompletableFuture<AuthResponse> post(String endpoint, Map<String, Object> body) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + endpoint))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();

        LOG.debug("POST {}", endpoint);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> parse(endpoint, response));
    }

    private AuthResponse parse(String endpoint, HttpResponse<String> response) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            LOG.warn("Empty response from {} (HTTP {})", endpoint, response.statusCode());
            return null;
        }
        try {
            return mapper.readValue(body, AuthResponse.class);
        } catch (JsonProcessingException e) {
            LOG.warn("Unparsable response from {} (HTTP {}): {}", endpoint, response.statusCode(), e.getMessage());
            return null;
        }
    }

    private static AuthResult simple(AuthResponse response, String successDefault, String failureDefault) {
        if (response == null) {
            return AuthResult.failed(UNPARSABLE_RESPONSE);
        }
        return response.success()
                ? AuthResult.ok(orDefault(response.message(), successDefault))
                : AuthResult.failed(orDefault(response.message(), failureDefault));
    }

    private static String orDefault(String message, String fallback) {
        return message == null || message.isBlank() ? fallback : message;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
