package com.autorestart.dashboard;

import com.autorestart.common.config.ConfigDefaults;
import com.autorestart.common.config.ConfigStore;
import com.autorestart.common.config.PluginConfig;
import com.autorestart.common.logging.LogRedact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the dashboard control plane.
 * <p>
 * One {@link OkHttpClient} (and so one connection pool) is shared by every
 * caller. Requests carry a bearer credential from {@link CredentialCache}; a
 * 401 invalidates it and the request is replayed once with a fresh login.
 */
@Slf4j
public class DashboardClient implements AutoCloseable {

    /** Renew well before the server's 24h expiry. */
    public static final Duration TOKEN_VALID_THRESHOLD = Duration.ofHours(23);

    static final String LOGIN_PATH = "api/auth/login";
    static final String RESTART_PATH = "api/stat/restart-core";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_LOGGED_BODY = 300;

    private final HttpUrl baseUrl;
    private final ConfigStore configStore;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CredentialCache credentials;

    public DashboardClient(ConfigStore configStore) {
        this(configStore, System.getenv(), Clock.systemUTC());
    }

    public DashboardClient(ConfigStore configStore, Map<String, String> env, Clock clock) {
        this(DashboardEndpoint.resolve(configStore.load().getDashboard(), env).baseUrl(),
                configStore,
                buildHttpClient(Duration.ofSeconds(ConfigDefaults.requestTimeoutSeconds(configStore.load()))),
                clock);
    }

    /** Test constructor: explicit base URL and client. */
    DashboardClient(HttpUrl baseUrl, ConfigStore configStore, OkHttpClient httpClient, Clock clock) {
        this.baseUrl = baseUrl;
        this.configStore = configStore;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.clock = clock;
        this.credentials = new CredentialCache(this::login, clock, TOKEN_VALID_THRESHOLD);
    }

    static OkHttpClient buildHttpClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Restart the managed core.
     */
    public void restart() {
        request("POST", RESTART_PATH, null);
        log.info("Dashboard accepted restart-core request");
    }

    /**
     * Issue an authorized request and unwrap the envelope.
     *
     * @param method HTTP method
     * @param path   path relative to the dashboard base URL
     * @param body   JSON-serialisable body, or null
     * @return the envelope's {@code data} (a {@link NullNode} when absent)
     */
    public JsonNode request(String method, String path, Object body) {
        Credential credential = credentials.getValid();
        try (Response response = execute(method, path, body, credential)) {
            if (response.code() != 401) {
                return unwrap(response, method, path);
            }
        }

        log.info("Dashboard rejected token for {} {}, logging in again", method, path);
        credentials.invalidate(credential);
        Credential renewed = credentials.getValid();
        try (Response retry = execute(method, path, body, renewed)) {
            if (retry.code() == 401) {
                credentials.invalidate(renewed);
                throw new AuthenticationError(
                        "Still unauthorized after re-login: " + method + " " + path, 401);
            }
            return unwrap(retry, method, path);
        }
    }

    /**
     * Log in with the configured username and password.
     *
     * @throws AuthenticationError on any failure, including an unreachable
     *                             login endpoint
     */
    public Credential login() {
        PluginConfig.DashboardConfig dashboard = configStore.load().getDashboard();
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("username", dashboard == null ? null : dashboard.getUsername());
        payload.put("password", dashboard == null ? null : dashboard.getPassword());

        Request request = new Request.Builder()
                .url(resolve(LOGIN_PATH))
                .post(jsonBody(payload))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String text = bodyText(response);
            if (!response.isSuccessful()) {
                throw new AuthenticationError("Login failed [" + response.code() + "]: "
                        + describeBody(text), response.code());
            }
            DashboardEnvelope envelope = parseEnvelope(text);
            if (envelope == null || !envelope.isOk()) {
                String message = envelope != null ? envelope.message() : describeBody(text);
                throw new AuthenticationError("Login rejected: " + message, response.code());
            }
            JsonNode token = envelope.data() == null ? null : envelope.data().get("token");
            if (token == null || token.asText().isBlank()) {
                throw new AuthenticationError("Login response carried no token", response.code());
            }
            log.info("Dashboard login succeeded, token renewed");
            return new Credential(token.asText(), clock.instant());
        } catch (IOException e) {
            throw new AuthenticationError("Login endpoint unreachable: " + e.getMessage(), null, e);
        }
    }

    /**
     * Stop the dispatcher and drop pooled connections. Calls already running
     * are left to finish.
     */
    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        log.debug("Dashboard client closed");
    }

    CredentialCache credentials() {
        return credentials;
    }

    // =========================================================================
    // Internal
    // =========================================================================

    private Response execute(String method, String path, Object body, Credential credential) {
        RequestBody requestBody = body != null
                ? jsonBody(body)
                : requiresBody(method) ? RequestBody.create(new byte[0], null) : null;
        Request request = new Request.Builder()
                .url(resolve(path))
                .header("Authorization", "Bearer " + credential.token())
                .method(method, requestBody)
                .build();
        log.debug("Dashboard {} {}", method, request.url());
        try {
            return httpClient.newCall(request).execute();
        } catch (IOException e) {
            throw new TransportError("Request failed: " + method + " " + path + ": " + e.getMessage(), null, e);
        }
    }

    private JsonNode unwrap(Response response, String method, String path) {
        String text;
        try {
            text = bodyText(response);
        } catch (IOException e) {
            throw new TransportError("Could not read response to " + method + " " + path, response.code(), e);
        }
        if (!response.isSuccessful()) {
            throw new TransportError("Request failed [" + response.code() + "] " + method + " " + path
                    + ": " + describeBody(text), response.code());
        }
        DashboardEnvelope envelope = parseEnvelope(text);
        if (envelope == null) {
            throw new TransportError("Malformed response to " + method + " " + path + ": "
                    + describeBody(text), response.code());
        }
        if (!envelope.isOk()) {
            throw new BusinessError("Dashboard error: " + envelope.message(), response.code(), envelope.status());
        }
        return envelope.data() != null ? envelope.data() : NullNode.getInstance();
    }

    private DashboardEnvelope parseEnvelope(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(text, DashboardEnvelope.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private RequestBody jsonBody(Object body) {
        try {
            return RequestBody.create(objectMapper.writeValueAsBytes(body), JSON);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serialisable: " + e.getMessage(), e);
        }
    }

    private HttpUrl resolve(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        HttpUrl url = baseUrl.resolve(relative);
        if (url == null) {
            throw new IllegalArgumentException("Invalid dashboard path: " + path);
        }
        return url;
    }

    private static boolean requiresBody(String method) {
        return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
    }

    private static String bodyText(Response response) throws IOException {
        ResponseBody body = response.body();
        return body == null ? "" : body.string();
    }

    private static String describeBody(String text) {
        if (text == null || text.isBlank()) {
            return "(empty body)";
        }
        String trimmed = text.length() > MAX_LOGGED_BODY ? text.substring(0, MAX_LOGGED_BODY) + "…" : text;
        return LogRedact.redactSensitiveText(trimmed);
    }
}
