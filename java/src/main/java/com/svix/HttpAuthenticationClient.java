package com.svix;

import com.svix.internal.ApiErrorDecoder;
import com.svix.internal.HttpUtil;
import com.svix.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Logger;

/**
 * {@link AuthenticationClient} backed by the JDK {@link HttpClient}.
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Authenticates every call with the configured bearer token and tags it with a {@code svix-req-id} that stays
 *       the same across retries of that call.</li>
 *   <li>Retries transport failures and 5xx responses following {@link Config#getRetrySchedule()}; 4xx responses are
 *       surfaced immediately as {@link ApiException}.</li>
 *   <li>Honours {@link PostOptions} per call: idempotency key, extra headers and timeout.</li>
 * </ul>
 */
public final class HttpAuthenticationClient implements AuthenticationClient {

    private static final Logger LOGGER = Logger.getLogger(HttpAuthenticationClient.class.getName());

    static final String DASHBOARD_ACCESS_PATH = "/api/v1/auth/dashboard-access/";
    static final String LOGOUT_PATH = "/api/v1/auth/logout";

    private final HttpClient httpClient;
    private final String serverUrl;
    private final String token;
    private final Duration httpTimeout;
    private final List<Duration> retrySchedule;

    public HttpAuthenticationClient(Config config) {
        Objects.requireNonNull(config, "config");
        Config resolved = config.withDefaults();
        this.httpClient = resolved.getHttpClient();
        this.serverUrl = resolved.getServerUrl();
        this.token = resolved.getToken();
        this.httpTimeout = resolved.getHttpTimeout();
        this.retrySchedule = List.copyOf(resolved.getRetrySchedule());
    }

    @Override
    public DashboardAccessOut dashboardAccess(String appId, PostOptions options) throws SvixException {
        if (appId == null || appId.isBlank()) {
            throw new IllegalArgumentException("appId is required");
        }
        String path = DASHBOARD_ACCESS_PATH + encodePathSegment(appId);
        return post("dashboard access", path, options,
            body -> Json.mapper().readValue(body, DashboardAccessOut.class));
    }

    @Override
    public void logout(PostOptions options) throws SvixException {
        post("logout", LOGOUT_PATH, options, body -> null);
    }

    private <T> T post(String operation, String path, PostOptions options, ResponseReader<T> reader) throws SvixException {
        PostOptions resolved = options == null ? PostOptions.empty() : options;
        Duration timeout = resolved.getTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = httpTimeout;
        }
        String url = serverUrl + path;
        long requestId = ThreadLocalRandom.current().nextLong(1, Long.MAX_VALUE);

        int attempt = 0;
        while (true) {
            int current = attempt;
            LOGGER.fine(() -> String.format(Locale.ROOT,
                "[svix-sdk] POST %s (req %d, attempt %d)", path, requestId, current));

            HttpResponse<InputStream> response;
            try {
                response = HttpUtil.send(httpClient, "POST", url, token,
                    requestHeaders(resolved, requestId, current), timeout);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new SvixException(operation + " request interrupted", ex);
            } catch (IOException ex) {
                if (current >= retrySchedule.size()) {
                    throw new SvixException(operation + " request: " + ex.getMessage(), ex);
                }
                backoff(operation, current, ex.toString());
                attempt++;
                continue;
            }

            ApiException retryable;
            try (InputStream body = response.body()) {
                int status = response.statusCode();
                if (status < 400) {
                    return reader.read(body);
                }
                ApiException apiError = ApiErrorDecoder.decode(status, body);
                if (!apiError.isRetryable() || current >= retrySchedule.size()) {
                    throw apiError;
                }
                retryable = apiError;
            } catch (IOException ex) {
                throw new SvixException("decode " + operation + " response: " + ex.getMessage(), ex);
            }

            backoff(operation, current, "status " + retryable.getStatusCode());
            attempt++;
        }
    }

    private void backoff(String operation, int attempt, String reason) throws SvixException {
        Duration delay = retrySchedule.get(attempt);
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[svix-sdk] %s failed (%s); retry %d/%d in %d ms",
            operation, reason, attempt + 1, retrySchedule.size(), delay.toMillis()));
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SvixException(operation + " retry interrupted", ex);
        }
    }

    private static Map<String, String> requestHeaders(PostOptions options, long requestId, int attempt) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", Config.USER_AGENT);
        headers.put("svix-req-id", Long.toString(requestId));
        if (attempt > 0) {
            headers.put("svix-retry-count", Integer.toString(attempt));
        }
        String idempotencyKey = options.getIdempotencyKey();
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            headers.put("idempotency-key", idempotencyKey);
        }
        headers.putAll(options.getHeaders());
        return headers;
    }

    private static String encodePathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @FunctionalInterface
    private interface ResponseReader<T> {
        T read(InputStream body) throws IOException;
    }
}
