package com.svix;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link Svix} instances.
 */
public final class Config {

    public static final String DEFAULT_SERVER_URL = "https://api.svix.com";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final List<Duration> DEFAULT_RETRY_SCHEDULE = List.of(
        Duration.ofMillis(50),
        Duration.ofMillis(100),
        Duration.ofMillis(200)
    );
    public static final String LIB_VERSION = "1.0.0";
    static final String USER_AGENT = "svix-libs/" + LIB_VERSION + "/java";

    private static final Map<String, String> REGIONAL_SERVER_URLS = Map.of(
        "us", "https://api.us.svix.com",
        "eu", "https://api.eu.svix.com",
        "in", "https://api.in.svix.com",
        "ca", "https://api.ca.svix.com",
        "au", "https://api.au.svix.com"
    );

    private final String token;
    private final String serverUrl;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final List<Duration> retrySchedule;

    private Config(Builder builder) {
        this.token = builder.token;
        this.serverUrl = builder.serverUrl;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.retrySchedule = builder.retrySchedule == null ? null : new ArrayList<>(builder.retrySchedule);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedToken = Optional.ofNullable(token).map(String::trim).orElse("");
        if (resolvedToken.isEmpty()) {
            throw new IllegalArgumentException("Token is required");
        }

        String resolvedServerUrl = Optional.ofNullable(serverUrl)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElseGet(() -> serverUrlForToken(resolvedToken));
        resolvedServerUrl = sanitizeUrl(resolvedServerUrl);

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        List<Duration> resolvedSchedule = Optional.ofNullable(retrySchedule).orElse(DEFAULT_RETRY_SCHEDULE);
        for (Duration delay : resolvedSchedule) {
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("RetrySchedule entries must be non-negative");
            }
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .token(resolvedToken)
            .serverUrl(resolvedServerUrl)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .retrySchedule(resolvedSchedule)
            .buildInternal();
    }

    /**
     * Resolves the API host from the region suffix of a token ({@code <key>.<region>}).
     */
    static String serverUrlForToken(String token) {
        int dot = token.lastIndexOf('.');
        if (dot < 0 || dot == token.length() - 1) {
            return DEFAULT_SERVER_URL;
        }
        String region = token.substring(dot + 1).toLowerCase(Locale.ROOT);
        return REGIONAL_SERVER_URLS.getOrDefault(region, DEFAULT_SERVER_URL);
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getToken() {
        return token;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public List<Duration> getRetrySchedule() {
        return Collections.unmodifiableList(retrySchedule);
    }

    public static final class Builder {
        private String token;
        private String serverUrl;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private List<Duration> retrySchedule;

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder serverUrl(String serverUrl) {
            this.serverUrl = serverUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder retrySchedule(List<Duration> retrySchedule) {
            this.retrySchedule = retrySchedule == null ? null : new ArrayList<>(retrySchedule);
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
