package com.svix;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-request overrides for POST operations. Instances are immutable; unset fields fall back to the values
 * configured on the client.
 */
public final class PostOptions {

    // rejected by java.net.http.HttpRequest.Builder
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
        "connection", "content-length", "expect", "host", "upgrade");

    private static final PostOptions EMPTY = new Builder().build();

    private final String idempotencyKey;
    private final Map<String, String> headers;
    private final Duration timeout;

    private PostOptions(Builder builder) {
        this.idempotencyKey = builder.idempotencyKey;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.timeout = builder.timeout;
    }

    public static PostOptions empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return value sent as the {@code idempotency-key} header, or {@code null} when unset.
     */
    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    /**
     * @return extra request headers; names the JDK client manages itself ({@code Host}, {@code Content-Length},
     *     {@code Connection}, {@code Expect}, {@code Upgrade}) are rejected by the builder.
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * @return timeout for this request only; {@code null} or a non-positive value means {@link Config#getHttpTimeout()}.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public boolean isEmpty() {
        return idempotencyKey == null && headers.isEmpty() && timeout == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PostOptions)) {
            return false;
        }
        PostOptions other = (PostOptions) o;
        return Objects.equals(idempotencyKey, other.idempotencyKey)
            && headers.equals(other.headers)
            && Objects.equals(timeout, other.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(idempotencyKey, headers, timeout);
    }

    @Override
    public String toString() {
        return "PostOptions{idempotencyKey=" + idempotencyKey + ", headers=" + headers.keySet() + ", timeout=" + timeout + "}";
    }

    public static final class Builder {
        private String idempotencyKey;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout;

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            if (RESTRICTED_HEADERS.contains(name.trim().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("header " + name + " is managed by the HTTP client");
            }
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> values) {
            if (values != null) {
                values.forEach(this::header);
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public PostOptions build() {
            return new PostOptions(this);
        }
    }
}
