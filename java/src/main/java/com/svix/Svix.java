package com.svix;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for the Svix API. The client is lightweight and thread-safe: create a single instance per
 * process and reuse it for the lifetime of the JVM.
 * </p>
 *
 * <pre>{@code
 * Svix svix = new Svix("testsk_xxx.eu");
 * DashboardAccessOut access = svix.authentication().dashboardAccess("app_123");
 * }</pre>
 */
public final class Svix implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Svix.class.getName());

    private final Config config;
    private final Authentication authentication;

    public Svix(String token) {
        this(Config.builder().token(token).build());
    }

    /**
     * Constructs a new client using the supplied configuration.
     *
     * @param config caller-supplied configuration; only {@code token} is mandatory.
     */
    public Svix(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.authentication = new Authentication(new HttpAuthenticationClient(this.config));
        LOGGER.fine(() -> "[svix-sdk] client configured for " + this.config.getServerUrl());
    }

    public Authentication authentication() {
        return authentication;
    }

    public String getServerUrl() {
        return config.getServerUrl();
    }

    /**
     * Closes the client. Currently a no-op because the underlying {@link java.net.http.HttpClient} does not require
     * explicit shutdown.
     */
    @Override
    public void close() {
        // the JDK HttpClient needs no shutdown; nothing to close.
    }
}
