package com.svix;

/**
 * Authentication endpoints of the Svix API.
 *
 * <p>
 * Calls are forwarded to the underlying {@link AuthenticationClient} unchanged: arguments are not validated
 * here and errors surface exactly as the client raised them.
 * </p>
 */
public final class Authentication {

    private final AuthenticationClient client;

    public Authentication(AuthenticationClient client) {
        this.client = client;
    }

    public DashboardAccessOut dashboardAccess(String appId) throws SvixException {
        return dashboardAccess(appId, PostOptions.empty());
    }

    /**
     * Issues a pre-authenticated dashboard URL for an application.
     *
     * @param appId   application id or uid.
     * @param options per-request overrides such as an idempotency key.
     * @return the URL and token granted by the server.
     * @throws SvixException when the underlying request fails.
     */
    public DashboardAccessOut dashboardAccess(String appId, PostOptions options) throws SvixException {
        return client.dashboardAccess(appId, options);
    }

    public void logout() throws SvixException {
        logout(PostOptions.empty());
    }

    /**
     * Revokes the token used to authenticate the request.
     *
     * @param options per-request overrides.
     * @throws SvixException when the underlying request fails.
     */
    public void logout(PostOptions options) throws SvixException {
        client.logout(options);
    }
}
