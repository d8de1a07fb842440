package com.svix;

/**
 * Contract for the transport behind {@link Authentication}.
 */
public interface AuthenticationClient {

    DashboardAccessOut dashboardAccess(String appId, PostOptions options) throws SvixException;

    void logout(PostOptions options) throws SvixException;
}
