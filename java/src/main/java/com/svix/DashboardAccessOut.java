package com.svix;

/**
 * Dashboard access grant returned for an application: a pre-authenticated URL and the token embedded in it.
 */
public record DashboardAccessOut(
    String url,
    String token
) {
}
