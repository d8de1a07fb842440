package com.svix;

/**
 * Exception representing an error returned by the Svix API. When the server responds with a non-2xx status
 * the SDK hydrates this type so callers can inspect both the HTTP status and the structured error code.
 */
public final class ApiException extends SvixException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public ApiException(int statusCode, String code, String detail) {
        super(detail == null || detail.isBlank() ? defaultMessage(statusCode, code) : detail);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by the Svix API.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return Svix error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    boolean isRetryable() {
        return statusCode >= 500;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "Svix request failed with status " + status;
        }
        return "Svix request failed with status " + status + " (" + code + ")";
    }
}
