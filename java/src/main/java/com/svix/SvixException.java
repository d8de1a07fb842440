package com.svix;

/**
 * Base exception thrown by the Svix Java SDK.
 */
public class SvixException extends Exception {

    private static final long serialVersionUID = 1L;

    public SvixException(String message) {
        super(message);
    }

    public SvixException(String message, Throwable cause) {
        super(message, cause);
    }
}
