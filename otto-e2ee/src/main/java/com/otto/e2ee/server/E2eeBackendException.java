package com.otto.e2ee.server;

import com.otto.e2ee.E2eeException;

/**
 * The backend answered with an error status, an unusable body, or not at all.
 *
 * Status {@value #NO_RESPONSE} means no HTTP response was received.
 */
public class E2eeBackendException extends E2eeException {

    public static final int NO_RESPONSE = 0;

    private final int statusCode;

    public E2eeBackendException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public E2eeBackendException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return statusCode == NO_RESPONSE || statusCode >= 500;
    }
}
