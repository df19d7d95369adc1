package com.otto.e2ee.server;

import com.otto.e2ee.E2eeException;

/**
 * A backend request did not complete within the configured timeout.
 */
public class FetchTimeoutException extends E2eeException {

    public FetchTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
