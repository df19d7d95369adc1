package com.otto.e2ee.identity;

import com.otto.e2ee.E2eeException;

/**
 * The device identity could not be initialized, so nothing can be signed, agreed or
 * encrypted. Chat functionality stays blocked until initialization succeeds.
 */
public class KeysUnavailableException extends E2eeException {

    public KeysUnavailableException(String message) {
        super(message);
    }

    public KeysUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
