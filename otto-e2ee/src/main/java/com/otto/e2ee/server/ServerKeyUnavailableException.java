package com.otto.e2ee.server;

import com.otto.e2ee.E2eeException;

/**
 * No server public key in memory or cache, and fetching one failed.
 */
public class ServerKeyUnavailableException extends E2eeException {

    public ServerKeyUnavailableException(String message) {
        super(message);
    }

    public ServerKeyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
