package com.otto.e2ee.cipher;

import com.otto.e2ee.E2eeException;

/**
 * Ciphertext, nonce or tag was altered, or the wrong key was used.
 */
public class AuthenticationFailedException extends E2eeException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
