package com.otto.e2ee.identity;

import com.otto.e2ee.E2eeException;

/**
 * A recovery phrase with an unknown word, a wrong word count or a bad checksum.
 * The user has to re-enter it.
 */
public class InvalidMnemonicException extends E2eeException {

    public InvalidMnemonicException(String message) {
        super(message);
    }

    public InvalidMnemonicException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
