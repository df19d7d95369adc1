package com.otto.e2ee;

/**
 * Base type for every error raised by the E2EE subsystem.
 *
 * Subclasses state whether the failed operation may be retried as-is. Codec and
 * authentication failures never are; missing keys and network timeouts usually are.
 */
public abstract class E2eeException extends RuntimeException {

    protected E2eeException(String message) {
        super(message);
    }

    protected E2eeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same operation can succeed without new input from the user.
     */
    public abstract boolean isRetryable();
}
