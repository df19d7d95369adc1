package com.otto.e2ee.codec;

import com.otto.e2ee.E2eeException;

/**
 * Malformed key material: bad PEM armour, unexpected ASN.1 structure, a missing
 * field or a key that is not on the expected curve.
 *
 * Retrying with the same input cannot succeed; the key has to be re-imported or
 * regenerated.
 */
public class KeyFormatException extends E2eeException {

    private final String field;

    public KeyFormatException(String field, String message) {
        super(message);
        this.field = field;
    }

    public KeyFormatException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Name of the offending field, e.g. {@code modulus} or {@code pem}.
     */
    public String getField() {
        return field;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
