package com.otto.e2ee.identity;

/**
 * Lifecycle of the device identity held by {@link IdentityKeyManager}.
 */
public enum IdentityState {
    /** No initialization attempted yet. */
    UNINITIALIZED,
    /** Seed loaded or generated and keypair derived. */
    INITIALIZED,
    /** Last initialization failed; the next call retries it. */
    DEGRADED
}
