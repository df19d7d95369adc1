package com.otto.e2ee.identity;

/**
 * Callback for components holding key material tied to the current identity.
 */
@FunctionalInterface
public interface IdentityListener {

    /**
     * Called after the identity seed was replaced (import or migration).
     *
     * @param previous The identity that was replaced, or null if none was loaded
     * @param current The identity now in use
     */
    void onIdentityReplaced(SeedIdentity previous, SeedIdentity current);
}
