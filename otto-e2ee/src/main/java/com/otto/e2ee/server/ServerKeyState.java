package com.otto.e2ee.server;

/**
 * Whether {@link HybridServerChannel} holds a usable server public key in memory.
 */
public enum ServerKeyState {
    NO_SERVER_KEY,
    HAS_SERVER_KEY
}
