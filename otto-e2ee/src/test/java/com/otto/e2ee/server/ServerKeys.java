package com.otto.e2ee.server;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;

/**
 * RSA keypairs shared across tests; generated once because 2048-bit generation is slow.
 */
public final class ServerKeys {

    private static KeyPair server;
    private static KeyPair other;

    private ServerKeys() {
    }

    public static synchronized KeyPair server() {
        if (server == null) {
            server = generate(2048);
        }
        return server;
    }

    public static synchronized KeyPair other() {
        if (other == null) {
            other = generate(2048);
        }
        return other;
    }

    static KeyPair generate(int bits) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(bits);
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
