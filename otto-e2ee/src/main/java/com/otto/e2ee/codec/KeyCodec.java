package com.otto.e2ee.codec;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.util.encoders.Hex;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.security.spec.RSAPrivateKeySpec;
import java.security.spec.RSAPublicKeySpec;

/**
 * PEM codec for RSA keys.
 *
 * Public keys are written as SubjectPublicKeyInfo ({@code PUBLIC KEY}) and private
 * keys as PKCS8 ({@code PRIVATE KEY}) wrapping a PKCS1 RSAPrivateKey, base64 at 64
 * characters per line. Reading additionally accepts the bare PKCS1 forms
 * ({@code RSA PUBLIC KEY}, {@code RSA PRIVATE KEY}).
 *
 * All integers are DER INTEGERs, i.e. minimal two's complement: a zero byte is
 * prepended whenever the top bit of the leading byte is set, which is always the
 * case for a full-length modulus.
 */
public final class KeyCodec {

    public static final String PUBLIC_KEY = "PUBLIC KEY";
    public static final String RSA_PUBLIC_KEY = "RSA PUBLIC KEY";
    public static final String PRIVATE_KEY = "PRIVATE KEY";
    public static final String RSA_PRIVATE_KEY = "RSA PRIVATE KEY";

    private static final AlgorithmIdentifier RSA_ENCRYPTION =
            new AlgorithmIdentifier(PKCSObjectIdentifiers.rsaEncryption, DERNull.INSTANCE);

    /** RSAPrivateKey fields in ASN.1 order (PKCS1 / RFC 8017 A.1.2). */
    private static final String[] PRIVATE_KEY_FIELDS = {
            "version", "modulus", "publicExponent", "privateExponent",
            "prime1", "prime2", "exponent1", "exponent2", "coefficient"
    };

    private KeyCodec() {
    }

    // ==================== Public Keys ====================

    public static String encodePublicKeyPem(RSAPublicKey key) {
        if (key == null) {
            throw new IllegalArgumentException("Public key cannot be null");
        }
        return writePem(PUBLIC_KEY, encodeSubjectPublicKeyInfo(key));
    }

    public static RSAPublicKey decodePublicKeyPem(String pem) {
        PemObject pemObject = readPem(pem);
        switch (pemObject.getType()) {
            case PUBLIC_KEY:
                return toPublicKey(parseSubjectPublicKeyInfo(pemObject.getContent()));
            case RSA_PUBLIC_KEY:
                return toPublicKey(parseRsaPublicKey(toSequence(pemObject.getContent(), "rsaPublicKey")));
            default:
                throw new KeyFormatException("pem", "Expected a public key PEM block but found " + pemObject.getType());
        }
    }

    /**
     * SHA-256 over the SubjectPublicKeyInfo DER, lowercase hex. Matches the
     * fingerprint the backend logs for its own key.
     */
    public static String fingerprint(RSAPublicKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Hex.toHexString(digest.digest(encodeSubjectPublicKeyInfo(key)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ==================== Private Keys ====================

    /**
     * Encodes a private key as PKCS8. CRT parameters are recomputed from the primes;
     * a key without primes is written with zero primes and CRT fields.
     */
    public static String encodePrivateKeyPem(RSAPrivateKey key) {
        if (key == null) {
            throw new IllegalArgumentException("Private key cannot be null");
        }

        BigInteger n = key.getModulus();
        BigInteger d = key.getPrivateExponent();
        BigInteger e = BigInteger.ZERO;
        BigInteger p = BigInteger.ZERO;
        BigInteger q = BigInteger.ZERO;
        BigInteger dP = BigInteger.ZERO;
        BigInteger dQ = BigInteger.ZERO;
        BigInteger qInv = BigInteger.ZERO;

        if (key instanceof RSAPrivateCrtKey crt) {
            e = crt.getPublicExponent();
            p = crt.getPrimeP();
            q = crt.getPrimeQ();
            dP = d.mod(p.subtract(BigInteger.ONE));
            dQ = d.mod(q.subtract(BigInteger.ONE));
            qInv = q.modInverse(p);
        }

        org.bouncycastle.asn1.pkcs.RSAPrivateKey pkcs1 =
                new org.bouncycastle.asn1.pkcs.RSAPrivateKey(n, e, d, p, q, dP, dQ, qInv);
        try {
            PrivateKeyInfo info = new PrivateKeyInfo(RSA_ENCRYPTION, pkcs1);
            return writePem(PRIVATE_KEY, info.getEncoded(ASN1Encoding.DER));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to DER-encode private key", ex);
        }
    }

    public static RSAPrivateKey decodePrivateKeyPem(String pem) {
        PemObject pemObject = readPem(pem);
        switch (pemObject.getType()) {
            case PRIVATE_KEY:
                return toPrivateKey(parsePrivateKeyInfo(pemObject.getContent()));
            case RSA_PRIVATE_KEY:
                return toPrivateKey(toSequence(pemObject.getContent(), "rsaPrivateKey"));
            default:
                throw new KeyFormatException("pem", "Expected a private key PEM block but found " + pemObject.getType());
        }
    }

    // ==================== Private Helper Methods ====================

    private static byte[] encodeSubjectPublicKeyInfo(RSAPublicKey key) {
        org.bouncycastle.asn1.pkcs.RSAPublicKey pkcs1 =
                new org.bouncycastle.asn1.pkcs.RSAPublicKey(key.getModulus(), key.getPublicExponent());
        try {
            return new SubjectPublicKeyInfo(RSA_ENCRYPTION, pkcs1).getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to DER-encode public key", e);
        }
    }

    private static ASN1Sequence parseSubjectPublicKeyInfo(byte[] der) {
        ASN1Sequence outer = toSequence(der, "subjectPublicKeyInfo");
        SubjectPublicKeyInfo info;
        try {
            info = SubjectPublicKeyInfo.getInstance(outer);
        } catch (IllegalArgumentException e) {
            throw new KeyFormatException("subjectPublicKeyInfo", "Malformed SubjectPublicKeyInfo", e);
        }
        requireRsa(info.getAlgorithm());
        try {
            return parseRsaPublicKey(ASN1Sequence.getInstance(info.parsePublicKey()));
        } catch (IOException | IllegalArgumentException e) {
            throw new KeyFormatException("subjectPublicKey", "Public key bit string is not an RSAPublicKey", e);
        }
    }

    private static ASN1Sequence parseRsaPublicKey(ASN1Sequence sequence) {
        if (sequence.size() < 1) {
            throw new KeyFormatException("modulus", "Modulus missing from RSA public key");
        }
        if (sequence.size() < 2) {
            throw new KeyFormatException("publicExponent", "Exponent missing from RSA public key");
        }
        return sequence;
    }

    private static ASN1Sequence parsePrivateKeyInfo(byte[] der) {
        ASN1Sequence outer = toSequence(der, "privateKeyInfo");
        PrivateKeyInfo info;
        try {
            info = PrivateKeyInfo.getInstance(outer);
        } catch (IllegalArgumentException e) {
            throw new KeyFormatException("privateKeyInfo", "Malformed PKCS8 PrivateKeyInfo", e);
        }
        requireRsa(info.getPrivateKeyAlgorithm());
        try {
            return ASN1Sequence.getInstance(info.parsePrivateKey());
        } catch (IOException | IllegalArgumentException e) {
            throw new KeyFormatException("privateKey", "PKCS8 payload is not an RSAPrivateKey", e);
        }
    }

    private static RSAPublicKey toPublicKey(ASN1Sequence sequence) {
        BigInteger modulus = positiveInteger(sequence, 0, "modulus");
        BigInteger exponent = positiveInteger(sequence, 1, "publicExponent");
        try {
            return (RSAPublicKey) KeyFactory.getInstance("RSA")
                    .generatePublic(new RSAPublicKeySpec(modulus, exponent));
        } catch (GeneralSecurityException e) {
            throw new KeyFormatException("modulus", "Rejected RSA public key", e);
        }
    }

    private static RSAPrivateKey toPrivateKey(ASN1Sequence sequence) {
        for (int i = 0; i < PRIVATE_KEY_FIELDS.length; i++) {
            if (sequence.size() <= i) {
                String field = PRIVATE_KEY_FIELDS[i];
                throw new KeyFormatException(field, "Field " + field + " missing from RSA private key");
            }
        }

        BigInteger n = positiveInteger(sequence, 1, "modulus");
        BigInteger e = integer(sequence, 2, "publicExponent");
        BigInteger d = positiveInteger(sequence, 3, "privateExponent");
        BigInteger p = integer(sequence, 4, "prime1");
        BigInteger q = integer(sequence, 5, "prime2");
        BigInteger dP = integer(sequence, 6, "exponent1");
        BigInteger dQ = integer(sequence, 7, "exponent2");
        BigInteger qInv = integer(sequence, 8, "coefficient");

        try {
            KeyFactory factory = KeyFactory.getInstance("RSA");
            if (p.signum() > 0 && q.signum() > 0 && e.signum() > 0) {
                return (RSAPrivateKey) factory.generatePrivate(
                        new RSAPrivateCrtKeySpec(n, e, d, p, q, dP, dQ, qInv));
            }
            return (RSAPrivateKey) factory.generatePrivate(new RSAPrivateKeySpec(n, d));
        } catch (GeneralSecurityException ex) {
            throw new KeyFormatException("privateExponent", "Rejected RSA private key", ex);
        }
    }

    private static void requireRsa(AlgorithmIdentifier algorithm) {
        if (!PKCSObjectIdentifiers.rsaEncryption.equals(algorithm.getAlgorithm())) {
            throw new KeyFormatException("algorithm", "Not an RSA key: " + algorithm.getAlgorithm().getId());
        }
    }

    private static BigInteger positiveInteger(ASN1Sequence sequence, int index, String field) {
        BigInteger value = integer(sequence, index, field);
        if (value.signum() <= 0) {
            throw new KeyFormatException(field, field + " must be positive");
        }
        return value;
    }

    private static BigInteger integer(ASN1Sequence sequence, int index, String field) {
        ASN1Encodable element = sequence.getObjectAt(index);
        if (!(element instanceof ASN1Integer integer)) {
            throw new KeyFormatException(field, field + " is not an INTEGER");
        }
        return integer.getValue();
    }

    private static ASN1Sequence toSequence(byte[] der, String field) {
        try {
            ASN1Primitive primitive = ASN1Primitive.fromByteArray(der);
            if (primitive instanceof ASN1Sequence sequence) {
                return sequence;
            }
            throw new KeyFormatException(field, field + " is not an ASN.1 SEQUENCE");
        } catch (IOException | IllegalArgumentException e) {
            throw new KeyFormatException(field, "Invalid DER in " + field, e);
        }
    }

    private static PemObject readPem(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new KeyFormatException("pem", "PEM text is empty");
        }
        if (!pem.contains("-----BEGIN ") || !pem.contains("-----END ")) {
            throw new KeyFormatException("pem", "PEM header or footer missing");
        }
        try (PemReader reader = new PemReader(new StringReader(pem))) {
            PemObject pemObject = reader.readPemObject();
            if (pemObject == null) {
                throw new KeyFormatException("pem", "No PEM block found");
            }
            return pemObject;
        } catch (IOException | RuntimeException e) {
            if (e instanceof KeyFormatException keyFormat) {
                throw keyFormat;
            }
            throw new KeyFormatException("pem", "Malformed PEM block", e);
        }
    }

    private static String writePem(String type, byte[] der) {
        StringWriter out = new StringWriter();
        try (PemWriter writer = new PemWriter(out)) {
            writer.writeObject(new PemObject(type, der));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write PEM", e);
        }
        return out.toString();
    }
}
