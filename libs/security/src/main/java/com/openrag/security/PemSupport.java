package com.openrag.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * PEM encoding and decoding of RSA keys (PKCS#8 private, SubjectPublicKeyInfo public).
 */
final class PemSupport {

    static final String PRIVATE_KEY_TYPE = "PRIVATE KEY";
    static final String PUBLIC_KEY_TYPE = "PUBLIC KEY";
    private static final String PKCS1_PRIVATE_KEY_TYPE = "RSA PRIVATE KEY";

    private PemSupport() {
        // utility class
    }

    static RSAPrivateKey decodePrivateKey(String pem) {
        String normalized = normalize(pem);
        if (normalized.contains("BEGIN " + PKCS1_PRIVATE_KEY_TYPE)) {
            throw new AuthConfigurationException(
                    "PKCS#1 RSA keys are not supported; convert with "
                            + "'openssl pkcs8 -topk8 -nocrypt -in key.pem -out private_key.pem'");
        }
        try {
            byte[] der = body(normalized, PRIVATE_KEY_TYPE);
            return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException | IllegalArgumentException | ClassCastException e) {
            throw new AuthConfigurationException("Failed to parse RSA private key PEM", e);
        }
    }

    static RSAPublicKey decodePublicKey(String pem) {
        try {
            byte[] der = body(normalize(pem), PUBLIC_KEY_TYPE);
            return (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException | IllegalArgumentException | ClassCastException e) {
            throw new AuthConfigurationException("Failed to parse RSA public key PEM", e);
        }
    }

    /** Derives the public half from a CRT private key (what every standard RSA PEM carries). */
    static RSAPublicKey derivePublicKey(RSAPrivateKey privateKey) {
        if (!(privateKey instanceof RSAPrivateCrtKey crt)) {
            throw new AuthConfigurationException("RSA private key does not carry its public exponent");
        }
        try {
            return (RSAPublicKey) KeyFactory.getInstance("RSA")
                    .generatePublic(new RSAPublicKeySpec(crt.getModulus(), crt.getPublicExponent()));
        } catch (GeneralSecurityException e) {
            throw new AuthConfigurationException("Failed to derive RSA public key", e);
        }
    }

    static String encodePrivateKey(RSAPrivateKey key) {
        return encode(PRIVATE_KEY_TYPE, key.getEncoded());
    }

    static String encodePublicKey(RSAPublicKey key) {
        return encode(PUBLIC_KEY_TYPE, key.getEncoded());
    }

    private static String encode(String type, byte[] der) {
        String base64 = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                .encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + base64 + "\n-----END " + type + "-----\n";
    }

    // Environment variables often carry PEMs with literal "\n" sequences.
    private static String normalize(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new AuthConfigurationException("PEM content is empty");
        }
        return pem.replace("\\n", "\n").strip();
    }

    private static byte[] body(String pem, String type) {
        String begin = "-----BEGIN " + type + "-----";
        String end = "-----END " + type + "-----";
        int start = pem.indexOf(begin);
        int stop = pem.indexOf(end);
        if (start < 0 || stop < start) {
            throw new IllegalArgumentException("Expected a '" + type + "' PEM block");
        }
        String base64 = pem.substring(start + begin.length(), stop).replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }
}
