package com.openrag.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.crypto.RSASSAVerifier;

import java.nio.charset.StandardCharsets;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Objects;
import java.util.Optional;

/**
 * Signing and verification keys for session tokens.
 * <p>
 * Either an RSA key pair (RS256, publishable through JWKS) or a shared HMAC secret (HS256,
 * nothing to publish). Built once at startup by {@link KeyMaterialLoader} and never mutated,
 * so one instance is shared by every request thread without locking. There is no rotation:
 * every token carries {@link #KEY_ID}.
 */
public final class KeyMaterial {

    /** Key identifier written into every token header and the published JWK. */
    public static final String KEY_ID = "openrag-key-1";

    /** Minimum HS256 secret length in bytes. */
    public static final int MIN_HMAC_SECRET_BYTES = 32;

    private final JWSAlgorithm algorithm;
    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final RSAPublicKey publicKey;
    private final String publicKeyPem;

    private KeyMaterial(JWSAlgorithm algorithm, JWSSigner signer, JWSVerifier verifier,
                        RSAPublicKey publicKey, String publicKeyPem) {
        this.algorithm = algorithm;
        this.signer = signer;
        this.verifier = verifier;
        this.publicKey = publicKey;
        this.publicKeyPem = publicKeyPem;
    }

    /**
     * Asymmetric RS256 key material.
     */
    public static KeyMaterial rsa(RSAPrivateKey privateKey, RSAPublicKey publicKey) {
        Objects.requireNonNull(privateKey, "privateKey");
        Objects.requireNonNull(publicKey, "publicKey");
        if (!privateKey.getModulus().equals(publicKey.getModulus())) {
            throw new AuthConfigurationException("RSA public key does not match the private key");
        }
        return new KeyMaterial(
                JWSAlgorithm.RS256,
                new RSASSASigner(privateKey),
                new RSASSAVerifier(publicKey),
                publicKey,
                PemSupport.encodePublicKey(publicKey));
    }

    /**
     * Symmetric HS256 key material.
     *
     * @throws AuthConfigurationException if the secret is shorter than {@value #MIN_HMAC_SECRET_BYTES} bytes
     */
    public static KeyMaterial hmac(String secret) {
        byte[] bytes = Objects.requireNonNull(secret, "secret").getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_HMAC_SECRET_BYTES) {
            throw new AuthConfigurationException(
                    "JWT_SIGNING_KEY must be at least %d bytes for HS256 (got %d)"
                            .formatted(MIN_HMAC_SECRET_BYTES, bytes.length));
        }
        try {
            return new KeyMaterial(JWSAlgorithm.HS256, new MACSigner(bytes), new MACVerifier(bytes), null, null);
        } catch (JOSEException e) {
            throw new AuthConfigurationException("Unusable HS256 signing key", e);
        }
    }

    public JWSAlgorithm algorithm() {
        return algorithm;
    }

    public boolean isAsymmetric() {
        return publicKey != null;
    }

    JWSSigner signer() {
        return signer;
    }

    JWSVerifier verifier() {
        return verifier;
    }

    /** RSA public key, or empty in HS256 mode. */
    public Optional<RSAPublicKey> publicKey() {
        return Optional.ofNullable(publicKey);
    }

    /** SubjectPublicKeyInfo PEM of the public key, or empty in HS256 mode. */
    public Optional<String> publicKeyPem() {
        return Optional.ofNullable(publicKeyPem);
    }
}
