package com.openrag.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;

/**
 * Builds the process-wide {@link KeyMaterial} from configuration.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>{@code signingKey} starting with {@code -----BEGIN}: PKCS#8 RSA private key, RS256</li>
 *   <li>{@code signingKey} otherwise: HS256 shared secret</li>
 *   <li>PEM files at {@code privateKeyPath} / {@code publicKeyPath}; generated when both are
 *       absent and {@code generateIfMissing} is set</li>
 * </ol>
 * Any failure is an {@link AuthConfigurationException}; the service must not start without keys.
 */
public final class KeyMaterialLoader {

    private static final Logger log = LoggerFactory.getLogger(KeyMaterialLoader.class);

    static final String PRIVATE_KEY_PERMISSIONS = "rw-------";

    private static final int GENERATED_KEY_BITS = 2048;

    /**
     * Key settings.
     *
     * @param signingKey        inline PEM or HMAC secret (nullable)
     * @param privateKeyPath    PKCS#8 private key file
     * @param publicKeyPath     SubjectPublicKeyInfo public key file
     * @param generateIfMissing generate and write a key pair when neither file exists
     */
    public record Settings(String signingKey, Path privateKeyPath, Path publicKeyPath, boolean generateIfMissing) {
    }

    private KeyMaterialLoader() {
        // utility class
    }

    public static KeyMaterial load(Settings settings) {
        String signingKey = settings.signingKey();
        if (signingKey != null && !signingKey.isBlank()) {
            if (signingKey.strip().startsWith("-----BEGIN")) {
                RSAPrivateKey privateKey = PemSupport.decodePrivateKey(signingKey);
                log.info("JWT signing configured with RSA key from environment");
                return KeyMaterial.rsa(privateKey, PemSupport.derivePublicKey(privateKey));
            }
            log.info("JWT signing configured with symmetric key from environment; JWKS will be empty");
            return KeyMaterial.hmac(signingKey);
        }
        return loadFromFiles(settings);
    }

    private static KeyMaterial loadFromFiles(Settings settings) {
        Path privatePath = settings.privateKeyPath();
        Path publicPath = settings.publicKeyPath();
        if (privatePath == null || publicPath == null) {
            throw new AuthConfigurationException("RSA key file paths are not configured");
        }
        boolean privateExists = Files.exists(privatePath);
        boolean publicExists = Files.exists(publicPath);

        if (!privateExists && !publicExists && settings.generateIfMissing()) {
            return generate(privatePath, publicPath);
        }
        if (!privateExists || !publicExists) {
            throw new AuthConfigurationException("RSA key files not found: %s, %s"
                    .formatted(privatePath, publicPath));
        }
        try {
            RSAPrivateKey privateKey = PemSupport.decodePrivateKey(Files.readString(privatePath, StandardCharsets.US_ASCII));
            RSAPublicKey publicKey = PemSupport.decodePublicKey(Files.readString(publicPath, StandardCharsets.US_ASCII));
            log.info("JWT signing configured with RSA key files {}", privatePath);
            return KeyMaterial.rsa(privateKey, publicKey);
        } catch (IOException e) {
            throw new AuthConfigurationException("Failed to read RSA key files", e);
        }
    }

    private static KeyMaterial generate(Path privatePath, Path publicPath) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(GENERATED_KEY_BITS);
            KeyPair pair = generator.generateKeyPair();
            RSAPrivateKey privateKey = (RSAPrivateKey) pair.getPrivate();
            RSAPublicKey publicKey = (RSAPublicKey) pair.getPublic();

            createParent(privatePath);
            createParent(publicPath);
            Files.writeString(privatePath, PemSupport.encodePrivateKey(privateKey), StandardCharsets.US_ASCII);
            restrictToOwner(privatePath);
            Files.writeString(publicPath, PemSupport.encodePublicKey(publicKey), StandardCharsets.US_ASCII);
            log.info("Generated RSA key pair at {}", privatePath.getParent() != null ? privatePath.getParent() : privatePath);
            return KeyMaterial.rsa(privateKey, publicKey);
        } catch (NoSuchAlgorithmException | IOException e) {
            throw new AuthConfigurationException("Failed to generate RSA key pair", e);
        }
    }

    private static void restrictToOwner(Path path) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(PRIVATE_KEY_PERMISSIONS));
        } else {
            log.warn("Cannot restrict permissions of {} on a non-POSIX file system", path);
        }
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
