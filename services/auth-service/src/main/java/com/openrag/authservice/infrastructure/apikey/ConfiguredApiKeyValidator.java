package com.openrag.authservice.infrastructure.apikey;

import com.openrag.security.ApiKeyPrincipal;
import com.openrag.security.ApiKeyValidator;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Validates API keys against statically configured SHA-256 digests.
 *
 * <p>Keys are never held in clear text: the presented key is hashed and compared in constant time
 * against every record. Deployments with a key database replace this bean with their own {@link
 * ApiKeyValidator}.
 */
public class ConfiguredApiKeyValidator implements ApiKeyValidator {

    /**
     * One configured key.
     *
     * @param keyHash lowercase hex SHA-256 of the full key
     * @param principal owner and access scope of the key
     */
    public record KeyRecord(String keyHash, ApiKeyPrincipal principal) {
    }

    private final List<KeyRecord> records;

    public ConfiguredApiKeyValidator(List<KeyRecord> records) {
        this.records = List.copyOf(records);
    }

    @Override
    public Optional<ApiKeyPrincipal> validate(String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return Optional.empty();
        }
        byte[] presented = sha256(apiKey);
        ApiKeyPrincipal match = null;
        for (KeyRecord keyRecord : records) {
            byte[] expected = HexFormat.of().parseHex(keyRecord.keyHash().toLowerCase(Locale.ROOT));
            if (MessageDigest.isEqual(presented, expected)) {
                match = keyRecord.principal();
            }
        }
        return Optional.ofNullable(match);
    }

    /** Lowercase hex SHA-256 of {@code apiKey}, the form stored in configuration. */
    public static String hash(String apiKey) {
        return HexFormat.of().formatHex(sha256(apiKey));
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
