package com.openrag.authservice.infrastructure.apikey;

import static org.assertj.core.api.Assertions.assertThat;

import com.openrag.security.ApiKeyPrincipal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConfiguredApiKeyValidator")
class ConfiguredApiKeyValidatorTest {

    private static final ApiKeyPrincipal MACHINE =
            new ApiKeyPrincipal("test-key", "machine-user", null, null, null, List.of("eng"));

    private final ConfiguredApiKeyValidator validator = new ConfiguredApiKeyValidator(List.of(
            new ConfiguredApiKeyValidator.KeyRecord(ConfiguredApiKeyValidator.hash("orag_test_key_123"), MACHINE)));

    @Test
    @DisplayName("hashes keys to lowercase hex SHA-256")
    void hashFormat() {
        assertThat(ConfiguredApiKeyValidator.hash("orag_test_key_123"))
                .isEqualTo("666a0cc9fadccd5b1fd9c68436076141411263635564d31e433cd821ad7bfade");
    }

    @Test
    @DisplayName("returns the owner of a configured key")
    void knownKey() {
        assertThat(validator.validate("orag_test_key_123")).contains(MACHINE);
    }

    @Test
    @DisplayName("rejects unknown and empty keys")
    void unknownKey() {
        assertThat(validator.validate("orag_test_key_124")).isEmpty();
        assertThat(validator.validate("")).isEmpty();
        assertThat(validator.validate(null)).isEmpty();
    }

    @Test
    @DisplayName("accepts digests configured in upper case")
    void upperCaseDigest() {
        var upper = new ConfiguredApiKeyValidator(List.of(new ConfiguredApiKeyValidator.KeyRecord(
                ConfiguredApiKeyValidator.hash("orag_other").toUpperCase(), MACHINE)));

        assertThat(upper.validate("orag_other")).isPresent();
    }
}
