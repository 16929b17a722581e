package tech.gatehouse.platform.authentication.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class RefreshTokenValuesTest {

    @Test
    @DisplayName("generate should return 64 random bytes as unpadded base64url")
    void generate_shouldReturnUrlSafeValue() {
        String value = RefreshTokenValues.generate();

        assertThat(value).hasSize(86);
        assertThat(value).matches("[A-Za-z0-9_-]+");
    }

    @Test
    @DisplayName("generate should not repeat values")
    void generate_shouldNotRepeat() {
        Set<String> values = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            values.add(RefreshTokenValues.generate());
        }
        assertThat(values).hasSize(1000);
    }

    @Test
    @DisplayName("hash should be deterministic and differ from the value")
    void hash_shouldBeDeterministic() {
        String value = RefreshTokenValues.generate();

        String hash = RefreshTokenValues.hash(value);

        assertThat(hash).hasSize(43);
        assertThat(hash).isEqualTo(RefreshTokenValues.hash(value));
        assertThat(hash).isNotEqualTo(value);
        assertThat(RefreshTokenValues.hash(value + "x")).isNotEqualTo(hash);
    }

    // ===== RefreshToken TESTS =====

    @Test
    @DisplayName("issue should start a new family when no family given")
    void issue_shouldStartFamily_whenFamilyIdNull() {
        Instant now = Instant.parse("2026-03-02T10:00:00Z");

        RefreshToken token = RefreshToken.issue("prn_1", "hash", null, now, now.plusSeconds(60), "10.0.0.1");

        assertThat(token.id).startsWith("rtk_");
        assertThat(token.familyId).isEqualTo(token.id);
        assertThat(token.isActiveAt(now)).isTrue();
        assertThat(token.isExpiredAt(now.plusSeconds(60))).isTrue();
    }

    @Test
    @DisplayName("issue should keep the given family")
    void issue_shouldKeepFamily_whenFamilyIdGiven() {
        Instant now = Instant.parse("2026-03-02T10:00:00Z");

        RefreshToken token = RefreshToken.issue("prn_1", "hash", "rtk_family", now, now.plusSeconds(60), null);

        assertThat(token.familyId).isEqualTo("rtk_family");
        assertThat(token.id).isNotEqualTo("rtk_family");
    }
}
