package tech.automator.platform.principal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.automator.platform.config.TestSecurityConfig;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PasswordService using real BCrypt at the minimum cost.
 */
class PasswordServiceTest {

    private PasswordService passwordService;

    @BeforeEach
    void setUp() {
        passwordService = new PasswordService();
        passwordService.config = new TestSecurityConfig();
    }

    // ========================================
    // hash / verify
    // ========================================

    @Test
    @DisplayName("hash should produce a BCrypt hash that verifies against the same password")
    void hash_shouldVerify_whenSamePassword() {
        // Act
        String hash = passwordService.hash("correct horse battery");

        // Assert
        assertThat(hash).startsWith("$2");
        assertThat(hash).doesNotContain("correct horse battery");
        assertThat(passwordService.verify("correct horse battery", hash)).isTrue();
    }

    @Test
    @DisplayName("verify should reject a different password")
    void verify_shouldReturnFalse_whenPasswordDiffers() {
        String hash = passwordService.hash("correct horse battery");

        assertThat(passwordService.verify("correct horse batterY", hash)).isFalse();
    }

    @Test
    @DisplayName("hash should use a fresh salt on every call")
    void hash_shouldDiffer_whenSamePasswordHashedTwice() {
        String first = passwordService.hash("Secret#2024");
        String second = passwordService.hash("Secret#2024");

        assertThat(first).isNotEqualTo(second);
        assertThat(passwordService.verify("Secret#2024", first)).isTrue();
        assertThat(passwordService.verify("Secret#2024", second)).isTrue();
    }

    @Test
    @DisplayName("hash should refuse an empty password")
    void hash_shouldThrow_whenPasswordEmpty() {
        assertThatThrownBy(() -> passwordService.hash(""))
            .isInstanceOf(PasswordHashingException.class);
        assertThatThrownBy(() -> passwordService.hash(null))
            .isInstanceOf(PasswordHashingException.class);
    }

    @Test
    @DisplayName("verify should return false for a missing or malformed hash")
    void verify_shouldReturnFalse_whenHashMissingOrMalformed() {
        assertThat(passwordService.verify("Secret#2024", null)).isFalse();
        assertThat(passwordService.verify("Secret#2024", "")).isFalse();
        assertThat(passwordService.verify("Secret#2024", "not-a-bcrypt-hash")).isFalse();
        assertThat(passwordService.verify(null, passwordService.hash("Secret#2024"))).isFalse();
    }

    // ========================================
    // meetsPolicy
    // ========================================

    @Test
    @DisplayName("meetsPolicy should enforce the configured length range")
    void meetsPolicy_shouldEnforceLengthRange() {
        assertThat(passwordService.meetsPolicy("1234567")).isFalse();
        assertThat(passwordService.meetsPolicy("12345678")).isTrue();
        assertThat(passwordService.meetsPolicy("x".repeat(128))).isTrue();
        assertThat(passwordService.meetsPolicy("x".repeat(129))).isFalse();
        assertThat(passwordService.meetsPolicy(null)).isFalse();
    }
}
