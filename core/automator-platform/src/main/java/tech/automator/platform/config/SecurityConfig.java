package tech.automator.platform.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Token signing and password hashing settings. Read once at startup.
 */
@ConfigMapping(prefix = "automator.security")
public interface SecurityConfig {

    Jwt jwt();

    /**
     * BCrypt cost factor for newly hashed passwords.
     * Existing hashes keep verifying after a change since the cost is encoded in each hash.
     */
    @WithDefault("12")
    int bcryptCost();

    @WithDefault("8")
    int passwordMinLength();

    @WithDefault("128")
    int passwordMaxLength();

    interface Jwt {

        /**
         * HMAC signing secret. Must be at least 32 bytes for HS256.
         */
        String secretKey();

        /**
         * One of HS256, HS384, HS512.
         */
        @WithDefault("HS256")
        String algorithm();

        @WithDefault("30")
        long accessTokenExpireMinutes();

        @WithDefault("7")
        long refreshTokenExpireDays();

        @WithDefault("automator-api")
        String issuer();

        @WithDefault("automator-users")
        String audience();
    }
}
