package tech.automator.platform.principal;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.automator.platform.shared.Address;

import java.time.Instant;
import java.util.List;

/**
 * Client-facing user record. Never carries the password hash or recovery codes.
 */
public record UserView(
    String userId,
    String email,
    String username,
    UserProfile profile,
    Address address,
    UserPreferences preferences,
    SecurityView security,
    String orgId,
    List<String> businessUnitIds,
    Membership membership,
    List<String> roles,
    List<String> groups,
    List<String> tags,
    @JsonProperty("is_active") boolean isActive,
    @JsonProperty("is_banned") boolean isBanned,
    @JsonProperty("is_suspended") boolean isSuspended,
    @JsonProperty("is_logged_in") boolean isLoggedIn,
    @JsonProperty("is_deleted") boolean isDeleted,
    UserMetadata metadata,
    Instant createdAt,
    Instant updatedAt
) {

    public record SecurityView(
        @JsonProperty("is_email_verified") boolean isEmailVerified,
        @JsonProperty("is_phone_verified") boolean isPhoneVerified,
        Instant lastLogin,
        boolean mfaEnabled
    ) {
    }

    public static UserView from(User user) {
        UserSecurity security = user.security != null ? user.security : new UserSecurity();
        return new UserView(
            user.id,
            user.email,
            user.username,
            user.profile,
            user.address,
            user.preferences,
            new SecurityView(security.emailVerified, security.phoneVerified,
                security.lastLogin, security.mfaEnabled),
            user.orgId,
            user.businessUnitIds,
            user.membership,
            user.roles,
            user.groups,
            user.tags,
            user.active,
            user.banned,
            user.suspended,
            user.loggedIn,
            user.deleted,
            user.metadata,
            user.createdAt,
            user.updatedAt
        );
    }
}
