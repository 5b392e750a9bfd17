package tech.automator.platform.principal;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.automator.platform.shared.Address;

import java.util.List;

/**
 * User payload for registration, admin creation and admin updates.
 *
 * Every field is optional at the JSON level. Creation requires email, username and
 * password; an update applies only the fields that are present.
 */
public record UserRequest(
    String email,
    String username,
    String password,
    UserProfile profile,
    Address address,
    UserPreferences preferences,
    SecurityInput security,
    String orgId,
    List<String> businessUnitIds,
    Membership membership,
    List<String> roles,
    List<String> groups,
    List<String> tags,
    @JsonProperty("is_active") Boolean isActive,
    @JsonProperty("is_banned") Boolean isBanned,
    @JsonProperty("is_suspended") Boolean isSuspended
) {

    /**
     * Client-settable security flags. The password hash is never accepted from clients.
     */
    public record SecurityInput(
        @JsonProperty("is_email_verified") Boolean isEmailVerified,
        @JsonProperty("is_phone_verified") Boolean isPhoneVerified,
        Boolean mfaEnabled
    ) {
    }
}
