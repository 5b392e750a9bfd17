package tech.automator.platform.principal;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Credential and verification state (embedded in User).
 * Never serialized to clients; see {@link UserView}.
 */
public class UserSecurity {

    public boolean emailVerified;
    public boolean phoneVerified;

    /**
     * BCrypt hash in Modular Crypt Format. Replaced wholesale, never patched.
     */
    public String passwordHash;

    public Instant lastLogin;
    public boolean mfaEnabled;
    public List<String> recoveryCodes = new ArrayList<>();

    public UserSecurity() {
    }
}
