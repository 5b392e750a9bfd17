package tech.automator.platform.principal;

import java.time.Instant;

public class UserMetadata {

    public Instant lastActivity;
    public String registrationSource;

    public UserMetadata() {
    }
}
