package tech.automator.platform.principal;

import java.time.Instant;

/**
 * Subscription plan (embedded in User).
 */
public class Membership {

    public String plan;
    public String status;
    public Instant startedAt;
    public Instant expiresAt;

    public Membership() {
    }

    public static Membership free(Instant startedAt) {
        Membership membership = new Membership();
        membership.plan = "free";
        membership.status = "active";
        membership.startedAt = startedAt;
        return membership;
    }
}
