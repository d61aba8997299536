package app.tiered.entitlement.subscription;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum SubscriptionStatus {
    PENDING,
    TRIAL,
    ACTIVE,
    INACTIVE,
    CANCELED,
    EXPIRED;

    /**
     * Statuses that count toward the one-active-subscription-per-subscriber rule.
     */
    public static final Set<SubscriptionStatus> ACTIVE_FAMILY = EnumSet.of(ACTIVE, TRIAL);

    private static final Map<SubscriptionStatus, Set<SubscriptionStatus>> TRANSITIONS = Map.of(
            PENDING, EnumSet.of(TRIAL, ACTIVE, CANCELED, EXPIRED),
            TRIAL, EnumSet.of(ACTIVE, CANCELED, EXPIRED),
            ACTIVE, EnumSet.of(ACTIVE, INACTIVE, CANCELED, EXPIRED),
            INACTIVE, EnumSet.of(ACTIVE, CANCELED, EXPIRED),
            CANCELED, EnumSet.of(ACTIVE),
            EXPIRED, EnumSet.of(ACTIVE)
    );

    public boolean isActiveFamily() {
        return ACTIVE_FAMILY.contains(this);
    }

    public boolean canTransitionTo(SubscriptionStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }
}
