package app.tiered.entitlement.subscription.event;

import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscription.SubscriptionSnapshot;

import java.time.Instant;

/**
 * {@code remaining} is -1 when the feature has no numeric limit.
 */
public record FeatureUsed(SubscriberRef subscriber,
                          SubscriptionSnapshot subscription,
                          Instant occurredAt,
                          String featureKey,
                          long amount,
                          long used,
                          long remaining) implements SubscriptionEvent {

    public static final long UNLIMITED = -1L;

    public boolean isUnlimited() {
        return remaining == UNLIMITED;
    }
}
