package app.tiered.entitlement.subscription.event;

import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscription.SubscriptionSnapshot;

import java.time.Instant;

public record FeatureUsageReset(SubscriberRef subscriber,
                                SubscriptionSnapshot subscription,
                                Instant occurredAt,
                                String featureKey,
                                long previousUsed) implements SubscriptionEvent {
}
