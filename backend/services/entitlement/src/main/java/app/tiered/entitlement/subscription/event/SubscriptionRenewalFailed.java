package app.tiered.entitlement.subscription.event;

import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscription.SubscriptionSnapshot;

import java.time.Instant;

public record SubscriptionRenewalFailed(SubscriberRef subscriber,
                                        SubscriptionSnapshot subscription,
                                        Instant occurredAt,
                                        String reason) implements SubscriptionEvent {
}
