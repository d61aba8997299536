package app.tiered.entitlement.subscription.event;

import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscription.SubscriptionSnapshot;

import java.time.Instant;

public record SubscriptionCanceled(SubscriberRef subscriber,
                                   SubscriptionSnapshot subscription,
                                   Instant occurredAt) implements SubscriptionEvent {

    public Instant graceEndsAt() {
        return subscription.graceEndsAt();
    }
}
