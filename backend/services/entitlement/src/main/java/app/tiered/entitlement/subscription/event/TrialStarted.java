package app.tiered.entitlement.subscription.event;

import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscription.SubscriptionSnapshot;

import java.time.Instant;

public record TrialStarted(SubscriberRef subscriber,
                           SubscriptionSnapshot subscription,
                           Instant occurredAt,
                           int trialDays) implements SubscriptionEvent {

    public Instant trialEndsAt() {
        return subscription.trialEndsAt();
    }
}
