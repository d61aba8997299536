package app.tiered.entitlement.subscription.event;

import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscription.SubscriptionSnapshot;

import java.time.Instant;
import java.util.Map;

public record SubscriptionCreated(SubscriberRef subscriber,
                                  SubscriptionSnapshot subscription,
                                  Instant occurredAt,
                                  Map<String, Object> metadata) implements SubscriptionEvent {

    public SubscriptionCreated {
        metadata = Map.copyOf(metadata);
    }
}
