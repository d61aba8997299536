package app.tiered.entitlement.subscription.event;

import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscription.SubscriptionSnapshot;

import java.time.Instant;

/**
 * A subscription became usable: created as ACTIVE, or resumed after cancellation.
 */
public record SubscriptionStarted(SubscriberRef subscriber,
                                  SubscriptionSnapshot subscription,
                                  Instant occurredAt,
                                  boolean resumed) implements SubscriptionEvent {
}
