package app.tiered.entitlement.subscription.event;

import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscription.SubscriptionSnapshot;

import java.time.Instant;

/**
 * Lifecycle notification. Listeners only see events of committed transactions.
 */
public interface SubscriptionEvent {

    SubscriberRef subscriber();

    SubscriptionSnapshot subscription();

    Instant occurredAt();
}
