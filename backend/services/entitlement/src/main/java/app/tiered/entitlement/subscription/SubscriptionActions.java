package app.tiered.entitlement.subscription;

import app.tiered.entitlement.subscriber.SubscriberRef;

import java.util.UUID;

/**
 * Lifecycle commands. Methods returning {@code boolean} report false when the subscription is
 * not in a state that allows the operation; rule violations throw.
 */
public interface SubscriptionActions {

    SubscriptionSnapshot subscribe(SubscriberRef subscriber, UUID planId, UUID pricingId, int trialDays);

    default SubscriptionSnapshot subscribe(SubscriberRef subscriber, UUID planId, UUID pricingId) {
        return subscribe(subscriber, planId, pricingId, 0);
    }

    SubscriptionSnapshot startTrial(SubscriberRef subscriber, UUID planId, int durationDays);

    boolean renew(UUID subscriptionId);

    boolean cancel(UUID subscriptionId);

    boolean resume(UUID subscriptionId);

    boolean expire(UUID subscriptionId);

    boolean activate(UUID subscriptionId);

    boolean deactivate(UUID subscriptionId);

    /**
     * Replaces the subscriber's live subscription with a new one on another plan.
     *
     * @param resetUsage explicit override; {@code null} resets only on downgrades, when enabled
     */
    SubscriptionSnapshot changePlan(SubscriberRef subscriber, UUID newPlanId, UUID newPricingId, Boolean resetUsage);

    default SubscriptionSnapshot changePlan(SubscriberRef subscriber, UUID newPlanId, UUID newPricingId) {
        return changePlan(subscriber, newPlanId, newPricingId, null);
    }

    SubscriptionSnapshot duplicate(UUID subscriptionId, boolean withTrial);
}
