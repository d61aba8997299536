package app.tiered.entitlement.subscription;

import app.tiered.entitlement.subscriber.SubscriberRef;

import java.util.UUID;

public interface SubscriptionValidation {

    boolean canSubscribe(SubscriberRef subscriber, UUID planId, UUID pricingId);

    boolean canStartTrial(SubscriberRef subscriber, UUID planId, int durationDays);

    boolean canChangePlan(SubscriberRef subscriber, UUID newPlanId, UUID newPricingId);

    boolean canRenew(UUID subscriptionId);

    boolean canCancel(UUID subscriptionId);

    boolean canResume(UUID subscriptionId);
}
