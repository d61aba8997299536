package app.tiered.entitlement.subscription;

import app.tiered.entitlement.subscriber.SubscriberRef;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable copy of a subscription row, safe to hand to listeners after the transaction ends.
 */
public record SubscriptionSnapshot(UUID subscriptionId,
                                   SubscriberRef subscriber,
                                   UUID planId,
                                   UUID planPricingId,
                                   SubscriptionStatus status,
                                   boolean autoRenewal,
                                   Instant startsAt,
                                   Instant endsAt,
                                   Instant trialEndsAt,
                                   Instant graceEndsAt) {

    public static SubscriptionSnapshot of(SubscriptionEntity entity) {
        return new SubscriptionSnapshot(
                entity.getSubscriptionId(),
                entity.getSubscriber(),
                entity.getPlanId(),
                entity.getPlanPricingId(),
                entity.getStatus(),
                entity.isAutoRenewal(),
                entity.getStartsAt(),
                entity.getEndsAt(),
                entity.getTrialEndsAt(),
                entity.getGraceEndsAt()
        );
    }

    public boolean isLifetime() {
        return endsAt == null;
    }
}
