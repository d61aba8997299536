package app.tiered.entitlement.subscription;

import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.usage.UsageMeteringService.FeatureUsageSummary;
import app.tiered.entitlement.value.FlexibleValue;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Feature checks and metering against the subscriber's live subscription.
 */
public interface FeatureAccess {

    boolean hasFeature(SubscriberRef subscriber, String featureKey);

    Optional<FlexibleValue> getFeatureValue(SubscriberRef subscriber, String featureKey, String locale);

    default Optional<FlexibleValue> getFeatureValue(SubscriberRef subscriber, String featureKey) {
        return getFeatureValue(subscriber, featureKey, null);
    }

    long getFeatureUsage(SubscriberRef subscriber, String featureKey);

    OptionalLong getRemainingUsage(SubscriberRef subscriber, String featureKey);

    boolean isFeatureExhausted(SubscriberRef subscriber, String featureKey);

    boolean canConsumeFeature(SubscriberRef subscriber, String featureKey, long amount);

    /**
     * Returns false when there is no live subscription or the limit would be exceeded.
     */
    boolean consumeFeature(SubscriberRef subscriber, String featureKey, long amount);

    default boolean consumeFeature(SubscriberRef subscriber, String featureKey) {
        return consumeFeature(subscriber, featureKey, 1);
    }

    boolean resetFeature(SubscriberRef subscriber, String featureKey);

    /**
     * Zeroes every counter of the live subscription and returns how many were reset.
     */
    int resetAllFeatures(SubscriberRef subscriber);

    List<FeatureUsageSummary> usageSummary(SubscriberRef subscriber, String locale);
}
