package app.tiered.entitlement.subscription;

import app.tiered.entitlement.subscriber.Subscribable;
import app.tiered.entitlement.subscriber.SubscriberRef;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionQueries {

    Optional<SubscriptionSnapshot> getActiveSubscription(SubscriberRef subscriber);

    List<SubscriptionSnapshot> getSubscriptions(SubscriberRef subscriber);

    Optional<SubscriptionSnapshot> getSubscription(SubscriberRef subscriber, UUID subscriptionId);

    boolean hasActiveSubscription(SubscriberRef subscriber);

    boolean hasAnySubscription(SubscriberRef subscriber);

    boolean isSubscribedTo(SubscriberRef subscriber, UUID planId);

    boolean hasUsedTrial(SubscriberRef subscriber, UUID planId);

    List<SubscriptionSnapshot> getExpiringWithin(int days);

    Optional<Subscribable> resolveSubscriber(SubscriptionSnapshot subscription);

    SubscriptionStatistics statistics();

    HealthStatus healthStatus();

    record SubscriptionStatistics(long total, Map<SubscriptionStatus, Long> byStatus, Instant generatedAt) {

        public long count(SubscriptionStatus status) {
            return byStatus.getOrDefault(status, 0L);
        }
    }

    record HealthStatus(String status,
                        long activeSubscriptions,
                        long expiringSoon,
                        long overdueSubscriptions,
                        long autoRenewalEnabled) {

        public boolean isHealthy() {
            return "healthy".equals(status);
        }
    }
}
