package app.tiered.entitlement.subscription.event;

import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscription.PlanChangeSummary;
import app.tiered.entitlement.subscription.SubscriptionSnapshot;

import java.time.Instant;

/**
 * A plan change replaced {@code previous} with {@code subscription}.
 */
public record SubscriptionChanged(SubscriberRef subscriber,
                                  SubscriptionSnapshot subscription,
                                  Instant occurredAt,
                                  SubscriptionSnapshot previous,
                                  PlanChangeSummary summary) implements SubscriptionEvent {

    public boolean isUpgrade() {
        return summary.changeType() == PlanChangeSummary.ChangeType.UPGRADE;
    }

    public boolean isDowngrade() {
        return summary.changeType() == PlanChangeSummary.ChangeType.DOWNGRADE;
    }
}
