package app.tiered.entitlement.subscription;

import app.tiered.entitlement.plan.PlanPricingEntity;

/**
 * Extension point around renewals for a host billing integration.
 * Throwing from {@link #beforeRenewal} aborts the renewal and rolls back its transaction.
 */
public interface BillingHook {

    default void beforeRenewal(SubscriptionSnapshot subscription, PlanPricingEntity pricing, boolean automatic) {
    }

    default void afterRenewal(SubscriptionSnapshot subscription, PlanPricingEntity pricing, boolean automatic) {
    }
}
