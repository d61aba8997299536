package app.tiered.entitlement.subscription;

import app.tiered.entitlement.config.EntitlementProps;
import app.tiered.entitlement.plan.PlanCatalog;
import app.tiered.entitlement.plan.PlanEntity;
import app.tiered.entitlement.plan.PlanFeatureEntity;
import app.tiered.entitlement.plan.PlanPricingEntity;
import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.support.SubscriptionValidationException;
import app.tiered.entitlement.value.FlexibleValueCodec;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

@Component
public class SubscriptionValidator {

    private static final Set<SubscriptionStatus> DUPLICABLE = EnumSet.of(
            SubscriptionStatus.EXPIRED, SubscriptionStatus.CANCELED, SubscriptionStatus.INACTIVE);

    private final SubscriptionRepository subscriptionRepository;
    private final PlanCatalog planCatalog;
    private final FlexibleValueCodec codec;
    private final EntitlementProps props;

    public SubscriptionValidator(SubscriptionRepository subscriptionRepository,
                                 PlanCatalog planCatalog,
                                 FlexibleValueCodec codec,
                                 EntitlementProps props) {
        this.subscriptionRepository = subscriptionRepository;
        this.planCatalog = planCatalog;
        this.codec = codec;
        this.props = props;
    }

    /**
     * Locks the subscriber's live rows and fails when one exists.
     */
    public void requireNoActiveSubscription(SubscriberRef subscriber) {
        List<SubscriptionEntity> active = subscriptionRepository.findForSubscriberForUpdate(
                subscriber.type(), subscriber.id(), SubscriptionStatus.ACTIVE_FAMILY);
        if (!active.isEmpty()) {
            throw new SubscriptionValidationException("Subscriber already has an active subscription: " + subscriber);
        }
    }

    public void requireNoOtherActiveSubscription(SubscriptionEntity subscription) {
        boolean other = subscriptionRepository.findForSubscriberForUpdate(
                        subscription.getSubscriberType(), subscription.getSubscriberId(), SubscriptionStatus.ACTIVE_FAMILY)
                .stream()
                .anyMatch(s -> !s.getSubscriptionId().equals(subscription.getSubscriptionId()));
        if (other) {
            throw new SubscriptionValidationException(
                    "Subscriber already has another active subscription: " + subscription.getSubscriber());
        }
    }

    public void validateTrialDays(int trialDays) {
        if (trialDays < 0) {
            throw new SubscriptionValidationException("Trial days cannot be negative: " + trialDays);
        }
        if (trialDays > 0) {
            validateTrialDuration(trialDays);
        }
    }

    public void validateTrialDuration(int durationDays) {
        EntitlementProps.Trial trial = props.trial();
        if (durationDays < trial.minDays() || durationDays > trial.maxDays()) {
            throw new SubscriptionValidationException(
                    "Trial duration must be between " + trial.minDays() + " and " + trial.maxDays() + " days: " + durationDays);
        }
    }

    public void validateTrialEligibility(SubscriberRef subscriber, PlanEntity plan) {
        if (props.trial().allowMultipleTrialsPerPlan()) {
            return;
        }
        if (subscriptionRepository.existsTrialForPlan(subscriber.type(), subscriber.id(), plan.getPlanId())) {
            throw new SubscriptionValidationException(
                    "Subscriber already used a trial for plan " + plan.getSlug() + ": " + subscriber);
        }
    }

    public void validatePlanChange(SubscriptionEntity current,
                                   PlanEntity newPlan,
                                   PlanPricingEntity newPricing,
                                   PlanChangeSummary.ChangeType changeType,
                                   boolean usageWillReset,
                                   Map<String, Long> currentUsage) {
        EntitlementProps.PlanChanges rules = props.planChanges();
        if (current.getStatus() == SubscriptionStatus.TRIAL && !rules.allowPlanChangeDuringTrial()) {
            throw new SubscriptionValidationException("Plan changes are not allowed during a trial");
        }
        if (current.getPlanId().equals(newPlan.getPlanId())
                && current.getPlanPricingId().equals(newPricing.getPlanPricingId())) {
            throw new SubscriptionValidationException("Subscription is already on this plan and pricing");
        }
        if (changeType == PlanChangeSummary.ChangeType.DOWNGRADE && !rules.allowDowngrades()) {
            throw new SubscriptionValidationException("Plan downgrades are not allowed");
        }
        if (rules.preventDowngradeWithExcessUsage() && !usageWillReset) {
            requireUsageWithinLimits(currentUsage, newPlan);
        }
    }

    public void validateDuplicate(SubscriptionEntity source) {
        if (!DUPLICABLE.contains(source.getStatus())) {
            throw new SubscriptionValidationException(
                    "Only expired, canceled or inactive subscriptions can be duplicated, status: " + source.getStatus());
        }
    }

    private void requireUsageWithinLimits(Map<String, Long> usage, PlanEntity newPlan) {
        String fallback = props.locale().fallback();
        for (Map.Entry<String, Long> entry : usage.entrySet()) {
            OptionalLong limit = planCatalog.findFeature(newPlan.getPlanId(), entry.getKey())
                    .map(PlanFeatureEntity::getFeatureValue)
                    .map(value -> codec.resolveLocalized(value, fallback, fallback).asLimit())
                    .orElse(OptionalLong.empty());
            if (limit.isPresent() && entry.getValue() > limit.getAsLong()) {
                throw new SubscriptionValidationException(
                        "Current usage of " + entry.getKey() + " (" + entry.getValue()
                                + ") exceeds the new plan limit of " + limit.getAsLong());
            }
        }
    }
}
