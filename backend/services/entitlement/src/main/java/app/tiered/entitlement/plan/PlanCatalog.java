package app.tiered.entitlement.plan;

import app.tiered.entitlement.support.SubscriptionValidationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to plans, pricings and features.
 */
@Service
@Transactional(readOnly = true)
public class PlanCatalog {

    private final PlanRepository planRepository;
    private final PlanPricingRepository pricingRepository;
    private final PlanFeatureRepository featureRepository;

    public PlanCatalog(PlanRepository planRepository,
                       PlanPricingRepository pricingRepository,
                       PlanFeatureRepository featureRepository) {
        this.planRepository = planRepository;
        this.pricingRepository = pricingRepository;
        this.featureRepository = featureRepository;
    }

    public PlanEntity getPlan(UUID planId) {
        return planRepository.findById(planId)
                .orElseThrow(() -> new SubscriptionValidationException("Plan not found: " + planId));
    }

    public PlanEntity getAvailablePlan(UUID planId) {
        PlanEntity plan = getPlan(planId);
        if (!plan.isAvailable()) {
            throw new SubscriptionValidationException("Plan is not active: " + planId);
        }
        return plan;
    }

    public PlanPricingEntity getPricing(UUID pricingId) {
        return pricingRepository.findById(pricingId)
                .orElseThrow(() -> new SubscriptionValidationException("Pricing not found: " + pricingId));
    }

    public PlanPricingEntity getPricingForPlan(UUID planId, UUID pricingId) {
        return pricingRepository.findByPlanPricingIdAndPlanId(pricingId, planId)
                .orElseThrow(() -> new SubscriptionValidationException(
                        "Pricing " + pricingId + " does not belong to plan " + planId));
    }

    public List<PlanPricingEntity> pricings(UUID planId) {
        return pricingRepository.findByPlanIdOrderByPriceAscDurationInDaysAscPlanPricingIdAsc(planId);
    }

    /**
     * Pricing attached to a trial: the cheapest one, ties broken by shorter duration and then id.
     */
    public PlanPricingEntity trialPricing(UUID planId) {
        return pricings(planId).stream()
                .min(Comparator.comparing(PlanPricingEntity::defaultPrice)
                        .thenComparing(p -> p.isLifetime() ? Integer.MAX_VALUE : p.getDurationInDays())
                        .thenComparing(PlanPricingEntity::getPlanPricingId))
                .orElseThrow(() -> new SubscriptionValidationException("Plan has no pricing: " + planId));
    }

    public Optional<PlanFeatureEntity> findFeature(UUID planId, String featureKey) {
        return featureRepository.findByPlanIdAndFeatureKey(planId, featureKey);
    }

    public List<PlanFeatureEntity> features(UUID planId) {
        return featureRepository.findByPlanIdOrderByFeatureKeyAsc(planId);
    }
}
