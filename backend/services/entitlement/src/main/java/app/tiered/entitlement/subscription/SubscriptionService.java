package app.tiered.entitlement.subscription;

import app.tiered.entitlement.config.EntitlementProps;
import app.tiered.entitlement.plan.PlanCatalog;
import app.tiered.entitlement.plan.PlanEntity;
import app.tiered.entitlement.plan.PlanPricingEntity;
import app.tiered.entitlement.subscriber.Subscribable;
import app.tiered.entitlement.subscriber.SubscriberRef;
import app.tiered.entitlement.subscriber.SubscriberRegistry;
import app.tiered.entitlement.subscription.event.FeatureUsageReset;
import app.tiered.entitlement.subscription.event.FeatureUsed;
import app.tiered.entitlement.subscription.event.SubscriptionCanceled;
import app.tiered.entitlement.subscription.event.SubscriptionChanged;
import app.tiered.entitlement.subscription.event.SubscriptionCreated;
import app.tiered.entitlement.subscription.event.SubscriptionExpired;
import app.tiered.entitlement.subscription.event.SubscriptionRenewalFailed;
import app.tiered.entitlement.subscription.event.SubscriptionRenewed;
import app.tiered.entitlement.subscription.event.SubscriptionStarted;
import app.tiered.entitlement.subscription.event.TrialStarted;
import app.tiered.entitlement.support.SubscriptionValidationException;
import app.tiered.entitlement.usage.UsageMeteringService;
import app.tiered.entitlement.usage.UsageMeteringService.Consumption;
import app.tiered.entitlement.usage.UsageMeteringService.FeatureUsageSummary;
import app.tiered.entitlement.value.FlexibleValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Entry point for subscriber-facing lifecycle operations. Each public operation is one
 * transaction; events are published inside it and reach listeners after commit.
 */
@Service
public class SubscriptionService implements SubscriptionQueries, SubscriptionActions, SubscriptionValidation, FeatureAccess {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private static final int EXPIRING_SOON_DAYS = 7;

    private final SubscriptionRepository subscriptionRepository;
    private final PlanCatalog planCatalog;
    private final SubscriptionStateMachine stateMachine;
    private final UsageMeteringService metering;
    private final SubscriptionValidator validator;
    private final SubscriptionEventPublisher events;
    private final SubscriberRegistry subscriberRegistry;
    private final List<BillingHook> billingHooks;
    private final EntitlementProps props;
    private final Clock clock;

    @Autowired
    public SubscriptionService(SubscriptionRepository subscriptionRepository,
                               PlanCatalog planCatalog,
                               SubscriptionStateMachine stateMachine,
                               UsageMeteringService metering,
                               SubscriptionValidator validator,
                               SubscriptionEventPublisher events,
                               SubscriberRegistry subscriberRegistry,
                               ObjectProvider<BillingHook> billingHooks,
                               EntitlementProps props,
                               Clock clock) {
        this(subscriptionRepository, planCatalog, stateMachine, metering, validator, events,
                subscriberRegistry, billingHooks.orderedStream().toList(), props, clock);
    }

    public SubscriptionService(SubscriptionRepository subscriptionRepository,
                               PlanCatalog planCatalog,
                               SubscriptionStateMachine stateMachine,
                               UsageMeteringService metering,
                               SubscriptionValidator validator,
                               SubscriptionEventPublisher events,
                               SubscriberRegistry subscriberRegistry,
                               List<BillingHook> billingHooks,
                               EntitlementProps props,
                               Clock clock) {
        this.subscriptionRepository = subscriptionRepository;
        this.planCatalog = planCatalog;
        this.stateMachine = stateMachine;
        this.metering = metering;
        this.validator = validator;
        this.events = events;
        this.subscriberRegistry = subscriberRegistry;
        this.billingHooks = List.copyOf(billingHooks);
        this.props = props;
        this.clock = clock;
    }

    // ---- lifecycle

    @Override
    @Transactional
    public SubscriptionSnapshot subscribe(SubscriberRef subscriber, UUID planId, UUID pricingId, int trialDays) {
        Instant now = clock.instant();
        validator.validateTrialDays(trialDays);
        PlanEntity plan = planCatalog.getAvailablePlan(planId);
        PlanPricingEntity pricing = planCatalog.getPricingForPlan(planId, pricingId);
        validator.requireNoActiveSubscription(subscriber);
        if (trialDays > 0) {
            validator.validateTrialEligibility(subscriber, plan);
        }

        SubscriptionEntity created = insert(newSubscription(subscriber, plan, pricing, trialDays, now), now);
        log.info("Subscription created: subscriptionId={}, subscriber={}, planId={}, pricingId={}, status={}",
                created.getSubscriptionId(), subscriber, planId, pricingId, created.getStatus());

        SubscriptionSnapshot snapshot = SubscriptionSnapshot.of(created);
        publishStart(snapshot, trialDays, false, now);
        return snapshot;
    }

    @Override
    @Transactional
    public SubscriptionSnapshot startTrial(SubscriberRef subscriber, UUID planId, int durationDays) {
        Instant now = clock.instant();
        validator.validateTrialDuration(durationDays);
        PlanEntity plan = planCatalog.getAvailablePlan(planId);
        validator.requireNoActiveSubscription(subscriber);
        validator.validateTrialEligibility(subscriber, plan);
        PlanPricingEntity pricing = planCatalog.trialPricing(planId);

        SubscriptionEntity created = insert(newSubscription(subscriber, plan, pricing, durationDays, now), now);
        log.info("Trial started: subscriptionId={}, subscriber={}, planId={}, pricingId={}, trialEndsAt={}",
                created.getSubscriptionId(), subscriber, planId, pricing.getPlanPricingId(), created.getTrialEndsAt());

        SubscriptionSnapshot snapshot = SubscriptionSnapshot.of(created);
        events.publish(new TrialStarted(subscriber, snapshot, now, durationDays));
        return snapshot;
    }

    @Override
    @Transactional
    public boolean renew(UUID subscriptionId) {
        Instant now = clock.instant();
        SubscriptionEntity s = lock(subscriptionId);
        if (!stateMachine.canRenew(s)) {
            return false;
        }
        if (!s.getStatus().isActiveFamily()) {
            validator.requireNoOtherActiveSubscription(s);
        }
        renewLocked(s, now, false);
        return true;
    }

    @Override
    @Transactional
    public boolean cancel(UUID subscriptionId) {
        Instant now = clock.instant();
        SubscriptionEntity s = lock(subscriptionId);
        if (!stateMachine.canCancel(s)) {
            return false;
        }
        stateMachine.cancel(s);
        subscriptionRepository.save(s);
        log.info("Subscription canceled: subscriptionId={}, subscriber={}, graceEndsAt={}",
                s.getSubscriptionId(), s.getSubscriber(), s.getGraceEndsAt());
        events.publish(new SubscriptionCanceled(s.getSubscriber(), SubscriptionSnapshot.of(s), now));
        return true;
    }

    @Override
    @Transactional
    public boolean resume(UUID subscriptionId) {
        Instant now = clock.instant();
        SubscriptionEntity s = lock(subscriptionId);
        if (!stateMachine.canResume(s, now)) {
            return false;
        }
        validator.requireNoOtherActiveSubscription(s);
        stateMachine.resume(s, now);
        flush(s);
        log.info("Subscription resumed: subscriptionId={}, subscriber={}", s.getSubscriptionId(), s.getSubscriber());
        events.publish(new SubscriptionStarted(s.getSubscriber(), SubscriptionSnapshot.of(s), now, true));
        return true;
    }

    @Override
    @Transactional
    public boolean expire(UUID subscriptionId) {
        Instant now = clock.instant();
        SubscriptionEntity s = lock(subscriptionId);
        if (!stateMachine.canExpire(s, now)) {
            return false;
        }
        expireLocked(s, now);
        return true;
    }

    /**
     * Activating an ACTIVE subscription succeeds without changes or events.
     */
    @Override
    @Transactional
    public boolean activate(UUID subscriptionId) {
        Instant now = clock.instant();
        SubscriptionEntity s = lock(subscriptionId);
        if (s.getStatus() == SubscriptionStatus.ACTIVE) {
            return true;
        }
        if (!s.getStatus().isActiveFamily()) {
            validator.requireNoOtherActiveSubscription(s);
        }
        stateMachine.activate(s);
        flush(s);
        log.info("Subscription activated: subscriptionId={}, subscriber={}", s.getSubscriptionId(), s.getSubscriber());
        events.publish(new SubscriptionStarted(s.getSubscriber(), SubscriptionSnapshot.of(s), now, false));
        return true;
    }

    @Override
    @Transactional
    public boolean deactivate(UUID subscriptionId) {
        SubscriptionEntity s = lock(subscriptionId);
        if (s.getStatus() != SubscriptionStatus.ACTIVE) {
            return false;
        }
        stateMachine.deactivate(s);
        subscriptionRepository.save(s);
        log.info("Subscription deactivated: subscriptionId={}, subscriber={}", s.getSubscriptionId(), s.getSubscriber());
        return true;
    }

    @Override
    @Transactional
    public SubscriptionSnapshot changePlan(SubscriberRef subscriber, UUID newPlanId, UUID newPricingId, Boolean resetUsage) {
        Instant now = clock.instant();
        SubscriptionEntity current = subscriptionRepository.findForSubscriberForUpdate(
                        subscriber.type(), subscriber.id(), SubscriptionStatus.ACTIVE_FAMILY)
                .stream()
                .findFirst()
                .orElseThrow(() -> new SubscriptionValidationException("No active subscription to change: " + subscriber));
        PlanEntity newPlan = planCatalog.getAvailablePlan(newPlanId);
        PlanPricingEntity newPricing = planCatalog.getPricingForPlan(newPlanId, newPricingId);
        PlanPricingEntity oldPricing = planCatalog.getPricing(current.getPlanPricingId());

        PlanChangeSummary.ChangeType changeType =
                PlanChangeSummary.ChangeType.compare(oldPricing.defaultPrice(), newPricing.defaultPrice());
        boolean reset = resetUsage != null
                ? resetUsage
                : changeType == PlanChangeSummary.ChangeType.DOWNGRADE && props.planChanges().resetUsageOnPlanChange();
        validator.validatePlanChange(current, newPlan, newPricing, changeType, reset, metering.currentUsage(current, now));

        PlanChangeSummary summary = new PlanChangeSummary(
                changeType,
                current.getPlanId(),
                newPlanId,
                oldPricing.getPlanPricingId(),
                newPricing.getPlanPricingId(),
                oldPricing.getLabel(),
                newPricing.getLabel(),
                props.currency().defaultCode(),
                proration(current, oldPricing, newPricing, now),
                reset,
                now
        );

        stateMachine.supersede(current);
        subscriptionRepository.saveAndFlush(current);

        SubscriptionEntity replacement = insert(newSubscription(subscriber, newPlan, newPricing, 0, now), now);
        int copied = metering.copyUsages(current, replacement, reset);

        log.info("Subscription plan changed: subscriber={}, oldSubscriptionId={}, newSubscriptionId={}, changeType={}, usageReset={}, usageRows={}",
                subscriber, current.getSubscriptionId(), replacement.getSubscriptionId(), changeType, reset, copied);

        SubscriptionSnapshot snapshot = SubscriptionSnapshot.of(replacement);
        events.publish(new SubscriptionChanged(subscriber, snapshot, now, SubscriptionSnapshot.of(current), summary));
        return snapshot;
    }

    @Override
    @Transactional
    public SubscriptionSnapshot duplicate(UUID subscriptionId, boolean withTrial) {
        Instant now = clock.instant();
        SubscriptionEntity source = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new SubscriptionValidationException("Subscription not found: " + subscriptionId));
        validator.validateDuplicate(source);
        SubscriberRef subscriber = source.getSubscriber();
        PlanEntity plan = planCatalog.getAvailablePlan(source.getPlanId());
        PlanPricingEntity pricing = planCatalog.getPricingForPlan(source.getPlanId(), source.getPlanPricingId());
        validator.requireNoActiveSubscription(subscriber);

        int trialDays = withTrial ? props.trialPeriodDays() : 0;
        SubscriptionEntity created = insert(newSubscription(subscriber, plan, pricing, trialDays, now), now);
        metering.copyUsages(source, created, true);
        log.info("Subscription duplicated: originalSubscriptionId={}, subscriptionId={}, subscriber={}, withTrial={}",
                subscriptionId, created.getSubscriptionId(), subscriber, withTrial);

        SubscriptionSnapshot snapshot = SubscriptionSnapshot.of(created);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("action", "duplicate");
        metadata.put("original_subscription_id", subscriptionId.toString());
        metadata.put("with_trial", withTrial);
        events.publish(new SubscriptionCreated(subscriber, snapshot, now, metadata));
        events.publish(new SubscriptionStarted(subscriber, snapshot, now, false));
        if (withTrial) {
            events.publish(new TrialStarted(subscriber, snapshot, now, trialDays));
        }
        return snapshot;
    }

    // ---- sweeps

    @Transactional(readOnly = true)
    public List<UUID> overdueSubscriptionIds(int limit) {
        return subscriptionRepository.findOverdueIds(SubscriptionStatus.ACTIVE_FAMILY, clock.instant(), PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<UUID> renewalCandidateIds(int limit) {
        return subscriptionRepository.findRenewalCandidateIds(clock.instant(), PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public Optional<SubscriptionSnapshot> findSnapshot(UUID subscriptionId) {
        return subscriptionRepository.findById(subscriptionId).map(SubscriptionSnapshot::of);
    }

    /**
     * Expires the subscription if, once locked, it is still live and past its grace or paid window.
     */
    @Transactional
    public boolean expireIfOverdue(UUID subscriptionId) {
        Instant now = clock.instant();
        SubscriptionEntity s = lock(subscriptionId);
        if (!s.getStatus().isActiveFamily() || !isOverdue(s, now)) {
            return false;
        }
        if (!stateMachine.canExpire(s, now)) {
            log.warn("Overdue subscription cannot expire: subscriptionId={}, status={}, endsAt={}, graceEndsAt={}",
                    s.getSubscriptionId(), s.getStatus(), s.getEndsAt(), s.getGraceEndsAt());
            return false;
        }
        expireLocked(s, now);
        return true;
    }

    /**
     * Renews the subscription if, once locked, it still qualifies for automatic renewal.
     */
    @Transactional
    public boolean autoRenew(UUID subscriptionId) {
        Instant now = clock.instant();
        SubscriptionEntity s = lock(subscriptionId);
        if (!stateMachine.shouldAutoRenew(s, now)) {
            return false;
        }
        renewLocked(s, now, true);
        return true;
    }

    @Transactional
    public void recordRenewalFailure(UUID subscriptionId, String reason) {
        subscriptionRepository.findById(subscriptionId).ifPresent(s -> events.publish(
                new SubscriptionRenewalFailed(s.getSubscriber(), SubscriptionSnapshot.of(s), clock.instant(), reason)));
    }

    // ---- queries

    @Override
    @Transactional(readOnly = true)
    public Optional<SubscriptionSnapshot> getActiveSubscription(SubscriberRef subscriber) {
        return findActive(subscriber).map(SubscriptionSnapshot::of);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubscriptionSnapshot> getSubscriptions(SubscriberRef subscriber) {
        return subscriptionRepository.findHistory(subscriber.type(), subscriber.id()).stream()
                .map(SubscriptionSnapshot::of)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SubscriptionSnapshot> getSubscription(SubscriberRef subscriber, UUID subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .filter(s -> s.getSubscriber().equals(subscriber))
                .map(SubscriptionSnapshot::of);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasActiveSubscription(SubscriberRef subscriber) {
        return findActive(subscriber).isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasAnySubscription(SubscriberRef subscriber) {
        return !subscriptionRepository.findHistory(subscriber.type(), subscriber.id()).isEmpty();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isSubscribedTo(SubscriberRef subscriber, UUID planId) {
        return findActive(subscriber).map(s -> s.getPlanId().equals(planId)).orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasUsedTrial(SubscriberRef subscriber, UUID planId) {
        if (planId == null) {
            return subscriptionRepository.existsAnyTrial(subscriber.type(), subscriber.id());
        }
        return subscriptionRepository.existsTrialForPlan(subscriber.type(), subscriber.id(), planId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubscriptionSnapshot> getExpiringWithin(int days) {
        Instant now = clock.instant();
        return subscriptionRepository.findExpiringBetween(SubscriptionStatus.ACTIVE_FAMILY, now, now.plus(days, ChronoUnit.DAYS))
                .stream()
                .map(SubscriptionSnapshot::of)
                .toList();
    }

    @Override
    public Optional<Subscribable> resolveSubscriber(SubscriptionSnapshot subscription) {
        return subscriberRegistry.resolve(subscription.subscriber());
    }

    @Override
    @Transactional(readOnly = true)
    public SubscriptionStatistics statistics() {
        Map<SubscriptionStatus, Long> byStatus = new EnumMap<>(SubscriptionStatus.class);
        for (SubscriptionStatus status : SubscriptionStatus.values()) {
            byStatus.put(status, 0L);
        }
        long total = 0;
        for (SubscriptionRepository.StatusCount row : subscriptionRepository.countByStatus()) {
            byStatus.put(row.getStatus(), row.getTotal());
            total += row.getTotal();
        }
        return new SubscriptionStatistics(total, Map.copyOf(byStatus), clock.instant());
    }

    @Override
    @Transactional(readOnly = true)
    public HealthStatus healthStatus() {
        Instant now = clock.instant();
        SubscriptionStatistics stats = statistics();
        long active = stats.count(SubscriptionStatus.ACTIVE) + stats.count(SubscriptionStatus.TRIAL);
        long expiring = subscriptionRepository.findExpiringBetween(
                List.of(SubscriptionStatus.ACTIVE), now, now.plus(EXPIRING_SOON_DAYS, ChronoUnit.DAYS)).size();
        long overdue = subscriptionRepository.countOverdue(SubscriptionStatus.ACTIVE_FAMILY, now);
        long autoRenewal = subscriptionRepository.countByAutoRenewalTrueAndDeletedAtIsNull();
        return new HealthStatus(overdue > 0 ? "warning" : "healthy", active, expiring, overdue, autoRenewal);
    }

    // ---- validation

    @Override
    @Transactional(readOnly = true)
    public boolean canSubscribe(SubscriberRef subscriber, UUID planId, UUID pricingId) {
        try {
            planCatalog.getAvailablePlan(planId);
            planCatalog.getPricingForPlan(planId, pricingId);
            return findActive(subscriber).isEmpty();
        } catch (SubscriptionValidationException ex) {
            log.debug("Subscribe not allowed: subscriber={}, planId={}, reason={}", subscriber, planId, ex.getMessage());
            return false;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean canStartTrial(SubscriberRef subscriber, UUID planId, int durationDays) {
        try {
            validator.validateTrialDuration(durationDays);
            PlanEntity plan = planCatalog.getAvailablePlan(planId);
            validator.validateTrialEligibility(subscriber, plan);
            planCatalog.trialPricing(planId);
            return findActive(subscriber).isEmpty();
        } catch (SubscriptionValidationException ex) {
            log.debug("Trial not allowed: subscriber={}, planId={}, reason={}", subscriber, planId, ex.getMessage());
            return false;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean canChangePlan(SubscriberRef subscriber, UUID newPlanId, UUID newPricingId) {
        Optional<SubscriptionEntity> current = findActive(subscriber);
        if (current.isEmpty()) {
            return false;
        }
        try {
            PlanEntity newPlan = planCatalog.getAvailablePlan(newPlanId);
            PlanPricingEntity newPricing = planCatalog.getPricingForPlan(newPlanId, newPricingId);
            PlanPricingEntity oldPricing = planCatalog.getPricing(current.get().getPlanPricingId());
            PlanChangeSummary.ChangeType changeType =
                    PlanChangeSummary.ChangeType.compare(oldPricing.defaultPrice(), newPricing.defaultPrice());
            boolean reset = changeType == PlanChangeSummary.ChangeType.DOWNGRADE && props.planChanges().resetUsageOnPlanChange();
            validator.validatePlanChange(current.get(), newPlan, newPricing, changeType, reset, metering.currentUsage(current.get(), clock.instant()));
            return true;
        } catch (SubscriptionValidationException ex) {
            log.debug("Plan change not allowed: subscriber={}, newPlanId={}, reason={}", subscriber, newPlanId, ex.getMessage());
            return false;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean canRenew(UUID subscriptionId) {
        return subscriptionRepository.findById(subscriptionId).map(stateMachine::canRenew).orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean canCancel(UUID subscriptionId) {
        return subscriptionRepository.findById(subscriptionId).map(stateMachine::canCancel).orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean canResume(UUID subscriptionId) {
        Instant now = clock.instant();
        return subscriptionRepository.findById(subscriptionId).map(s -> stateMachine.canResume(s, now)).orElse(false);
    }

    // ---- features

    @Override
    @Transactional(readOnly = true)
    public boolean hasFeature(SubscriberRef subscriber, String featureKey) {
        UsageMeteringService.requireValidKey(featureKey);
        return findActive(subscriber).map(s -> metering.hasFeature(s, featureKey)).orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FlexibleValue> getFeatureValue(SubscriberRef subscriber, String featureKey, String locale) {
        UsageMeteringService.requireValidKey(featureKey);
        return findActive(subscriber).flatMap(s -> metering.getFeatureValue(s, featureKey, locale));
    }

    @Override
    @Transactional(readOnly = true)
    public long getFeatureUsage(SubscriberRef subscriber, String featureKey) {
        UsageMeteringService.requireValidKey(featureKey);
        Instant now = clock.instant();
        return findActive(subscriber).map(s -> metering.getFeatureUsage(s, featureKey, now)).orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public OptionalLong getRemainingUsage(SubscriberRef subscriber, String featureKey) {
        UsageMeteringService.requireValidKey(featureKey);
        Instant now = clock.instant();
        Optional<SubscriptionEntity> s = findActive(subscriber);
        return s.isPresent() ? metering.getRemainingUsage(s.get(), featureKey, now) : OptionalLong.empty();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isFeatureExhausted(SubscriberRef subscriber, String featureKey) {
        UsageMeteringService.requireValidKey(featureKey);
        Instant now = clock.instant();
        return findActive(subscriber).map(s -> metering.isFeatureExhausted(s, featureKey, now)).orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean canConsumeFeature(SubscriberRef subscriber, String featureKey, long amount) {
        UsageMeteringService.requireValidKey(featureKey);
        UsageMeteringService.requirePositiveAmount(amount);
        Instant now = clock.instant();
        return findActive(subscriber).map(s -> metering.canConsumeFeature(s, featureKey, amount, now)).orElse(false);
    }

    @Override
    @Transactional
    public boolean consumeFeature(SubscriberRef subscriber, String featureKey, long amount) {
        UsageMeteringService.requireValidKey(featureKey);
        UsageMeteringService.requirePositiveAmount(amount);
        Instant now = clock.instant();
        Optional<SubscriptionEntity> active = findActive(subscriber);
        if (active.isEmpty()) {
            return false;
        }
        SubscriptionEntity s = active.get();
        Consumption consumption = metering.consumeFeature(s, featureKey, amount, now);
        if (!consumption.consumed()) {
            log.debug("Feature consumption rejected: subscriptionId={}, key={}, amount={}, used={}",
                    s.getSubscriptionId(), featureKey, amount, consumption.used());
            return false;
        }
        events.publish(new FeatureUsed(subscriber, SubscriptionSnapshot.of(s), now, featureKey, amount,
                consumption.used(), consumption.remainingOrUnlimited()));
        return true;
    }

    @Override
    @Transactional
    public boolean resetFeature(SubscriberRef subscriber, String featureKey) {
        UsageMeteringService.requireValidKey(featureKey);
        Instant now = clock.instant();
        Optional<SubscriptionEntity> active = findActive(subscriber);
        if (active.isEmpty()) {
            return false;
        }
        SubscriptionEntity s = active.get();
        Optional<Long> previous = metering.resetFeatureUsage(s, featureKey);
        previous.ifPresent(used -> events.publish(
                new FeatureUsageReset(subscriber, SubscriptionSnapshot.of(s), now, featureKey, used)));
        return previous.isPresent();
    }

    @Override
    @Transactional
    public int resetAllFeatures(SubscriberRef subscriber) {
        Instant now = clock.instant();
        Optional<SubscriptionEntity> active = findActive(subscriber);
        if (active.isEmpty()) {
            return 0;
        }
        SubscriptionEntity s = active.get();
        Map<String, Long> previous = metering.resetAllUsages(s);
        SubscriptionSnapshot snapshot = SubscriptionSnapshot.of(s);
        previous.forEach((featureKey, used) ->
                events.publish(new FeatureUsageReset(subscriber, snapshot, now, featureKey, used)));
        log.info("Feature usage reset: subscriptionId={}, subscriber={}, features={}",
                s.getSubscriptionId(), subscriber, previous.keySet());
        return previous.size();
    }

    @Override
    @Transactional(readOnly = true)
    public List<FeatureUsageSummary> usageSummary(SubscriberRef subscriber, String locale) {
        Instant now = clock.instant();
        return findActive(subscriber).map(s -> metering.usageSummary(s, locale, now)).orElse(List.of());
    }

    // ---- internals

    private Optional<SubscriptionEntity> findActive(SubscriberRef subscriber) {
        return subscriptionRepository.findForSubscriber(subscriber.type(), subscriber.id(), SubscriptionStatus.ACTIVE_FAMILY)
                .stream()
                .findFirst();
    }

    private SubscriptionEntity lock(UUID subscriptionId) {
        return subscriptionRepository.findByIdForUpdate(subscriptionId)
                .orElseThrow(() -> new SubscriptionValidationException("Subscription not found: " + subscriptionId));
    }

    private SubscriptionEntity newSubscription(SubscriberRef subscriber,
                                               PlanEntity plan,
                                               PlanPricingEntity pricing,
                                               int trialDays,
                                               Instant now) {
        SubscriptionEntity s = new SubscriptionEntity();
        s.setSubscriber(subscriber);
        s.setPlanId(plan.getPlanId());
        s.setPlanPricingId(pricing.getPlanPricingId());
        s.setStartsAt(now);
        s.setEndsAt(pricing.isLifetime() ? null : now.plus(pricing.getDurationInDays(), ChronoUnit.DAYS));
        s.setGraceEndsAt(stateMachine.graceEndFor(s.getEndsAt()));
        s.setTrialEndsAt(trialDays > 0 ? now.plus(trialDays, ChronoUnit.DAYS) : null);
        s.setStatus(trialDays > 0 ? SubscriptionStatus.TRIAL : SubscriptionStatus.ACTIVE);
        s.setAutoRenewal(props.autoRenewalDefault());
        s.setCreatedAt(now);
        s.setUpdatedAt(now);
        return s;
    }

    private SubscriptionEntity insert(SubscriptionEntity s, Instant now) {
        stateMachine.validateNew(s, now);
        try {
            return subscriptionRepository.saveAndFlush(s);
        } catch (DataIntegrityViolationException ex) {
            throw new SubscriptionValidationException("Subscriber already has an active subscription: " + s.getSubscriber(), ex);
        }
    }

    private void flush(SubscriptionEntity s) {
        stateMachine.validateState(s);
        try {
            subscriptionRepository.saveAndFlush(s);
        } catch (DataIntegrityViolationException ex) {
            throw new SubscriptionValidationException("Subscriber already has an active subscription: " + s.getSubscriber(), ex);
        }
    }

    private void renewLocked(SubscriptionEntity s, Instant now, boolean automatic) {
        PlanPricingEntity pricing = planCatalog.getPricing(s.getPlanPricingId());
        SubscriptionSnapshot before = SubscriptionSnapshot.of(s);
        billingHooks.forEach(hook -> hook.beforeRenewal(before, pricing, automatic));

        Instant previousEndsAt = s.getEndsAt();
        stateMachine.renew(s, pricing, now);
        flush(s);

        SubscriptionSnapshot after = SubscriptionSnapshot.of(s);
        billingHooks.forEach(hook -> hook.afterRenewal(after, pricing, automatic));
        log.info("Subscription renewed: subscriptionId={}, subscriber={}, planId={}, automatic={}, endsAt={}",
                s.getSubscriptionId(), s.getSubscriber(), s.getPlanId(), automatic, s.getEndsAt());
        events.publish(new SubscriptionRenewed(s.getSubscriber(), after, now, automatic, previousEndsAt));
    }

    private void expireLocked(SubscriptionEntity s, Instant now) {
        boolean wasInGrace = stateMachine.expire(s, now);
        subscriptionRepository.save(s);
        log.info("Subscription expired: subscriptionId={}, subscriber={}, planId={}, wasInGrace={}",
                s.getSubscriptionId(), s.getSubscriber(), s.getPlanId(), wasInGrace);
        events.publish(new SubscriptionExpired(s.getSubscriber(), SubscriptionSnapshot.of(s), now, wasInGrace));
    }

    private void publishStart(SubscriptionSnapshot snapshot, int trialDays, boolean resumed, Instant now) {
        if (trialDays > 0) {
            events.publish(new TrialStarted(snapshot.subscriber(), snapshot, now, trialDays));
        } else {
            events.publish(new SubscriptionStarted(snapshot.subscriber(), snapshot, now, resumed));
        }
    }

    private static boolean isOverdue(SubscriptionEntity s, Instant now) {
        if (s.getGraceEndsAt() != null) {
            return s.getGraceEndsAt().isBefore(now);
        }
        return s.getEndsAt() != null && s.getEndsAt().isBefore(now);
    }

    /**
     * Cost of switching for the days left on the current period, in the default currency:
     * new daily rate minus old daily rate, times the remaining days.
     */
    private BigDecimal proration(SubscriptionEntity current,
                                 PlanPricingEntity oldPricing,
                                 PlanPricingEntity newPricing,
                                 Instant now) {
        long daysRemaining = stateMachine.daysRemaining(current, now).orElse(0L);
        if (daysRemaining <= 0 || oldPricing.isLifetime() || newPricing.isLifetime()) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal oldDaily = oldPricing.defaultPrice()
                .divide(BigDecimal.valueOf(oldPricing.getDurationInDays()), MathContext.DECIMAL64);
        BigDecimal newDaily = newPricing.defaultPrice()
                .divide(BigDecimal.valueOf(newPricing.getDurationInDays()), MathContext.DECIMAL64);
        return newDaily.subtract(oldDaily)
                .multiply(BigDecimal.valueOf(daysRemaining))
                .setScale(2, RoundingMode.HALF_UP);
    }
}
